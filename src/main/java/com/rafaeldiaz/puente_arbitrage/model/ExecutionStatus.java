package com.rafaeldiaz.puente_arbitrage.model;

public enum ExecutionStatus {
    QUEUED,
    EXECUTING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    ABANDONED;

    public boolean isTerminal() {
        return this != QUEUED && this != EXECUTING;
    }
}
