package com.rafaeldiaz.puente_arbitrage.model;

public enum BridgeStatus {
    PENDING,
    COMPLETED,
    FAILED
}
