package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Contrato explícito de resultado que devuelve cualquier callback de ejecución.
 */
public interface ExecutionOutcome {

    boolean success();

    /** PnL neto en USD (negativo = pérdida). */
    double profitUsd();

    String message();

    static ExecutionOutcome of(boolean success, double profitUsd, String message) {
        return new Simple(success, profitUsd, message);
    }

    record Simple(boolean success, double profitUsd, String message) implements ExecutionOutcome {}
}
