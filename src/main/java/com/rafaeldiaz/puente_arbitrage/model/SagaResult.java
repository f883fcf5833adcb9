package com.rafaeldiaz.puente_arbitrage.model;

import java.time.Duration;

/**
 * 🧾 Resultado final de una saga cross-chain. Es el {@link ExecutionOutcome} que ve el coordinador.
 */
public record SagaResult(
        String sagaId,
        String opportunityId,
        String token,
        String route,
        SagaStage stage,
        FailureKind failureKind,     // null si SOLD
        double tradeSizeUsd,
        TxReceipt buyReceipt,
        BridgeTransfer bridgeTransfer,
        TxReceipt sellReceipt,
        double netProfitUsd,         // Solo significativo en SOLD
        double realizedLossUsd,      // Gas + fees perdidos en caso de fallo
        String message,
        boolean simulated,           // Dry-run: plan validado sin mover fondos
        Duration elapsed
) implements ExecutionOutcome {

    @Override
    public boolean success() {
        return stage == SagaStage.SOLD || simulated;
    }

    @Override
    public double profitUsd() {
        return stage == SagaStage.SOLD ? netProfitUsd : -realizedLossUsd;
    }

    public boolean stranded() {
        return stage == SagaStage.STRANDED_FUNDS;
    }
}
