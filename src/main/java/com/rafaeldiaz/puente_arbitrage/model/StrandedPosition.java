package com.rafaeldiaz.puente_arbitrage.model;

import java.time.Instant;

/**
 * 🧊 Capital fuera de la cadena origen que requiere reconciliación manual o automática.
 */
public record StrandedPosition(
        String sagaId,
        String opportunityId,
        String token,
        String sourceChain,
        String targetChain,
        String chainHoldingFunds,
        double amount,
        FailureKind kind,
        double lossUsd,
        String bridge,
        String transferId,
        Instant recordedAt,
        boolean resolved
) {

    public StrandedPosition resolve() {
        return new StrandedPosition(sagaId, opportunityId, token, sourceChain, targetChain, chainHoldingFunds,
                amount, kind, lossUsd, bridge, transferId, recordedAt, true);
    }

    public StrandedPosition relocate(String chain, double newAmount, FailureKind newKind) {
        return new StrandedPosition(sagaId, opportunityId, token, sourceChain, targetChain, chain,
                newAmount, newKind, lossUsd, bridge, transferId, recordedAt, resolved);
    }
}
