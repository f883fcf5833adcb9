package com.rafaeldiaz.puente_arbitrage.model;

public record BridgeCompletion(BridgeStatus status, double amountReceived, String destinationTxHash) {

    public static BridgeCompletion pending() {
        return new BridgeCompletion(BridgeStatus.PENDING, 0.0, null);
    }
}
