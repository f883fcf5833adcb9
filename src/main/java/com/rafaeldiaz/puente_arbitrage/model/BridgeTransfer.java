package com.rafaeldiaz.puente_arbitrage.model;

/**
 * 🌉 Transferencia de puente iniciada por la saga.
 */
public record BridgeTransfer(
        String bridge,
        String transferId,          // Hash de la tx en la cadena origen
        String sourceChain,
        String targetChain,
        String token,
        double amountSent,
        double feeUsd,
        TxReceipt sourceReceipt,
        BridgeStatus status,
        double amountReceived
) {

    public BridgeTransfer withCompletion(BridgeCompletion completion) {
        return new BridgeTransfer(bridge, transferId, sourceChain, targetChain, token, amountSent, feeUsd,
                sourceReceipt, completion.status(), completion.amountReceived());
    }
}
