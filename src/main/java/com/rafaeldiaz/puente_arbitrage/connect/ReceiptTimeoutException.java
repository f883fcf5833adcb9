package com.rafaeldiaz.puente_arbitrage.connect;

/**
 * ⏳ La transacción salió a la red (hay hash) pero no llegó recibo a tiempo.
 * Su resultado es desconocido: puede minarse después.
 */
public class ReceiptTimeoutException extends ChainException {

    private final String txHash;

    public ReceiptTimeoutException(String chain, String txHash, String message) {
        super(chain, message, true);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
