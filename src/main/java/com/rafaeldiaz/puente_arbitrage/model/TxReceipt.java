package com.rafaeldiaz.puente_arbitrage.model;

/**
 * 📦 Recibo de una transacción confirmada (o revertida) en una cadena.
 */
public record TxReceipt(
        String txHash,
        String chain,
        boolean success,
        long gasUsed,
        double effectiveGasPriceGwei,
        double outputAmount,        // Tokens entregados a la billetera (0 si no aplica)
        String revertReason
) {

    public static TxReceipt failed(String chain, String txHash, String reason) {
        return new TxReceipt(txHash, chain, false, 0, 0.0, 0.0, reason);
    }

    /**
     * 💰 Costo de gas en USD dado el precio del activo nativo.
     */
    public double gasCostUsd(double nativePriceUsd) {
        return gasUsed * effectiveGasPriceGwei * 1e-9 * nativePriceUsd;
    }
}
