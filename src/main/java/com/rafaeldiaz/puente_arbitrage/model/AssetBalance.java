package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Saldo de un activo: cantidad en unidades del token y su valor en USD.
 */
public record AssetBalance(String asset, double amount, double usdValue) {

    public static AssetBalance empty(String asset) {
        return new AssetBalance(asset, 0.0, 0.0);
    }

    /** Precio implícito por unidad; 0 si no hay saldo para inferirlo. */
    public double unitPriceUsd() {
        return amount > 0 ? usdValue / amount : 0.0;
    }
}
