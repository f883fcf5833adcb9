package com.rafaeldiaz.puente_arbitrage.model;

/**
 * ⛽ Niveles de precio de gas. Cada {@link ChainClass} define sus propios umbrales.
 */
public enum GasTier {
    ULTRA_LOW,
    LOW,
    MEDIUM,
    HIGH,
    EXTREME
}
