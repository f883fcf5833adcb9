package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Clase de operación para estimar unidades de gas.
 */
public enum OperationType {
    SAME_CHAIN(150_000),
    CROSS_CHAIN(200_000),
    FLASHLOAN(300_000),
    COMPLEX(400_000);

    private final long gasUnits;

    OperationType(long gasUnits) {
        this.gasUnits = gasUnits;
    }

    public long gasUnits() {
        return gasUnits;
    }
}
