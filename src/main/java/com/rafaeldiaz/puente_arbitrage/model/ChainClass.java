package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Clase de cadena según su costo de gas. Las tablas de cadenas baratas (L2) y caras (mainnet)
 * difieren en unos dos órdenes de magnitud.
 */
public enum ChainClass {

    //          Techos gwei ULTRA_LOW..HIGH          Min profit tras gas ULTRA_LOW..EXTREME    Piso gas USD
    CHEAP(new double[]{0.1, 0.25, 0.5, 1.0},   new double[]{0.05, 0.25, 1.00, 5.00, 5.00},   0.20),
    EXPENSIVE(new double[]{15, 25, 40, 60},    new double[]{0.25, 1.00, 5.00, 20.00, 50.00}, 1.00);

    private final double[] tierCeilingsGwei;
    private final double[] minProfitAfterGas;
    private final double gasCostFloorUsd;

    ChainClass(double[] tierCeilingsGwei, double[] minProfitAfterGas, double gasCostFloorUsd) {
        this.tierCeilingsGwei = tierCeilingsGwei;
        this.minProfitAfterGas = minProfitAfterGas;
        this.gasCostFloorUsd = gasCostFloorUsd;
    }

    public GasTier classify(double gasGwei) {
        GasTier[] tiers = GasTier.values();
        for (int i = 0; i < tierCeilingsGwei.length; i++) {
            if (gasGwei <= tierCeilingsGwei[i]) return tiers[i];
        }
        return GasTier.EXTREME;
    }

    public double minProfitAfterGas(GasTier tier) {
        return minProfitAfterGas[tier.ordinal()];
    }

    /** Costo mínimo de gas en USD (overhead de datos L1, propinas) aunque el gwei sea casi cero. */
    public double gasCostFloorUsd() {
        return gasCostFloorUsd;
    }
}
