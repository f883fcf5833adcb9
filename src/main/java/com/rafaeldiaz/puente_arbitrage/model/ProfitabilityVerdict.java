package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Veredicto de la compuerta de rentabilidad: ganancia neta tras gas y fee de puente.
 */
public record ProfitabilityVerdict(
        boolean profitable,
        double netProfitUsd,
        GasTier gasTier,
        double gasCostUsd,
        double requiredMinimumUsd,
        String reason
) {}
