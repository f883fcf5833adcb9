package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Resultado de {@code ensureFunds}.
 */
public record FundingResult(
        boolean sufficient,
        boolean conversionExecuted,
        String details,
        ConversionPlan plan
) {}
