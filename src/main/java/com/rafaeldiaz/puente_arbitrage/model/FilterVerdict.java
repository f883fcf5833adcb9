package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Veredicto del filtro. Efímero, derivado de la oportunidad y del estado de perfiles de venue.
 */
public record FilterVerdict(
        String opportunityId,
        boolean shouldExecute,
        String reason,
        double priorityScore,              // [0, 1]
        double estimatedExecutionSeconds,
        double profitDecayFactor,
        double adjustedProfitUsd
) {

    public static FilterVerdict reject(String opportunityId, String reason, double executionSeconds,
                                       double decayFactor, double adjustedProfitUsd) {
        return new FilterVerdict(opportunityId, false, reason, 0.0, executionSeconds, decayFactor, adjustedProfitUsd);
    }
}
