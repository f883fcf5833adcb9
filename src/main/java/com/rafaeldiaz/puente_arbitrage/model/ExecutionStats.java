package com.rafaeldiaz.puente_arbitrage.model;

public record ExecutionStats(
        long total,
        long succeeded,
        long failed,
        long abandoned,
        long lockViolations
) {

    public double successRatePercent() {
        return total > 0 ? (succeeded * 100.0) / total : 0.0;
    }
}
