package com.rafaeldiaz.puente_arbitrage.model;

import java.time.LocalDate;

public record RiskStatus(
        boolean permits,
        String haltReason,           // null si opera
        int consecutiveFailures,
        int maxConsecutiveFailures,
        double dailyLossUsd,
        double maxDailyLossUsd,
        LocalDate tradingDay,
        double totalProfitUsd,
        double totalLossUsd,
        long recordedOutcomes
) {}
