package com.rafaeldiaz.puente_arbitrage.model;

public record BridgeQuote(
        String bridge,
        String sourceChain,
        String targetChain,
        String token,
        double amount,
        double feeUsd,
        double feePercent,          // 0.05 = 0.05%
        double estimatedSeconds,
        double expectedAmountOut
) {}
