package com.rafaeldiaz.puente_arbitrage.model;

import java.util.List;

public record ExecutionStatusReport(
        boolean lockHeld,
        List<ExecutionRecord> active,
        ExecutionStats stats,
        List<ExecutionRecord> history
) {}
