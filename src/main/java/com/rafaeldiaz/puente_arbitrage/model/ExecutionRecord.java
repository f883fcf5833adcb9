package com.rafaeldiaz.puente_arbitrage.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Registro de una ejecución mientras vive en el coordinador. Luego se pliega a las estadísticas
 * y queda en el historial acotado.
 */
public record ExecutionRecord(
        String id,
        String initiator,
        Opportunity opportunity,
        ExecutionStatus status,
        Instant startedAt,
        Instant finishedAt,
        ExecutionOutcome outcome
) {

    public static ExecutionRecord executing(String id, String initiator, Opportunity opportunity, Instant startedAt) {
        return new ExecutionRecord(id, initiator, opportunity, ExecutionStatus.EXECUTING, startedAt, null, null);
    }

    public ExecutionRecord finish(ExecutionStatus finalStatus, Instant at, ExecutionOutcome result) {
        return new ExecutionRecord(id, initiator, opportunity, finalStatus, startedAt, at, result);
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, finishedAt != null ? finishedAt : now);
    }
}
