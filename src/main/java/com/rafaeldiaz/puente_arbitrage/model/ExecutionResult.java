package com.rafaeldiaz.puente_arbitrage.model;

import java.time.Duration;

/**
 * Lo que devuelve {@code ExecutionCoordinator.execute}. Nunca una excepción.
 */
public record ExecutionResult(
        String executionId,
        String initiator,
        boolean blocked,
        ExecutionStatus status,
        ExecutionOutcome outcome,   // null si bloqueado, expirado o con error
        String error,
        Duration duration
) {

    public static ExecutionResult blocked(String initiator) {
        return new ExecutionResult(null, initiator, true, null, null,
                "Ejecución bloqueada: ya hay un trade en curso", Duration.ZERO);
    }

    public boolean success() {
        return !blocked && status == ExecutionStatus.SUCCEEDED;
    }
}
