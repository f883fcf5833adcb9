package com.rafaeldiaz.puente_arbitrage.model;

import java.util.List;
import java.util.Optional;

/**
 * 📋 Lo que decidió el motor sobre un lote de oportunidades.
 */
public record DecisionReport(
        int received,
        List<FilterVerdict> executable,
        List<String> unprofitable,       // Ids descartados por la compuerta de gas
        boolean riskHalted,
        String selectedOpportunityId,
        ExecutionResult execution        // null si no se intentó ejecutar
) {

    public DecisionReport {
        executable = List.copyOf(executable);
        unprofitable = List.copyOf(unprofitable);
    }

    public Optional<ExecutionResult> executionResult() {
        return Optional.ofNullable(execution);
    }

    public boolean executed() {
        return execution != null && !execution.blocked();
    }

    /**
     * Motivo por el que el lote no terminó en un trade exitoso, si lo hubo.
     */
    public Optional<FailureKind> failureKind() {
        if (riskHalted) return Optional.of(FailureKind.RISK_HALT);
        if (selectedOpportunityId == null) return Optional.of(FailureKind.FILTERED);
        if (execution == null || execution.success()) return Optional.empty();
        if (execution.blocked()) return Optional.of(FailureKind.BLOCKED);
        if (execution.outcome() instanceof SagaResult) {
            return Optional.ofNullable(((SagaResult) execution.outcome()).failureKind());
        }
        return Optional.of(FailureKind.UNEXPECTED);
    }

    /** true si el trade dejó capital fuera de la cadena origen. */
    public boolean requiresRecovery() {
        return failureKind().map(FailureKind::requiresRecovery).orElse(false);
    }
}
