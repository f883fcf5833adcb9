package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Taxonomía de fallos. Todos viajan como resultados estructurados, nunca como excepciones.
 */
public enum FailureKind {
    BLOCKED(false),                    // Lock ocupado: política, no error
    FILTERED(false),                   // Vieja, duplicada, poco rentable o lenta
    FUNDING_FAILURE(false),            // Sin saldo convertible o conversión fallida
    BUY_FAILURE(false),
    BRIDGE_INITIATION_FAILURE(false),  // Fondos siguen en la cadena origen
    BRIDGE_TIMEOUT(true),              // Fondos en vuelo, resultado desconocido
    STRANDED_FUNDS(true),              // Venta fallida tras el puente (toda venta ocurre tras el puente)
    RISK_HALT(false),                  // Veto sistémico del circuit breaker
    UNEXPECTED(false);

    private final boolean requiresRecovery;

    FailureKind(boolean requiresRecovery) {
        this.requiresRecovery = requiresRecovery;
    }

    /** true si hay capital fuera de la cadena origen que necesita reconciliación. */
    public boolean requiresRecovery() {
        return requiresRecovery;
    }
}
