package com.rafaeldiaz.puente_arbitrage.core.orchestrator;

import com.rafaeldiaz.puente_arbitrage.model.ExecutionOutcome;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;

/**
 * Trabajo que el coordinador ejecuta bajo su lock. Cualquier excepción se convierte en un resultado FAILED.
 */
@FunctionalInterface
public interface ExecutionCallback {

    ExecutionOutcome execute(Opportunity opportunity) throws Exception;
}
