package com.rafaeldiaz.puente_arbitrage.core.orchestrator;

import com.rafaeldiaz.puente_arbitrage.connect.ChainClient;
import com.rafaeldiaz.puente_arbitrage.connect.ChainDirectory;
import com.rafaeldiaz.puente_arbitrage.connect.ChainException;
import com.rafaeldiaz.puente_arbitrage.core.analysis.ProfitabilityGate;
import com.rafaeldiaz.puente_arbitrage.core.scanner.OpportunityFilter;
import com.rafaeldiaz.puente_arbitrage.execution.RiskGovernor;
import com.rafaeldiaz.puente_arbitrage.execution.StrandedFundsLedger;
import com.rafaeldiaz.puente_arbitrage.model.DecisionReport;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionOutcome;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionResult;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionStatusReport;
import com.rafaeldiaz.puente_arbitrage.model.FailureKind;
import com.rafaeldiaz.puente_arbitrage.model.FilterVerdict;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;
import com.rafaeldiaz.puente_arbitrage.model.ProfitabilityVerdict;
import com.rafaeldiaz.puente_arbitrage.model.RiskStatus;
import com.rafaeldiaz.puente_arbitrage.model.SagaResult;
import com.rafaeldiaz.puente_arbitrage.model.StrandedPosition;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 🎻 MOTOR DE ARBITRAJE (Director de Orquesta)
 * filtro → compuerta de gas → gobernador de riesgo → coordinador → saga → registro del resultado.
 * Es la única puerta de entrada a la ejecución.
 */
public class ArbitrageEngine {

    private static final String INITIATOR = "decision-loop";

    private final OpportunityFilter filter;
    private final ProfitabilityGate gate;
    private final RiskGovernor risk;
    private final ExecutionCoordinator coordinator;
    private final ExecutionCallback saga;
    private final ChainDirectory chains;
    private final StrandedFundsLedger ledger;

    private SchedulerManager scheduler;

    public ArbitrageEngine(OpportunityFilter filter, ProfitabilityGate gate, RiskGovernor risk,
                           ExecutionCoordinator coordinator, ExecutionCallback saga, ChainDirectory chains,
                           StrandedFundsLedger ledger) {
        this.filter = filter;
        this.gate = gate;
        this.risk = risk;
        this.coordinator = coordinator;
        this.saga = saga;
        this.chains = chains;
        this.ledger = ledger;
    }

    /** El scheduler se detiene junto con el motor. */
    public void attachScheduler(SchedulerManager scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Decide sobre un lote: ejecuta como mucho UNA oportunidad (la de mayor prioridad que pase la compuerta de gas).
     */
    public DecisionReport submitOpportunities(List<Opportunity> batch) {
        Map<String, Opportunity> byId = new HashMap<>();
        for (Opportunity opp : batch) byId.put(opp.id(), opp);

        // 1. RANKING
        List<FilterVerdict> ranked = filter.rank(batch);

        // 2. COMPUERTA DE GAS (en orden de prioridad)
        List<String> unprofitable = new ArrayList<>();
        Opportunity selected = null;
        for (FilterVerdict verdict : ranked) {
            Opportunity opp = byId.get(verdict.opportunityId());
            ProfitabilityVerdict pv = checkProfitability(opp);
            if (pv != null && pv.profitable()) {
                selected = opp;
                BotLogger.info("💎 Seleccionada " + opp.id() + " | " + pv.reason());
                break;
            }
            unprofitable.add(opp.id());
        }
        if (selected == null) {
            return new DecisionReport(batch.size(), ranked, unprofitable, false, null, null);
        }

        // 3. RIESGO (antes del lock: un trade condenado no consume el único slot)
        if (!risk.permits()) {
            return new DecisionReport(batch.size(), ranked, unprofitable, true, selected.id(), null);
        }

        // 4. EJECUCIÓN SERIALIZADA
        ExecutionResult result = coordinator.execute(saga, selected, INITIATOR);
        if (!result.blocked()) {
            recordOutcome(result);
        }
        return new DecisionReport(batch.size(), ranked, unprofitable, false, selected.id(), result);
    }

    public ExecutionStatusReport getExecutionStatus() {
        return coordinator.getStatus();
    }

    public RiskStatus getRiskStatus() {
        return risk.status();
    }

    /**
     * Detiene tareas de fondo, da un periodo de gracia a la saga en vuelo y reporta lo varado.
     */
    public List<StrandedPosition> shutdown() {
        return shutdown(Duration.ofMillis(BotConfig.SHUTDOWN_GRACE_MS));
    }

    public List<StrandedPosition> shutdown(Duration grace) {
        BotLogger.info("🛑 Apagando motor de arbitraje...");
        if (scheduler != null) scheduler.stop();
        boolean clean = coordinator.shutdown(grace);
        if (!clean) {
            BotLogger.alert("Apagado con una saga aún en curso: revisar posiciones manualmente.");
        }
        List<StrandedPosition> stranded = ledger.unresolved();
        if (stranded.isEmpty()) {
            BotLogger.info("✅ Sin fondos varados al apagar.");
        } else {
            BotLogger.alert(stranded.size() + " posiciones varadas pendientes de reconciliación al apagar.");
        }
        return stranded;
    }

    // =========================================================================
    // 🕵️ HELPERS
    // =========================================================================

    private ProfitabilityVerdict checkProfitability(Opportunity opp) {
        try {
            ChainClient client = chains.client(opp.sourceChain());
            ProfitabilityVerdict pv = gate.isProfitable(opp, client.getGasPriceGwei(), client.chainClass());
            if (!pv.profitable()) BotLogger.info("⛽ Descartada " + opp.id() + " | " + pv.reason());
            return pv;
        } catch (ChainException e) {
            BotLogger.warn("⚠️ Sin precio de gas para " + opp.sourceChain() + ": " + e.getMessage());
            return null;
        }
    }

    private void recordOutcome(ExecutionResult result) {
        ExecutionOutcome outcome = result.outcome();
        if (outcome == null) {
            // Timeout o excepción: fallo sin PnL conocido
            outcome = ExecutionOutcome.of(false, 0.0, result.error());
        }
        // Los descartes no son fallos de ejecución
        if (outcome instanceof SagaResult && ((SagaResult) outcome).failureKind() == FailureKind.FILTERED) {
            return;
        }
        risk.record(outcome);
    }
}
