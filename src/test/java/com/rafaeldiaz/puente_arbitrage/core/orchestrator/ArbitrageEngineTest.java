package com.rafaeldiaz.puente_arbitrage.core.orchestrator;

import com.rafaeldiaz.puente_arbitrage.connect.ChainClient;
import com.rafaeldiaz.puente_arbitrage.connect.ChainDirectory;
import com.rafaeldiaz.puente_arbitrage.connect.ChainException;
import com.rafaeldiaz.puente_arbitrage.connect.RetryPolicy;
import com.rafaeldiaz.puente_arbitrage.core.analysis.ProfitabilityGate;
import com.rafaeldiaz.puente_arbitrage.core.scanner.OpportunityFilter;
import com.rafaeldiaz.puente_arbitrage.execution.RiskGovernor;
import com.rafaeldiaz.puente_arbitrage.execution.StrandedFundsLedger;
import com.rafaeldiaz.puente_arbitrage.model.ChainClass;
import com.rafaeldiaz.puente_arbitrage.model.DecisionReport;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionOutcome;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionStatus;
import com.rafaeldiaz.puente_arbitrage.model.FailureKind;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;
import com.rafaeldiaz.puente_arbitrage.model.SagaResult;
import com.rafaeldiaz.puente_arbitrage.model.SagaStage;
import com.rafaeldiaz.puente_arbitrage.model.StrandedPosition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ArbitrageEngineTest {

    @Mock private ChainClient arbitrum;
    @Mock private ChainClient ethereum;

    private RiskGovernor risk;
    private ExecutionCoordinator coordinator;
    private StrandedFundsLedger ledger;
    private ChainDirectory chains;

    @BeforeEach
    void setUp() {
        when(arbitrum.chain()).thenReturn("arbitrum");
        when(arbitrum.chainClass()).thenReturn(ChainClass.CHEAP);
        when(arbitrum.getGasPriceGwei()).thenReturn(0.05);
        when(ethereum.chain()).thenReturn("ethereum");
        when(ethereum.chainClass()).thenReturn(ChainClass.EXPENSIVE);
        when(ethereum.getGasPriceGwei()).thenReturn(70.0);

        chains = new ChainDirectory(RetryPolicy.none()).register(arbitrum).register(ethereum);
        risk = new RiskGovernor(5, 100.0, LocalTime.MIDNIGHT, Clock.systemUTC(), null);
        coordinator = new ExecutionCoordinator(Duration.ofSeconds(2), 10, Clock.systemUTC());
        ledger = StrandedFundsLedger.inMemory();
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown(Duration.ofMillis(200));
    }

    private ArbitrageEngine engine(ExecutionCallback saga) {
        return new ArbitrageEngine(new OpportunityFilter(Clock.systemUTC()), new ProfitabilityGate(0.25, 2500.0),
                risk, coordinator, saga, chains, ledger);
    }

    private static Opportunity opp(String id, String token, String chain, double profit) {
        return Opportunity.builder()
                .id(id)
                .token(token)
                .sourceChain(chain)
                .targetChain("optimism")
                .buyVenue("sushiswap")
                .sellVenue("uniswap_v3")
                .discoveredAt(Instant.now())
                .estimatedProfitUsd(profit)
                .build();
    }

    private static SagaResult sagaResult(String oppId, SagaStage stage, FailureKind kind, double net, double loss) {
        return new SagaResult("saga_x", oppId, "ARB", "arbitrum->optimism", stage, kind, 40.0,
                null, null, null, net, loss, "test", false, Duration.ZERO);
    }

    @Test
    @DisplayName("🎻 Se ejecuta solo la de mayor prioridad y el resultado llega al riesgo")
    void executesHighestPriorityAndRecordsOutcome() {
        AtomicInteger calls = new AtomicInteger();
        ArbitrageEngine engine = engine(o -> {
            calls.incrementAndGet();
            return sagaResult(o.id(), SagaStage.SOLD, null, 3.5, 0.0);
        });

        DecisionReport report = engine.submitOpportunities(List.of(
                opp("small", "ARB", "arbitrum", 12.0),
                opp("big", "OP", "arbitrum", 45.0)));

        assertEquals(1, calls.get());
        assertEquals("big", report.selectedOpportunityId());
        assertTrue(report.executed());
        assertEquals(ExecutionStatus.SUCCEEDED, report.execution().status());
        assertEquals(1, engine.getRiskStatus().recordedOutcomes());
        assertEquals(3.5, engine.getRiskStatus().totalProfitUsd(), 1e-9);
        assertEquals(1, engine.getExecutionStatus().stats().succeeded());
        assertTrue(report.failureKind().isEmpty());
    }

    @Test
    @DisplayName("⛽ La compuerta de gas descarta en orden y pasa a la siguiente")
    void unprofitableAfterGasFallsThrough() {
        ArbitrageEngine engine = engine(o -> sagaResult(o.id(), SagaStage.SOLD, null, 1.0, 0.0));

        // En ethereum a 70 gwei el gas ($35) se come los $45
        DecisionReport report = engine.submitOpportunities(List.of(
                opp("eth", "OP", "ethereum", 45.0),
                opp("arb", "ARB", "arbitrum", 12.0)));

        assertEquals(List.of("eth"), report.unprofitable());
        assertEquals("arb", report.selectedOpportunityId());
    }

    @Test
    @DisplayName("📡 Sin precio de gas la oportunidad se descarta sin ejecutar")
    void gasPriceFailureSkipsOpportunity() {
        when(arbitrum.getGasPriceGwei()).thenThrow(new ChainException("arbitrum", "rpc caído", false));
        ExecutionCallback saga = mock(ExecutionCallback.class);
        ArbitrageEngine engine = engine(saga);

        DecisionReport report = engine.submitOpportunities(List.of(opp("a", "ARB", "arbitrum", 20.0)));

        assertNull(report.selectedOpportunityId());
        assertTrue(report.executionResult().isEmpty());
        verifyNoInteractions(saga);
    }

    @Test
    @DisplayName("⛔ Con el riesgo detenido no se pide el lock")
    void riskHaltSkipsExecution() throws Exception {
        for (int i = 0; i < 5; i++) risk.record(ExecutionOutcome.of(false, -0.1, "fallo"));
        ExecutionCallback saga = mock(ExecutionCallback.class);
        ArbitrageEngine engine = engine(saga);

        DecisionReport report = engine.submitOpportunities(List.of(opp("a", "ARB", "arbitrum", 20.0)));

        assertTrue(report.riskHalted());
        assertFalse(report.executed());
        assertEquals(FailureKind.RISK_HALT, report.failureKind().orElseThrow());
        verify(saga, never()).execute(any());
        assertEquals(0, coordinator.stats().total());
    }

    @Test
    @DisplayName("⏭️ Los descartes de la saga no cuentan como fallos para el disyuntor")
    void filteredSagaIsNotRecorded() {
        ArbitrageEngine engine = engine(o -> sagaResult(o.id(), SagaStage.FAILED, FailureKind.FILTERED, 0.0, 0.0));

        engine.submitOpportunities(List.of(opp("a", "ARB", "arbitrum", 20.0)));

        assertEquals(0, engine.getRiskStatus().recordedOutcomes());
    }

    @Test
    @DisplayName("🧊 Una saga varada suma su pérdida al riesgo")
    void strandedSagaRecordsLoss() {
        ArbitrageEngine engine = engine(o -> sagaResult(o.id(), SagaStage.STRANDED_FUNDS,
                FailureKind.STRANDED_FUNDS, 0.0, 0.35));

        DecisionReport report = engine.submitOpportunities(List.of(opp("a", "ARB", "arbitrum", 20.0)));

        assertEquals(0.35, engine.getRiskStatus().dailyLossUsd(), 1e-9);
        assertTrue(report.requiresRecovery());
        assertEquals(1, engine.getRiskStatus().consecutiveFailures());
    }

    @Test
    @DisplayName("💥 Una excepción del callback cuenta como fallo sin PnL")
    void callbackCrashIsRecordedAsFailure() {
        ArbitrageEngine engine = engine(o -> {
            throw new IllegalStateException("boom");
        });

        DecisionReport report = engine.submitOpportunities(List.of(opp("a", "ARB", "arbitrum", 20.0)));

        assertEquals(ExecutionStatus.FAILED, report.execution().status());
        assertEquals(1, engine.getRiskStatus().consecutiveFailures());
        assertEquals(0.0, engine.getRiskStatus().dailyLossUsd(), 1e-9);
    }

    @Test
    @DisplayName("🛑 Apagado: reporta las posiciones varadas sin resolver")
    void shutdownReportsStrandedPositions() {
        ledger.record(new StrandedPosition("saga_1", "a", "ARB", "arbitrum", "optimism", "optimism", 99.9,
                FailureKind.BRIDGE_TIMEOUT, 0.35, "stargate", "0x1", Instant.now(), false));
        ArbitrageEngine engine = engine(o -> sagaResult(o.id(), SagaStage.SOLD, null, 1.0, 0.0));

        List<StrandedPosition> open = engine.shutdown(Duration.ofMillis(200));

        assertEquals(1, open.size());
        assertEquals("saga_1", open.get(0).sagaId());
    }
}
