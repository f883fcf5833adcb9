package com.rafaeldiaz.puente_arbitrage.core.orchestrator;

import com.rafaeldiaz.puente_arbitrage.connect.BridgeProvider;
import com.rafaeldiaz.puente_arbitrage.connect.ChainException;
import com.rafaeldiaz.puente_arbitrage.connect.OpportunityScanner;
import com.rafaeldiaz.puente_arbitrage.core.analysis.BridgeSelector;
import com.rafaeldiaz.puente_arbitrage.execution.StrandedFundsLedger;
import com.rafaeldiaz.puente_arbitrage.model.BridgeCompletion;
import com.rafaeldiaz.puente_arbitrage.model.BridgeStatus;
import com.rafaeldiaz.puente_arbitrage.model.DecisionReport;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionStats;
import com.rafaeldiaz.puente_arbitrage.model.FailureKind;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;
import com.rafaeldiaz.puente_arbitrage.model.RiskStatus;
import com.rafaeldiaz.puente_arbitrage.model.StrandedPosition;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ⏰ TAREAS DE FONDO
 * Escaneo → motor, refresco de costos de puente, vigilancia de puentes vencidos y reporte periódico.
 * Cada iteración atrapa sus propios errores: un fallo nunca mata el ciclo.
 */
public class SchedulerManager {

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "Bot-Scheduler");
        t.setDaemon(true);
        return t;
    });

    private final ArbitrageEngine engine;
    private final OpportunityScanner scanner;
    private final BridgeSelector bridges;
    private final StrandedFundsLedger ledger;

    public SchedulerManager(ArbitrageEngine engine, OpportunityScanner scanner, BridgeSelector bridges,
                            StrandedFundsLedger ledger) {
        this.engine = engine;
        this.scanner = scanner;
        this.bridges = bridges;
        this.ledger = ledger;
        engine.attachScheduler(this);
    }

    public void start() {
        BotLogger.info("⏰ Iniciando tareas de fondo...");
        scheduler.scheduleWithFixedDelay(this::scanAndSubmit, 0, BotConfig.SCAN_INTERVAL_MS, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::refreshBridgeCosts, BotConfig.BRIDGE_REFRESH_MS,
                BotConfig.BRIDGE_REFRESH_MS, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::watchPendingBridges, BotConfig.PENDING_WATCH_MS,
                BotConfig.PENDING_WATCH_MS, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::report, BotConfig.REPORT_INTERVAL_MS,
                BotConfig.REPORT_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        scheduler.shutdown();
        BotLogger.info("⏰ Tareas de fondo detenidas.");
    }

    void scanAndSubmit() {
        try {
            List<Opportunity> batch = scanner.scan();
            if (batch == null || batch.isEmpty()) return;
            DecisionReport report = engine.submitOpportunities(batch);
            if (report.executed()) {
                BotLogger.info("🎯 Ciclo de escaneo: ejecutada " + report.selectedOpportunityId()
                        + " -> " + report.execution().status()
                        + report.failureKind().map(k -> " (" + k + ")").orElse(""));
                if (report.requiresRecovery()) {
                    BotLogger.warn("🧊 Quedan fondos por reconciliar: " + ledger.unresolved().size() + " posiciones abiertas.");
                }
            }
        } catch (RuntimeException e) {
            BotLogger.error("Error en ciclo de escaneo: " + e.getMessage());
        }
    }

    void refreshBridgeCosts() {
        try {
            bridges.refresh();
        } catch (RuntimeException e) {
            BotLogger.error("Error refrescando costos de puente: " + e.getMessage());
        }
    }

    /**
     * Re-consulta los puentes que vencieron sin confirmación. Si los fondos llegaron, la posición
     * pasa a la cadena destino (pendiente de venta); si el puente falló, se alerta de nuevo.
     */
    void watchPendingBridges() {
        for (StrandedPosition p : ledger.pendingBridges()) {
            try {
                Optional<BridgeProvider> provider = bridges.provider(p.bridge());
                if (provider.isEmpty() || p.transferId() == null) continue;
                BridgeCompletion c = provider.get().awaitCompletion(p.sourceChain(), p.transferId());
                if (c.status() == BridgeStatus.COMPLETED) {
                    ledger.update(p.relocate(p.targetChain(), c.amountReceived(), FailureKind.STRANDED_FUNDS));
                    BotLogger.alert("Puente de " + p.sagaId() + " completado tarde: " + c.amountReceived() + " "
                            + p.token() + " en " + p.targetChain() + ", venta manual pendiente.");
                } else if (c.status() == BridgeStatus.FAILED) {
                    ledger.update(p.relocate(p.sourceChain(), p.amount(), FailureKind.STRANDED_FUNDS));
                    BotLogger.alert("Puente de " + p.sagaId() + " falló: fondos esperados de vuelta en " + p.sourceChain());
                }
            } catch (ChainException e) {
                BotLogger.warn("⚠️ Vigilancia de " + p.sagaId() + " falló: " + e.getMessage());
            } catch (RuntimeException e) {
                BotLogger.error("Error vigilando puente de " + p.sagaId() + ": " + e.getMessage());
            }
        }
    }

    void report() {
        try {
            ExecutionStats s = engine.getExecutionStatus().stats();
            RiskStatus r = engine.getRiskStatus();
            BotLogger.info(String.format("📊 REPORTE: %d ejecuciones | %d ok | %d fallidas | %d abandonadas | %d bloqueadas | éxito %.1f%%",
                    s.total(), s.succeeded(), s.failed(), s.abandoned(), s.lockViolations(), s.successRatePercent()));
            BotLogger.info(String.format("🛡️ RIESGO: %s | strikes %d/%d | pérdida diaria $%.2f/$%.2f | varadas %d",
                    r.permits() ? "OPERATIONAL" : r.haltReason(), r.consecutiveFailures(), r.maxConsecutiveFailures(),
                    r.dailyLossUsd(), r.maxDailyLossUsd(), ledger.unresolved().size()));
        } catch (RuntimeException e) {
            BotLogger.error("Error en reporte periódico: " + e.getMessage());
        }
    }
}
