package com.rafaeldiaz.puente_arbitrage.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rafaeldiaz.puente_arbitrage.core.orchestrator.BotConfig;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionOutcome;
import com.rafaeldiaz.puente_arbitrage.model.RiskStatus;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 📉 GOBERNADOR DE RIESGO (Circuit Breaker)
 *
 * RESPONSABILIDAD:
 * 1. Contar fallos consecutivos (cualquier éxito los resetea).
 * 2. Acumular la pérdida del día contable (se reinicia en la frontera diaria configurada).
 * 3. Vetar ejecuciones al tocar cualquiera de los techos, hasta reset manual o cambio de día.
 * 4. Persistir el estado para continuidad tras reinicio.
 */
public class RiskGovernor {

    // Estados del Autómata
    public enum SystemStatus {
        OPERATIONAL,
        HALTED_CONSECUTIVE_FAILURES,  // Requiere reset manual
        HALTED_DAILY_LOSS             // Se levanta solo al cambiar el día contable
    }

    private final int maxConsecutiveFailures;
    private final double maxDailyLossUsd;
    private final LocalTime dailyResetTime;
    private final Clock clock;
    private final File stateFile;
    private final ObjectMapper mapper = new ObjectMapper();

    // --- ESTADO ---
    private SystemStatus status = SystemStatus.OPERATIONAL;
    private int consecutiveFailures = 0;
    private double dailyLossUsd = 0.0;
    private LocalDate tradingDay;
    private double totalProfitUsd = 0.0;
    private double totalLossUsd = 0.0;
    private long recordedOutcomes = 0;

    public RiskGovernor() {
        this(BotConfig.CB_MAX_CONSECUTIVE_FAILURES, BotConfig.MAX_DAILY_LOSS_USD, BotConfig.DAILY_RESET_TIME,
                Clock.systemDefaultZone(), new File(BotConfig.RISK_STATE_FILE));
    }

    /**
     * @param stateFile archivo JSON de estado, o {@code null} para operar solo en memoria
     */
    public RiskGovernor(int maxConsecutiveFailures, double maxDailyLossUsd, LocalTime dailyResetTime,
                        Clock clock, File stateFile) {
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.maxDailyLossUsd = maxDailyLossUsd;
        this.dailyResetTime = dailyResetTime;
        this.clock = clock;
        this.stateFile = stateFile;
        this.tradingDay = currentTradingDay();
        loadState();
    }

    /**
     * ¿Hay autorización para operar? Se consulta ANTES de pedir el lock de ejecución.
     */
    public synchronized boolean permits() {
        rollDayIfNeeded();
        if (status != SystemStatus.OPERATIONAL) {
            BotLogger.warn("⛔ OPERACIÓN DENEGADA. Estatus del Sistema: " + status);
            return false;
        }
        return true;
    }

    public synchronized void record(ExecutionOutcome outcome) {
        rollDayIfNeeded();
        recordedOutcomes++;

        double pnl = outcome.profitUsd();
        if (pnl >= 0) {
            totalProfitUsd += pnl;
        } else {
            totalLossUsd += -pnl;
            dailyLossUsd += -pnl;
        }

        if (outcome.success()) {
            consecutiveFailures = 0;
        } else {
            consecutiveFailures++;
            BotLogger.warn("⚠️ Fallo de ejecución. Strike " + consecutiveFailures + "/" + maxConsecutiveFailures
                    + " | " + outcome.message());
        }

        evaluateLimits();
        saveState();
    }

    /**
     * Intervención humana: limpia el bloqueo y el contador de fallos. La pérdida diaria se mantiene.
     */
    public synchronized void reset() {
        status = SystemStatus.OPERATIONAL;
        consecutiveFailures = 0;
        BotLogger.warn("🔓 INTERVENCIÓN MANUAL: Protocolos de bloqueo restablecidos por operador.");
        saveState();
    }

    public synchronized RiskStatus status() {
        rollDayIfNeeded();
        return new RiskStatus(status == SystemStatus.OPERATIONAL,
                status == SystemStatus.OPERATIONAL ? null : haltReason(),
                consecutiveFailures, maxConsecutiveFailures, dailyLossUsd, maxDailyLossUsd,
                tradingDay, totalProfitUsd, totalLossUsd, recordedOutcomes);
    }

    public synchronized SystemStatus systemStatus() {
        return status;
    }

    // =========================================================
    // 🛑 DISYUNTORES
    // =========================================================

    private void evaluateLimits() {
        if (status != SystemStatus.OPERATIONAL) return;

        if (consecutiveFailures >= maxConsecutiveFailures) {
            status = SystemStatus.HALTED_CONSECUTIVE_FAILURES;
            BotLogger.error("🚨 CIRCUIT BREAKER ACTIVADO: " + consecutiveFailures + " fallos consecutivos. Ejecución detenida.");
        } else if (dailyLossUsd >= maxDailyLossUsd) {
            status = SystemStatus.HALTED_DAILY_LOSS;
            BotLogger.error(String.format("🛑 DISYUNTOR DIARIO ACTIVADO. Pérdida: $%.2f (Límite: $%.2f).",
                    dailyLossUsd, maxDailyLossUsd));
        }
    }

    private void rollDayIfNeeded() {
        LocalDate today = currentTradingDay();
        if (today.equals(tradingDay)) return;

        BotLogger.info("☀️ Nuevo día contable " + today + ". Pérdida diaria anterior: $"
                + String.format("%.2f", dailyLossUsd));
        tradingDay = today;
        dailyLossUsd = 0.0;
        if (status == SystemStatus.HALTED_DAILY_LOSS) {
            status = SystemStatus.OPERATIONAL;
            BotLogger.info("🟢 Disyuntor diario levantado por cambio de día.");
        }
        saveState();
    }

    /** Antes de la hora de corte seguimos en el día contable anterior. */
    private LocalDate currentTradingDay() {
        LocalDateTime now = LocalDateTime.now(clock);
        return now.toLocalTime().isBefore(dailyResetTime) ? now.toLocalDate().minusDays(1) : now.toLocalDate();
    }

    private String haltReason() {
        if (status == SystemStatus.HALTED_CONSECUTIVE_FAILURES) {
            return status + ": " + consecutiveFailures + "/" + maxConsecutiveFailures + " fallos consecutivos";
        }
        return status + String.format(": pérdida diaria $%.2f >= $%.2f", dailyLossUsd, maxDailyLossUsd);
    }

    // =========================================================
    // 💾 CAPA DE PERSISTENCIA (I/O)
    // =========================================================

    private void saveState() {
        if (stateFile == null) return;
        try {
            ObjectNode node = mapper.createObjectNode();
            node.put("tradingDay", tradingDay.toString());
            node.put("status", status.name());
            node.put("consecutiveFailures", consecutiveFailures);
            node.put("dailyLossUsd", dailyLossUsd);
            node.put("totalProfitUsd", totalProfitUsd);
            node.put("totalLossUsd", totalLossUsd);
            node.put("recordedOutcomes", recordedOutcomes);
            mapper.writerWithDefaultPrettyPrinter().writeValue(stateFile, node);
        } catch (IOException e) {
            BotLogger.error("⚠️ Error I/O: No se pudo persistir el estado de riesgo: " + e.getMessage());
        }
    }

    private void loadState() {
        if (stateFile == null || !stateFile.exists()) return;
        try {
            JsonNode node = mapper.readTree(stateFile);
            consecutiveFailures = node.path("consecutiveFailures").asInt(0);
            totalProfitUsd = node.path("totalProfitUsd").asDouble(0.0);
            totalLossUsd = node.path("totalLossUsd").asDouble(0.0);
            recordedOutcomes = node.path("recordedOutcomes").asLong(0);
            SystemStatus saved = SystemStatus.valueOf(node.path("status").asText(SystemStatus.OPERATIONAL.name()));

            if (tradingDay.toString().equals(node.path("tradingDay").asText())) {
                // Mismo día contable: continuidad completa
                dailyLossUsd = node.path("dailyLossUsd").asDouble(0.0);
                status = saved;
                BotLogger.info("🔄 Sesión de riesgo recuperada. Pérdida diaria: $" + String.format("%.2f", dailyLossUsd));
            } else {
                // Nuevo día: el bloqueo por fallos consecutivos sobrevive, el diario no
                dailyLossUsd = 0.0;
                status = saved == SystemStatus.HALTED_CONSECUTIVE_FAILURES ? saved : SystemStatus.OPERATIONAL;
                BotLogger.info("☀️ Inicio de nuevo día contable. Reseteando pérdida diaria.");
                saveState();
            }
        } catch (IOException | IllegalArgumentException e) {
            BotLogger.error("⚠️ Estado de riesgo ilegible. Iniciando con parámetros por defecto: " + e.getMessage());
        }
    }
}
