package com.rafaeldiaz.puente_arbitrage.core.orchestrator;

import io.github.cdimascio.dotenv.Dotenv;

import java.time.LocalTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 🧠 CEREBRO DE CONFIGURACIÓN GLOBAL
 * Parámetros de la misión leídos desde .env (o variables de entorno) con valores por defecto.
 * Los componentes reciben sus parámetros por constructor; esta clase solo alimenta los atajos.
 */
public class BotConfig {

    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    // Estado del Seguro
    public static final boolean DRY_RUN = Boolean.parseBoolean(get("BOT_DRY_RUN", "true"));

    // ==========================================
    // 🔎 FILTRO DE OPORTUNIDADES
    // ==========================================
    public static final double MAX_OPPORTUNITY_AGE_SECONDS = getDouble("MAX_OPPORTUNITY_AGE_SECONDS", "15");
    public static final double DUPLICATE_WINDOW_SECONDS = getDouble("DUPLICATE_WINDOW_SECONDS", "5");
    public static final double MIN_PROFIT_AFTER_DECAY = getDouble("MIN_PROFIT_AFTER_DECAY", "1.0");
    public static final double MIN_EXECUTION_SPEED_SCORE = getDouble("MIN_EXECUTION_SPEED_SCORE", "0.3");
    public static final double MAX_ESTIMATED_EXECUTION_SECONDS = getDouble("MAX_ESTIMATED_EXECUTION_SECONDS", "15");
    public static final double MIN_PRIORITY_SCORE = getDouble("MIN_PRIORITY_SCORE", "0.5");

    // ==========================================
    // ⛽ GAS Y RENTABILIDAD
    // ==========================================
    public static final double MIN_PROFIT_USD = getDouble("MIN_PROFIT_USD", "0.25");
    public static final double NATIVE_PRICE_USD = getDouble("NATIVE_PRICE_USD", "2500");

    // ==========================================
    // 💼 TAMAÑO DE POSICIÓN
    // ==========================================
    public static final double MAX_CROSS_CHAIN_TRADE_USD = getDouble("MAX_CROSS_CHAIN_TRADE_USD", "40");
    public static final double TOTAL_CAPITAL_USD = getDouble("TOTAL_CAPITAL_USD", "872");
    public static final double MAX_TRADE_PERCENTAGE = getDouble("MAX_TRADE_PERCENTAGE", "0.75");
    public static final double MIN_TRADE_USD = getDouble("MIN_TRADE_USD", "20");
    public static final double PROFIT_SIZE_MULTIPLIER = getDouble("PROFIT_SIZE_MULTIPLIER", "10");
    public static final double MAX_SLIPPAGE = getDouble("MAX_SLIPPAGE", "0.03");

    // ==========================================
    // 💰 FONDEO JUST-IN-TIME
    // ==========================================
    public static final double GAS_RESERVE_USD = getDouble("GAS_RESERVE_USD", "5.0");
    public static final long BALANCE_CACHE_MS = getLong("BALANCE_CACHE_MS", "30000");
    public static final String CONVERSION_VENUE = get("CONVERSION_VENUE", "uniswap_v3");
    // Orden fijo: menos líquidos primero, los cercanos al nativo al final
    public static final List<String> CONVERSION_PRIORITY = parseList("CONVERSION_PRIORITY", "DAI,USDT,USDC,WBTC,WETH");
    public static final Map<String, Double> MIN_RESERVES_USD = parseMap("MIN_RESERVES_USD", "DAI:10,USDT:10,USDC:10,WBTC:20,WETH:20");

    // ==========================================
    // 🛡️ RIESGO
    // ==========================================
    public static final int CB_MAX_CONSECUTIVE_FAILURES = Integer.parseInt(get("CB_MAX_CONSECUTIVE_FAILURES", "5"));
    public static final double MAX_DAILY_LOSS_USD = getDouble("MAX_DAILY_LOSS_USD", "100");
    public static final LocalTime DAILY_RESET_TIME = LocalTime.parse(get("DAILY_RESET_TIME", "00:00"));
    public static final String RISK_STATE_FILE = get("RISK_STATE_FILE", "risk_state.json");
    public static final String STRANDED_LEDGER_FILE = get("STRANDED_LEDGER_FILE", "stranded_funds.json");

    // ==========================================
    // 🚦 COORDINACIÓN Y TIEMPOS
    // ==========================================
    public static final long EXECUTION_TIMEOUT_MS = getLong("EXECUTION_TIMEOUT_MS", "300000");
    public static final int EXECUTION_HISTORY_SIZE = Integer.parseInt(get("EXECUTION_HISTORY_SIZE", "100"));
    public static final long RECEIPT_TIMEOUT_MS = getLong("RECEIPT_TIMEOUT_MS", "120000");
    public static final long BRIDGE_POLL_INTERVAL_MS = getLong("BRIDGE_POLL_INTERVAL_MS", "5000");
    public static final long BRIDGE_QUOTE_TTL_MS = getLong("BRIDGE_QUOTE_TTL_MS", "600000");

    // Reintentos RPC (solo lecturas)
    public static final long RPC_RETRY_BASE_MS = getLong("RPC_RETRY_BASE_MS", "500");
    public static final int RPC_RETRY_MAX_ATTEMPTS = Integer.parseInt(get("RPC_RETRY_MAX_ATTEMPTS", "3"));

    // ==========================================
    // ⏰ TAREAS DE FONDO
    // ==========================================
    public static final long SCAN_INTERVAL_MS = getLong("SCAN_INTERVAL_MS", "2000");
    public static final long BRIDGE_REFRESH_MS = getLong("BRIDGE_REFRESH_MS", "600000");
    public static final long PENDING_WATCH_MS = getLong("PENDING_WATCH_MS", "60000");
    public static final long REPORT_INTERVAL_MS = getLong("REPORT_INTERVAL_MS", "300000");
    public static final long SHUTDOWN_GRACE_MS = getLong("SHUTDOWN_GRACE_MS", "30000");

    private static String get(String key, String defaultVal) {
        String val = dotenv.get(key, defaultVal);
        return val == null ? defaultVal : val.trim();
    }

    private static double getDouble(String key, String defaultVal) {
        return Double.parseDouble(get(key, defaultVal));
    }

    private static long getLong(String key, String defaultVal) {
        return Long.parseLong(get(key, defaultVal));
    }

    // Helper para evitar errores de null en split
    private static List<String> parseList(String key, String defaultVal) {
        String val = get(key, defaultVal);
        if (val.isEmpty()) return Collections.emptyList();
        return Arrays.stream(val.split("\\s*,\\s*"))
                .map(String::toUpperCase)
                .collect(Collectors.toUnmodifiableList());
    }

    // Formato "ACTIVO:USD,ACTIVO:USD"
    private static Map<String, Double> parseMap(String key, String defaultVal) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String entry : parseList(key, defaultVal)) {
            String[] kv = entry.split(":");
            if (kv.length == 2) out.put(kv[0].trim(), Double.parseDouble(kv[1].trim()));
        }
        return Collections.unmodifiableMap(out);
    }
}
