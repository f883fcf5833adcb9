package com.rafaeldiaz.puente_arbitrage.utils;

import io.github.cdimascio.dotenv.Dotenv;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * 📜 BITÁCORA CENTRAL DEL MOTOR
 * Fachada estática sobre java.util.logging con escritura asíncrona (un solo consumidor),
 * auditoría CSV de sagas y filtros, y alertas a Telegram para incidentes de fondos.
 */
public class BotLogger {

    // 🎨 PALETA ANSI
    public static final String RESET = "\u001B[0m";
    public static final String RED = "\u001B[31m";
    public static final String GREEN = "\u001B[32m";
    public static final String YELLOW = "\u001B[33m";
    public static final String PURPLE = "\u001B[35m";

    private static final Logger logger = Logger.getLogger("PuenteArbitrage");
    private static final String LOG_DIR = "logs";
    private static final String SAGA_FILE = LOG_DIR + "/sagas.csv";
    private static final String OPPORTUNITY_FILE = LOG_DIR + "/opportunities.csv";
    private static final OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(5, TimeUnit.SECONDS)
            .readTimeout(5, TimeUnit.SECONDS)
            .build();
    private static final MediaType JSON = MediaType.parse("application/json");

    private static final Dotenv dotenv = Dotenv.configure()
            .directory(System.getProperty("user.dir"))
            .ignoreIfMissing()
            .load();
    private static final String TOKEN = dotenv.get("TELEGRAM_BOT_TOKEN");
    private static final String CHAT_ID = dotenv.get("TELEGRAM_CHAT_ID");

    private static final BlockingQueue<Runnable> logTasks = new LinkedBlockingQueue<>();
    private static final ExecutorService telegramPool = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "Telegram-Notifier");
        t.setDaemon(true);
        return t;
    });

    static {
        try {
            File dir = new File(LOG_DIR);
            if (!dir.exists()) dir.mkdirs();

            // --- 1. ARCHIVO (texto plano, rotación 10MB x 5) ---
            FileHandler fh = new FileHandler(LOG_DIR + "/bot.log", 10 * 1024 * 1024, 5, true);
            fh.setFormatter(new Formatter() {
                private static final String STANDARD_FORMAT = "[%1$tT] [%2$-7s] %3$s %n";
                @Override
                public synchronized String format(LogRecord lr) {
                    return String.format(STANDARD_FORMAT, new java.util.Date(lr.getMillis()),
                            lr.getLevel().getLocalizedName(), lr.getMessage());
                }
            });
            logger.addHandler(fh);
            logger.setLevel(Level.INFO);
            logger.setUseParentHandlers(false);

            // --- 2. CONSOLA (con colores por nivel) ---
            ConsoleHandler ch = new ConsoleHandler();
            ch.setFormatter(new Formatter() {
                @Override
                public String format(LogRecord lr) {
                    String color = GREEN;
                    if (lr.getLevel() == Level.WARNING) color = YELLOW;
                    if (lr.getLevel() == Level.SEVERE) color = RED;
                    return String.format("%1$s[%2$tT]%3$s %4$s %n",
                            color, new java.util.Date(lr.getMillis()), RESET, lr.getMessage());
                }
            });
            logger.addHandler(ch);

            initCsv(SAGA_FILE, "Timestamp,SagaId,Token,Route,Stage,Failure,NetProfit_Usd,Loss_Usd");
            initCsv(OPPORTUNITY_FILE, "Timestamp,OpportunityId,Token,Route,Priority,AdjustedProfit_Usd,Status,Reason");

            // --- 3. HILO CONSUMIDOR ---
            Thread consumerThread = new Thread(() -> {
                while (true) {
                    try {
                        Runnable task = logTasks.take();
                        task.run();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        break;
                    } catch (RuntimeException e) {
                        System.err.println("Log worker error: " + e.getMessage());
                    }
                }
            });
            consumerThread.setName("Async-Log-Worker");
            consumerThread.setDaemon(true);
            consumerThread.start();

        } catch (IOException e) {
            System.err.println("FATAL LOG ERROR: " + e.getMessage());
        }
    }

    // --- MÉTODOS PÚBLICOS ---

    public static void info(String msg) { logTasks.offer(() -> logger.info(msg)); }
    public static void warn(String msg) { logTasks.offer(() -> logger.warning(msg)); }
    public static void error(String msg) { logTasks.offer(() -> { logger.severe(msg); sendTelegram("🚨 ERROR: " + msg); }); }

    /**
     * Alerta diferenciada para fondos varados o puentes sin confirmar.
     * Siempre sale por consola/archivo; Telegram solo si está configurado.
     */
    public static void alert(String msg) {
        logTasks.offer(() -> {
            logger.severe(PURPLE + "🛑 ALERTA DE FONDOS: " + RESET + msg);
            sendTelegram("🛑 FONDOS: " + msg);
        });
    }

    public static void logSaga(String sagaId, String token, String route, String stage,
                               String failure, double netProfitUsd, double lossUsd) {
        logTasks.offer(() -> {
            String date = LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            try (PrintWriter pw = new PrintWriter(new FileWriter(SAGA_FILE, true))) {
                pw.printf(Locale.US, "%s,%s,%s,%s,%s,%s,%.4f,%.4f%n",
                        date, sagaId, token, route, stage, failure, netProfitUsd, lossUsd);
            } catch (IOException e) { logger.severe("Saga CSV Error: " + e.getMessage()); }
        });
    }

    public static void logOpportunity(String opportunityId, String token, String route, double priority,
                                      double adjustedProfitUsd, String status, String reason) {
        logTasks.offer(() -> {
            String date = LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            // Las comas del motivo romperían el CSV
            String safeReason = reason == null ? "" : reason.replace(',', ';');
            try (PrintWriter pw = new PrintWriter(new FileWriter(OPPORTUNITY_FILE, true))) {
                pw.printf(Locale.US, "%s,%s,%s,%s,%.4f,%.4f,%s,%s%n",
                        date, opportunityId, token, route, priority, adjustedProfitUsd, status, safeReason);
            } catch (IOException e) { logger.severe("Opp CSV Error: " + e.getMessage()); }
        });
    }

    public static void sendTelegram(String message) {
        if (TOKEN == null || TOKEN.isBlank() || CHAT_ID == null || CHAT_ID.isBlank()) return;
        telegramPool.submit(() -> {
            String url = "https://api.telegram.org/bot" + TOKEN.replace("\"", "").trim() + "/sendMessage";
            String jsonBody = String.format("{\"chat_id\": \"%s\", \"text\": \"%s\"}",
                    CHAT_ID.replace("\"", "").trim(), message.replace("\"", "'"));
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(jsonBody, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    logger.fine("Telegram HTTP " + response.code());
                }
            } catch (IOException e) {
                logger.fine("Telegram no disponible: " + e.getMessage());
            }
        });
    }

    private static void initCsv(String path, String header) {
        File f = new File(path);
        if (!f.exists()) {
            try (PrintWriter pw = new PrintWriter(new FileWriter(f))) {
                pw.println(header);
            } catch (IOException e) { logger.severe("No se pudo crear cabecera CSV " + path); }
        }
    }
}
