package com.rafaeldiaz.puente_arbitrage.core.orchestrator;

import com.rafaeldiaz.puente_arbitrage.model.ExecutionOutcome;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionRecord;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionResult;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionStats;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionStatus;
import com.rafaeldiaz.puente_arbitrage.model.ExecutionStatusReport;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 🚦 ÁRBITRO DE EJECUCIÓN (Single-Flight)
 * Un único trade en todo el proceso. Si el lock está tomado la respuesta es "bloqueado" al instante:
 * no hay cola, una decisión vieja nunca se ejecuta.
 * El callback corre en un hilo trabajador con timeout duro; el lock se libera en TODA salida.
 * <p>
 * Un callback abandonado por timeout que ignora la interrupción sigue vivo en su hilo:
 * mientras no termine, toda nueva ejecución responde "bloqueado".
 */
public class ExecutionCoordinator {

    private final Duration timeout;
    private final int historySize;
    private final Clock clock;

    // Estado del Lock (una sola concesión a la vez)
    private LockLease lease;
    // Callback abandonado por timeout que aún no termina
    private CountDownLatch straggler;

    private final Map<String, ExecutionRecord> active = new ConcurrentHashMap<>();
    private final Deque<ExecutionRecord> history = new ArrayDeque<>();
    private final AtomicInteger sequence = new AtomicInteger();

    // --- ESTADÍSTICAS ---
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();
    private final AtomicLong lockViolations = new AtomicLong();

    private final ExecutorService worker = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "Execution-Worker");
        t.setDaemon(true);
        return t;
    });

    // --- ESTRUCTURA INTERNA LOCK ---
    private static class LockLease {
        final Thread owner;
        final String executionId;
        final Instant startedAt;
        LockLease(Thread owner, String executionId, Instant startedAt) {
            this.owner = owner;
            this.executionId = executionId;
            this.startedAt = startedAt;
        }
    }

    public ExecutionCoordinator() {
        this(Duration.ofMillis(BotConfig.EXECUTION_TIMEOUT_MS), BotConfig.EXECUTION_HISTORY_SIZE, Clock.systemUTC());
    }

    public ExecutionCoordinator(Duration timeout, int historySize, Clock clock) {
        this.timeout = timeout;
        this.historySize = historySize;
        this.clock = clock;
    }

    /**
     * Ejecuta {@code callback} si nadie más está ejecutando. Nunca lanza.
     */
    public ExecutionResult execute(ExecutionCallback callback, Opportunity opportunity, String initiator) {
        String executionId = "exec_" + sequence.incrementAndGet() + "_" + opportunity.id();
        if (!tryAcquire(executionId)) {
            long violations = lockViolations.incrementAndGet();
            BotLogger.warn("🚫 EJECUCIÓN BLOQUEADA: " + initiator + " intentó " + opportunity.id()
                    + " con un trade en curso (violaciones: " + violations + ")");
            return ExecutionResult.blocked(initiator);
        }

        Instant start = clock.instant();
        ExecutionRecord record = ExecutionRecord.executing(executionId, initiator, opportunity, start);
        active.put(executionId, record);
        BotLogger.info("🔐 LOCK ADQUIRIDO: " + executionId + " (" + initiator + ")");

        ExecutionStatus status = ExecutionStatus.FAILED;
        ExecutionOutcome outcome = null;
        String error = null;
        Future<ExecutionOutcome> future = null;
        CountDownLatch done = new CountDownLatch(1);
        AtomicBoolean started = new AtomicBoolean();
        try {
            future = worker.submit(() -> {
                started.set(true);
                try {
                    return callback.execute(opportunity);
                } finally {
                    done.countDown();
                }
            });
            outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                error = "El callback no devolvió resultado";
            } else {
                status = outcome.success() ? ExecutionStatus.SUCCEEDED : ExecutionStatus.FAILED;
                if (!outcome.success()) error = outcome.message();
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            markStraggler(done, started);
            status = ExecutionStatus.TIMED_OUT;
            error = "Timeout tras " + timeout.toSeconds() + "s";
            BotLogger.error("⏰ TIMEOUT DE EJECUCIÓN: " + executionId + ". Abandonando callback.");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            BotLogger.error("🔥 Error en callback " + executionId + ": " + error);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
                markStraggler(done, started);
            }
            status = ExecutionStatus.ABANDONED;
            error = "Interrumpido";
        } catch (RuntimeException e) {
            // RejectedExecutionException tras shutdown
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            BotLogger.error("🔥 No se pudo lanzar " + executionId + ": " + error);
        } finally {
            release(executionId);
            finish(record.finish(status, clock.instant(), outcome), status);
        }

        Duration elapsed = Duration.between(start, clock.instant());
        return new ExecutionResult(executionId, initiator, false, status, outcome, error, elapsed);
    }

    public synchronized boolean isLocked() {
        return lease != null || stragglerAlive();
    }

    public ExecutionStatusReport getStatus() {
        List<ExecutionRecord> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        return new ExecutionStatusReport(isLocked(), new ArrayList<>(active.values()), stats(), snapshot);
    }

    public ExecutionStats stats() {
        return new ExecutionStats(total.get(), succeeded.get(), failed.get(), abandoned.get(), lockViolations.get());
    }

    /**
     * Espera hasta {@code grace} a que termine el trade en curso y apaga el hilo trabajador.
     * @return true si no quedó ninguna ejecución viva
     */
    public boolean shutdown(Duration grace) {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                BotLogger.warn("⏳ Ejecución aún viva tras " + grace.toSeconds() + "s de gracia. Forzando apagado.");
                worker.shutdownNow();
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
            return false;
        }
    }

    // =========================================================================
    // 🕵️ HELPERS
    // =========================================================================

    private synchronized boolean tryAcquire(String executionId) {
        if (lease != null || stragglerAlive()) return false;
        lease = new LockLease(Thread.currentThread(), executionId, clock.instant());
        return true;
    }

    private synchronized void release(String executionId) {
        if (lease != null && lease.executionId.equals(executionId) && lease.owner == Thread.currentThread()) {
            Duration held = Duration.between(lease.startedAt, clock.instant());
            lease = null;
            BotLogger.info("🔓 LOCK LIBERADO: " + executionId + " (" + held.toMillis() + " ms)");
        }
    }

    // Cancelado antes de arrancar = nunca correrá
    private synchronized void markStraggler(CountDownLatch done, AtomicBoolean started) {
        if (started.get() && done.getCount() > 0) straggler = done;
    }

    private synchronized boolean stragglerAlive() {
        if (straggler == null) return false;
        if (straggler.getCount() > 0) return true;
        BotLogger.info("🧹 Callback abandonado terminó. Lock disponible.");
        straggler = null;
        return false;
    }

    private void finish(ExecutionRecord done, ExecutionStatus status) {
        total.incrementAndGet();
        switch (status) {
            case SUCCEEDED:
                succeeded.incrementAndGet();
                break;
            case TIMED_OUT:
            case ABANDONED:
                abandoned.incrementAndGet();
                break;
            default:
                failed.incrementAndGet();
        }
        synchronized (history) {
            history.addLast(done);
            while (history.size() > historySize) history.removeFirst();
        }
        active.remove(done.id());
    }
}
