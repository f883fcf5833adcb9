package com.rafaeldiaz.puente_arbitrage.connect;

import com.rafaeldiaz.puente_arbitrage.core.orchestrator.BotConfig;

import java.util.concurrent.ThreadLocalRandom;

/**
 * ⏳ Backoff exponencial con jitter de ±20% para lecturas RPC.
 * Una sola política para todo el motor; nunca se aplica a envíos de transacciones.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts debe ser >= 1");
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Espera para el intento {@code attempt} (base 0): base * 2^attempt con jitter.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (exponential * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(BotConfig.RPC_RETRY_BASE_MS, 0.2, BotConfig.RPC_RETRY_MAX_ATTEMPTS);
    }

    /** Un único intento, sin espera. */
    public static RetryPolicy none() {
        return new RetryPolicy(0, 0.0, 1);
    }
}
