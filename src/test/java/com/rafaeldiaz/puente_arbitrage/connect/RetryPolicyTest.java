package com.rafaeldiaz.puente_arbitrage.connect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("⏳ Backoff exponencial con jitter de ±20%")
    void exponentialBackoffWithinJitter() {
        RetryPolicy policy = new RetryPolicy(500, 0.2, 4);

        for (int i = 0; i < 50; i++) {
            long first = policy.delayMs(0);
            long third = policy.delayMs(2);
            assertTrue(first >= 400 && first <= 600, "intento 0: " + first);
            assertTrue(third >= 1600 && third <= 2400, "intento 2: " + third);
        }
    }

    @Test
    @DisplayName("🧪 Sin jitter la espera es determinista")
    void noJitterIsDeterministic() {
        RetryPolicy policy = new RetryPolicy(100, 0.0, 3);
        assertEquals(100, policy.delayMs(0));
        assertEquals(400, policy.delayMs(2));
        assertEquals(1, RetryPolicy.none().getMaxAttempts());
    }

    @Test
    @DisplayName("🚫 Cero intentos no tiene sentido")
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(100, 0.1, 0));
    }
}
