package com.rafaeldiaz.puente_arbitrage.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BotLoggerTest {

    private static boolean eventuallyContains(Path file, String needle) throws IOException, InterruptedException {
        for (int i = 0; i < 100; i++) {
            if (Files.exists(file) && new String(Files.readAllBytes(file), StandardCharsets.UTF_8).contains(needle)) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }

    @Test
    @DisplayName("📝 La auditoría de sagas se escribe en CSV de forma asíncrona")
    void sagaAuditIsWrittenAsynchronously() throws Exception {
        String sagaId = "saga_" + UUID.randomUUID().toString().substring(0, 8);

        BotLogger.logSaga(sagaId, "ARB", "arbitrum->optimism", "STRANDED_FUNDS", "STRANDED_FUNDS", 0.0, 0.35);

        assertTrue(eventuallyContains(Paths.get("logs", "sagas.csv"),
                sagaId + ",ARB,arbitrum->optimism,STRANDED_FUNDS,STRANDED_FUNDS,0.0000,0.3500"));
    }

    @Test
    @DisplayName("🧹 Las comas del motivo no rompen el CSV de oportunidades")
    void opportunityReasonIsCsvSafe() throws Exception {
        String oppId = "opp_" + UUID.randomUUID().toString().substring(0, 8);

        BotLogger.logOpportunity(oppId, "OP", "base->arbitrum", 0.71, 29.4, "REJECTED", "Stale: 20.0s, max 15s");

        assertTrue(eventuallyContains(Paths.get("logs", "opportunities.csv"),
                oppId + ",OP,base->arbitrum,0.7100,29.4000,REJECTED,Stale: 20.0s; max 15s"));
    }
}
