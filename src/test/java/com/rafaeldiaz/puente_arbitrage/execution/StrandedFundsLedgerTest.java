package com.rafaeldiaz.puente_arbitrage.execution;

import com.rafaeldiaz.puente_arbitrage.model.FailureKind;
import com.rafaeldiaz.puente_arbitrage.model.StrandedPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrandedFundsLedgerTest {

    private static StrandedPosition position(String sagaId, FailureKind kind, Instant at) {
        return new StrandedPosition(sagaId, "opp-" + sagaId, "ARB", "arbitrum", "optimism", "optimism",
                99.9, kind, 0.35, "stargate", "0x" + sagaId, at, false);
    }

    @Test
    @DisplayName("🧊 Registrar, vigilar pendientes y reconciliar")
    void recordWatchAndResolve() {
        StrandedFundsLedger ledger = StrandedFundsLedger.inMemory();
        Instant t = Instant.parse("2025-06-01T12:00:00Z");
        ledger.record(position("s2", FailureKind.STRANDED_FUNDS, t.plusSeconds(10)));
        ledger.record(position("s1", FailureKind.BRIDGE_TIMEOUT, t));

        List<StrandedPosition> open = ledger.unresolved();
        assertEquals(List.of("s1", "s2"), List.of(open.get(0).sagaId(), open.get(1).sagaId()));
        assertEquals(1, ledger.pendingBridges().size());

        assertTrue(ledger.resolve("s1").orElseThrow().resolved());
        assertTrue(ledger.pendingBridges().isEmpty());
        assertEquals(1, ledger.unresolved().size());
        assertTrue(ledger.resolve("desconocida").isEmpty());
    }

    @Test
    @DisplayName("💾 El libro sobrevive a un reinicio")
    void ledgerSurvivesRestart(@TempDir Path dir) {
        File file = dir.resolve("stranded.json").toFile();
        StrandedFundsLedger ledger = new StrandedFundsLedger(file);
        StrandedPosition p = position("s1", FailureKind.BRIDGE_TIMEOUT, Instant.parse("2025-06-01T12:00:00Z"));
        ledger.record(p);
        ledger.update(p.relocate("optimism", 99.5, FailureKind.STRANDED_FUNDS));

        StrandedFundsLedger reloaded = new StrandedFundsLedger(file);

        assertEquals(1, reloaded.unresolved().size());
        StrandedPosition back = reloaded.unresolved().get(0);
        assertEquals(FailureKind.STRANDED_FUNDS, back.kind());
        assertEquals(99.5, back.amount(), 1e-9);
        assertEquals("0xs1", back.transferId());
        assertEquals(p.recordedAt(), back.recordedAt());
    }
}
