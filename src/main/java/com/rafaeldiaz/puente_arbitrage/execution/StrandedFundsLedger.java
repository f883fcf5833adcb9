package com.rafaeldiaz.puente_arbitrage.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rafaeldiaz.puente_arbitrage.model.FailureKind;
import com.rafaeldiaz.puente_arbitrage.model.StrandedPosition;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 🧊 LIBRO DE FONDOS VARADOS
 * Posiciones que cruzaron (o intentaron cruzar) un puente sin llegar a venderse.
 * Persistido en JSON para que sobreviva a reinicios; {@code null} como archivo = solo memoria.
 */
public class StrandedFundsLedger {

    private final File ledgerFile;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, StrandedPosition> positions = new ConcurrentHashMap<>();

    public StrandedFundsLedger(File ledgerFile) {
        this.ledgerFile = ledgerFile;
        load();
    }

    public static StrandedFundsLedger inMemory() {
        return new StrandedFundsLedger(null);
    }

    public void record(StrandedPosition position) {
        positions.put(position.sagaId(), position);
        BotLogger.alert(String.format("Saga %s %s: %.6f %s en %s (%s) | pérdida fees $%.2f",
                position.sagaId(), position.kind(), position.amount(), position.token(),
                position.chainHoldingFunds(), position.bridge(), position.lossUsd()));
        save();
    }

    public void update(StrandedPosition position) {
        positions.put(position.sagaId(), position);
        save();
    }

    public Optional<StrandedPosition> resolve(String sagaId) {
        StrandedPosition current = positions.get(sagaId);
        if (current == null) return Optional.empty();
        StrandedPosition resolved = current.resolve();
        positions.put(sagaId, resolved);
        BotLogger.info("✅ Posición " + sagaId + " reconciliada.");
        save();
        return Optional.of(resolved);
    }

    public List<StrandedPosition> unresolved() {
        List<StrandedPosition> out = new ArrayList<>();
        for (StrandedPosition p : positions.values()) {
            if (!p.resolved()) out.add(p);
        }
        out.sort(Comparator.comparing(StrandedPosition::recordedAt));
        return out;
    }

    /** Puentes que vencieron sin confirmación: los vigila el scheduler. */
    public List<StrandedPosition> pendingBridges() {
        List<StrandedPosition> out = new ArrayList<>();
        for (StrandedPosition p : unresolved()) {
            if (p.kind() == FailureKind.BRIDGE_TIMEOUT) out.add(p);
        }
        return out;
    }

    // =========================================================
    // 💾 PERSISTENCIA
    // =========================================================

    private synchronized void save() {
        if (ledgerFile == null) return;
        try {
            ArrayNode array = mapper.createArrayNode();
            for (StrandedPosition p : positions.values()) {
                ObjectNode node = array.addObject();
                node.put("sagaId", p.sagaId());
                node.put("opportunityId", p.opportunityId());
                node.put("token", p.token());
                node.put("sourceChain", p.sourceChain());
                node.put("targetChain", p.targetChain());
                node.put("chainHoldingFunds", p.chainHoldingFunds());
                node.put("amount", p.amount());
                node.put("kind", p.kind().name());
                node.put("lossUsd", p.lossUsd());
                node.put("bridge", p.bridge());
                node.put("transferId", p.transferId());
                node.put("recordedAt", p.recordedAt().toString());
                node.put("resolved", p.resolved());
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(ledgerFile, array);
        } catch (IOException e) {
            BotLogger.error("⚠️ Error I/O: no se pudo persistir el libro de fondos varados: " + e.getMessage());
        }
    }

    private void load() {
        if (ledgerFile == null || !ledgerFile.exists()) return;
        try {
            JsonNode root = mapper.readTree(ledgerFile);
            for (JsonNode node : root) {
                StrandedPosition p = new StrandedPosition(
                        node.path("sagaId").asText(),
                        node.path("opportunityId").asText(),
                        node.path("token").asText(),
                        node.path("sourceChain").asText(),
                        node.path("targetChain").asText(),
                        node.path("chainHoldingFunds").asText(),
                        node.path("amount").asDouble(),
                        FailureKind.valueOf(node.path("kind").asText(FailureKind.STRANDED_FUNDS.name())),
                        node.path("lossUsd").asDouble(),
                        node.path("bridge").asText(null),
                        node.path("transferId").asText(null),
                        Instant.parse(node.path("recordedAt").asText()),
                        node.path("resolved").asBoolean(false));
                positions.put(p.sagaId(), p);
            }
            if (!unresolved().isEmpty()) {
                BotLogger.warn("🧊 " + unresolved().size() + " posiciones varadas pendientes de reconciliación.");
            }
        } catch (IOException | RuntimeException e) {
            BotLogger.error("⚠️ Libro de fondos varados ilegible, se inicia vacío: " + e.getMessage());
        }
    }
}
