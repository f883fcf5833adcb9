package com.rafaeldiaz.puente_arbitrage.execution;

import com.rafaeldiaz.puente_arbitrage.model.BridgeTransfer;
import com.rafaeldiaz.puente_arbitrage.model.SagaStage;
import com.rafaeldiaz.puente_arbitrage.model.TxReceipt;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 🧭 Estado vivo de una saga: etapa actual, transiciones y artefactos de cada paso.
 * Lo usa un solo hilo (el de la ejecución).
 */
public class SagaTrace {

    public record Transition(SagaStage from, SagaStage to, Instant at) {}

    private final String sagaId;
    private final String opportunityId;
    private final List<Transition> transitions = new ArrayList<>();
    private SagaStage stage = SagaStage.CREATED;

    // --- ARTEFACTOS ---
    double tradeSizeUsd;
    double tokenAmount;
    double buyGasUsd;
    double bridgeFeeUsd;
    double sellGasUsd;
    TxReceipt buyReceipt;
    BridgeTransfer bridgeTransfer;
    TxReceipt sellReceipt;

    public SagaTrace(String sagaId, String opportunityId) {
        this.sagaId = sagaId;
        this.opportunityId = opportunityId;
    }

    /**
     * @throws IllegalStateException si la transición retrocede o salta etapas
     */
    public void advance(SagaStage next, Instant at) {
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Saga " + sagaId + ": transición inválida " + stage + " -> " + next);
        }
        transitions.add(new Transition(stage, next, at));
        stage = next;
    }

    public SagaStage stage() { return stage; }
    public String sagaId() { return sagaId; }
    public String opportunityId() { return opportunityId; }
    public List<Transition> transitions() { return Collections.unmodifiableList(transitions); }

    /** Fees ya gastados e irrecuperables: gas de compra + fee del puente. */
    public double spentFeesUsd() {
        return buyGasUsd + (bridgeTransfer != null ? bridgeFeeUsd : 0.0);
    }
}
