package com.rafaeldiaz.puente_arbitrage.model;

/**
 * 🧭 Posiciones de la saga cross-chain. Nunca retroceden.
 * FAILED solo es alcanzable antes de BRIDGED; STRANDED_FUNDS solo después, porque el capital
 * ya salió de la cadena origen.
 */
public enum SagaStage {
    CREATED,
    VALIDATED,
    FUNDED,
    BOUGHT,
    BRIDGED,
    BRIDGE_CONFIRMED,
    SOLD,
    FAILED,
    STRANDED_FUNDS;

    public boolean isTerminal() {
        return this == SOLD || this == FAILED || this == STRANDED_FUNDS;
    }

    public boolean fundsLeftSourceChain() {
        return this == BRIDGED || this == BRIDGE_CONFIRMED || this == SOLD || this == STRANDED_FUNDS;
    }

    public boolean canAdvanceTo(SagaStage next) {
        if (isTerminal() || next == CREATED) return false;
        switch (next) {
            case FAILED:
                return ordinal() < BRIDGED.ordinal();
            case STRANDED_FUNDS:
                return this == BRIDGED || this == BRIDGE_CONFIRMED;
            default:
                return next.ordinal() == ordinal() + 1;
        }
    }
}
