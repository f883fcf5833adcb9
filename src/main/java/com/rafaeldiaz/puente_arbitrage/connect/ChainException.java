package com.rafaeldiaz.puente_arbitrage.connect;

/**
 * 🔌 Fallo de comunicación con una cadena (RPC, envío, recibo).
 * {@code retryable} distingue caídas transitorias (timeout, 429, 5xx) de rechazos definitivos.
 */
public class ChainException extends RuntimeException {

    private final String chain;
    private final boolean retryable;

    public ChainException(String chain, String message, boolean retryable) {
        super("[" + chain + "] " + message);
        this.chain = chain;
        this.retryable = retryable;
    }

    public ChainException(String chain, String message, boolean retryable, Throwable cause) {
        super("[" + chain + "] " + message, cause);
        this.chain = chain;
        this.retryable = retryable;
    }

    public String getChain() {
        return chain;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
