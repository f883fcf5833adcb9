package com.rafaeldiaz.puente_arbitrage.connect;

import com.rafaeldiaz.puente_arbitrage.model.BridgeCompletion;
import com.rafaeldiaz.puente_arbitrage.model.BridgeQuote;
import com.rafaeldiaz.puente_arbitrage.model.PreparedTx;

import java.time.Duration;

/**
 * 🌉 Puerto hacia un puente cross-chain (Stargate, Hop, Across...).
 */
public interface BridgeProvider {

    String name();

    boolean supports(String sourceChain, String targetChain, String token);

    BridgeQuote quote(String sourceChain, String targetChain, String token, double amount);

    PreparedTx transfer(BridgeQuote quote, String recipient);

    /** Estado actual de la transferencia identificada por el hash de origen. Se consulta en ciclos de sondeo. */
    BridgeCompletion awaitCompletion(String sourceChain, String transferId);

    /** Tiempo máximo que esperamos la llegada de fondos. */
    default Duration completionTimeout() {
        return Duration.ofMinutes(15);
    }
}
