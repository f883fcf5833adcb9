package com.rafaeldiaz.puente_arbitrage.execution;

import com.rafaeldiaz.puente_arbitrage.connect.ChainClient;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * 🔢 Secuenciador de nonces por (cadena, dirección).
 * Primer uso o tras un envío fallido: consulta el nonce pendiente del nodo. En otro caso: último + 1.
 */
public class NonceManager {

    private final Map<String, Long> lastIssued = new HashMap<>();
    private final Set<String> uncertain = new HashSet<>();

    public synchronized long next(ChainClient client, String address) {
        String key = key(client.chain(), address);
        Long last = lastIssued.get(key);
        long nonce;
        if (last == null || uncertain.remove(key)) {
            long observed = client.getNonce(address);
            nonce = observed;
            if (last != null && observed != last + 1) {
                BotLogger.warn("🔢 Nonce reconciliado en " + client.chain() + ": local " + (last + 1) + " -> nodo " + observed);
            }
        } else {
            nonce = last + 1;
        }
        lastIssued.put(key, nonce);
        return nonce;
    }

    /**
     * El último envío no tiene resultado conocido: el próximo nonce se pide al nodo.
     */
    public synchronized void markUncertain(String chain, String address) {
        uncertain.add(key(chain, address));
    }

    public synchronized OptionalLong lastIssued(String chain, String address) {
        Long last = lastIssued.get(key(chain, address));
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }

    private static String key(String chain, String address) {
        return (chain + "|" + address).toLowerCase(Locale.ROOT);
    }
}
