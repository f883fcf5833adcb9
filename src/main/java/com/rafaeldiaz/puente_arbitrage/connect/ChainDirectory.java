package com.rafaeldiaz.puente_arbitrage.connect;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 📇 Directorio de clientes por cadena. Cada cliente registrado queda envuelto con la política de reintentos.
 */
public class ChainDirectory {

    private final Map<String, ChainClient> clients = new ConcurrentHashMap<>();
    private final RetryPolicy retryPolicy;

    public ChainDirectory() {
        this(RetryPolicy.defaultPolicy());
    }

    public ChainDirectory(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    public ChainDirectory register(ChainClient client) {
        clients.put(key(client.chain()), new RetryingChainClient(client, retryPolicy));
        return this;
    }

    public ChainClient client(String chain) {
        ChainClient client = clients.get(key(chain));
        if (client == null) throw new ChainException(chain, "Cadena no registrada", false);
        return client;
    }

    public boolean supports(String chain) {
        return clients.containsKey(key(chain));
    }

    public Collection<ChainClient> all() {
        return Collections.unmodifiableCollection(clients.values());
    }

    private static String key(String chain) {
        return chain.toLowerCase(Locale.ROOT);
    }
}
