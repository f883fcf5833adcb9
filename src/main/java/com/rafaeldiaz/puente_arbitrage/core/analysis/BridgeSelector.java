package com.rafaeldiaz.puente_arbitrage.core.analysis;

import com.rafaeldiaz.puente_arbitrage.connect.BridgeProvider;
import com.rafaeldiaz.puente_arbitrage.connect.ChainException;
import com.rafaeldiaz.puente_arbitrage.core.orchestrator.BotConfig;
import com.rafaeldiaz.puente_arbitrage.model.BridgeQuote;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 🌉 SELECTOR DE PUENTES (Caché de costos)
 * Rankea puentes por 0.6·fee + 0.4·velocidad usando cotizaciones cacheadas (TTL 10 min) y
 * pide una cotización fresca solo al ganador.
 */
public class BridgeSelector {

    // Normalización del score
    private static final double MAX_FEE_PERCENT = 0.2;
    private static final double MAX_MINUTES = 10.0;
    private static final double W_FEE = 0.6;
    private static final double W_SPEED = 0.4;

    private final List<BridgeProvider> providers;
    private final Clock clock;
    private final Duration quoteTtl;

    // Key: "BRIDGE|ORIGEN|DESTINO|TOKEN"
    private final Map<String, CachedQuote> quoteCache = new ConcurrentHashMap<>();

    private record CachedQuote(BridgeProvider provider, BridgeQuote quote, Instant expiry) {}

    /** Puente elegido con su cotización fresca para el monto exacto. */
    public record BridgeChoice(BridgeProvider provider, BridgeQuote quote, double score) {}

    public BridgeSelector(List<BridgeProvider> providers) {
        this(providers, Clock.systemUTC(), Duration.ofMillis(BotConfig.BRIDGE_QUOTE_TTL_MS));
    }

    public BridgeSelector(List<BridgeProvider> providers, Clock clock, Duration quoteTtl) {
        this.providers = List.copyOf(providers);
        this.clock = clock;
        this.quoteTtl = quoteTtl;
    }

    public Optional<BridgeChoice> select(String sourceChain, String targetChain, String token, double amount) {
        BridgeProvider best = null;
        double bestScore = -1;
        for (BridgeProvider provider : providers) {
            if (!provider.supports(sourceChain, targetChain, token)) continue;
            BridgeQuote quote = cachedOrFetch(provider, sourceChain, targetChain, token, amount);
            if (quote == null) continue;
            double score = score(quote);
            if (score > bestScore) {
                bestScore = score;
                best = provider;
            }
        }
        if (best == null) {
            BotLogger.warn("🌉 Sin puente disponible para " + token + " " + sourceChain + "->" + targetChain);
            return Optional.empty();
        }

        try {
            BridgeQuote fresh = best.quote(sourceChain, targetChain, token, amount);
            store(best, fresh);
            return Optional.of(new BridgeChoice(best, fresh, score(fresh)));
        } catch (ChainException e) {
            BotLogger.warn("⚠️ Cotización final de " + best.name() + " falló: " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Re-cotiza todas las rutas conocidas. Lo llama el scheduler.
     * @return rutas refrescadas con éxito
     */
    public int refresh() {
        int refreshed = 0;
        for (CachedQuote cached : quoteCache.values()) {
            BridgeQuote q = cached.quote();
            try {
                store(cached.provider(), cached.provider().quote(q.sourceChain(), q.targetChain(), q.token(), q.amount()));
                refreshed++;
            } catch (ChainException e) {
                BotLogger.warn("⚠️ Refresh de " + cached.provider().name() + " falló: " + e.getMessage());
            }
        }
        if (refreshed > 0) BotLogger.info("🌉 Costos de puente refrescados: " + refreshed + " rutas.");
        return refreshed;
    }

    public Optional<BridgeProvider> provider(String name) {
        return providers.stream().filter(p -> p.name().equalsIgnoreCase(name)).findFirst();
    }

    public int cachedRoutes() {
        return quoteCache.size();
    }

    /** 0.6·(1 - fee%/0.2) + 0.4·(1 - minutos/10), cada término acotado a [0, 1]. */
    public static double score(BridgeQuote quote) {
        double feeScore = clamp(1.0 - quote.feePercent() / MAX_FEE_PERCENT);
        double speedScore = clamp(1.0 - (quote.estimatedSeconds() / 60.0) / MAX_MINUTES);
        return W_FEE * feeScore + W_SPEED * speedScore;
    }

    private BridgeQuote cachedOrFetch(BridgeProvider provider, String src, String dst, String token, double amount) {
        String key = key(provider.name(), src, dst, token);
        CachedQuote cached = quoteCache.get(key);
        if (cached != null && clock.instant().isBefore(cached.expiry())) {
            return cached.quote();
        }
        try {
            BridgeQuote quote = provider.quote(src, dst, token, amount);
            store(provider, quote);
            return quote;
        } catch (ChainException e) {
            BotLogger.warn("⚠️ Cotización de " + provider.name() + " falló: " + e.getMessage());
            // Mejor un dato viejo que ninguno
            return cached != null ? cached.quote() : null;
        }
    }

    private void store(BridgeProvider provider, BridgeQuote quote) {
        quoteCache.put(key(provider.name(), quote.sourceChain(), quote.targetChain(), quote.token()),
                new CachedQuote(provider, quote, clock.instant().plus(quoteTtl)));
    }

    private static String key(String bridge, String src, String dst, String token) {
        return (bridge + "|" + src + "|" + dst + "|" + token).toUpperCase(Locale.ROOT);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
