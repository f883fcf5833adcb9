package com.rafaeldiaz.puente_arbitrage.core.scanner;

import com.rafaeldiaz.puente_arbitrage.core.orchestrator.BotConfig;
import com.rafaeldiaz.puente_arbitrage.model.FilterVerdict;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 🔎 FILTRO DE OPORTUNIDADES
 * Puntúa y poda oportunidades en etapas que cortan a la primera falla:
 * frescura → decaimiento de profit → velocidad de ejecución → volatilidad → prioridad.
 * <p>
 * El veredicto es función de la oportunidad, los perfiles de venue y el reloj. Volver a filtrar
 * la misma oportunidad (mismo id) nunca la marca como duplicada.
 */
public class OpportunityFilter {

    // --- DECAIMIENTO ---
    private static final double BASE_DECAY_RATE = 0.05;
    private static final double DECAY_FLOOR = 0.1;

    // --- VELOCIDAD ---
    private static final double COORDINATION_OVERHEAD_SECONDS = 2.0;
    private static final double SPEED_NORMALIZATION_SECONDS = 20.0;

    // --- VOLATILIDAD (banda óptima) ---
    private static final double OPTIMAL_VOL_MIN = 0.02;
    private static final double OPTIMAL_VOL_MAX = 0.15;

    // --- PRIORIDAD ---
    private static final double PROFIT_NORMALIZATION_USD = 50.0;
    private static final double W_PROFIT = 0.4;
    private static final double W_SPEED = 0.3;
    private static final double W_VOLATILITY = 0.2;
    private static final double W_FRESHNESS = 0.1;

    private static final int MAX_SEEN_KEYS = 1024;

    private final Clock clock;
    private final double maxAgeSeconds;
    private final Duration duplicateWindow;
    private final double minProfitAfterDecay;
    private final double minSpeedScore;
    private final double maxExecutionSeconds;
    private final double minPriorityScore;

    private final Map<String, VenueProfile> venueProfiles = new ConcurrentHashMap<>();

    // Llave de duplicado -> última oportunidad vista. Acotado, expulsa la más vieja.
    private final Map<String, Seen> seenKeys = new LinkedHashMap<>(256, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Seen> eldest) {
            return size() > MAX_SEEN_KEYS;
        }
    };

    private record Seen(String opportunityId, Instant at) {}

    public OpportunityFilter() {
        this(Clock.systemUTC());
    }

    public OpportunityFilter(Clock clock) {
        this(clock, BotConfig.MAX_OPPORTUNITY_AGE_SECONDS,
                Duration.ofMillis((long) (BotConfig.DUPLICATE_WINDOW_SECONDS * 1000)),
                BotConfig.MIN_PROFIT_AFTER_DECAY, BotConfig.MIN_EXECUTION_SPEED_SCORE,
                BotConfig.MAX_ESTIMATED_EXECUTION_SECONDS, BotConfig.MIN_PRIORITY_SCORE);
    }

    public OpportunityFilter(Clock clock, double maxAgeSeconds, Duration duplicateWindow, double minProfitAfterDecay,
                             double minSpeedScore, double maxExecutionSeconds, double minPriorityScore) {
        this.clock = clock;
        this.maxAgeSeconds = maxAgeSeconds;
        this.duplicateWindow = duplicateWindow;
        this.minProfitAfterDecay = minProfitAfterDecay;
        this.minSpeedScore = minSpeedScore;
        this.maxExecutionSeconds = maxExecutionSeconds;
        this.minPriorityScore = minPriorityScore;
        venueProfiles.putAll(VenueProfile.DEFAULTS);
    }

    // =========================================================================
    // 🧪 FILTRADO
    // =========================================================================

    public FilterVerdict filter(Opportunity opp) {
        Instant now = clock.instant();
        double age = opp.ageSeconds(now);

        // 1. FRESCURA
        if (age > maxAgeSeconds) {
            return reject(opp, String.format(Locale.US, "Stale: edad %.1fs > máx %.1fs", age, maxAgeSeconds), 0, 0, 0);
        }
        if (isDuplicate(opp, now)) {
            return reject(opp, "Duplicate: mismo token y par de venues visto hace < "
                    + duplicateWindow.toSeconds() + "s", 0, 0, 0);
        }

        // 2. DECAIMIENTO DEL PROFIT
        double decay = decayFactor(age, opp.volatility());
        double adjusted = opp.estimatedProfitUsd() * decay;
        if (adjusted < minProfitAfterDecay) {
            return reject(opp, String.format(Locale.US, "Profit decayed: $%.2f < $%.2f (factor %.2f)",
                    adjusted, minProfitAfterDecay, decay), 0, decay, adjusted);
        }

        // 3. VELOCIDAD DE EJECUCIÓN
        VenueProfile buy = profile(opp.buyVenue());
        VenueProfile sell = profile(opp.sellVenue());
        double estimate = buy.avgExecutionSeconds() + sell.avgExecutionSeconds() + COORDINATION_OVERHEAD_SECONDS;
        if (estimate > maxExecutionSeconds) {
            return reject(opp, String.format(Locale.US, "Too slow: %.1fs estimados > %.1fs",
                    estimate, maxExecutionSeconds), estimate, decay, adjusted);
        }
        double reliability = (buy.reliability() + sell.reliability()) / 2.0;
        double speedScore = Math.max(0.0, 1.0 - estimate / SPEED_NORMALIZATION_SECONDS) * reliability;

        // 4. VOLATILIDAD
        double volatilityScore = volatilityScore(opp.volatility());

        // 5. PRIORIDAD
        double profitScore = Math.min(1.0, adjusted / PROFIT_NORMALIZATION_USD);
        double freshnessScore = Math.max(0.0, 1.0 - age / maxAgeSeconds);
        double priority = W_PROFIT * profitScore + W_SPEED * speedScore
                + W_VOLATILITY * volatilityScore + W_FRESHNESS * freshnessScore;
        priority = Math.max(0.0, Math.min(1.0, priority));

        boolean execute = priority >= minPriorityScore && speedScore >= minSpeedScore;
        String reason;
        if (execute) {
            reason = String.format(Locale.US, "Executable: prioridad %.3f", priority);
        } else if (speedScore < minSpeedScore) {
            reason = String.format(Locale.US, "Slow venues: speedScore %.2f < %.2f", speedScore, minSpeedScore);
        } else {
            reason = String.format(Locale.US, "Low priority: %.3f < %.2f", priority, minPriorityScore);
        }

        FilterVerdict verdict = new FilterVerdict(opp.id(), execute, reason, priority, estimate, decay, adjusted);
        BotLogger.logOpportunity(opp.id(), opp.token(), opp.route(), priority, adjusted,
                execute ? "EXECUTE" : "REJECT", reason);
        return verdict;
    }

    /**
     * Filtra un lote y devuelve solo los veredictos ejecutables, de mayor a menor prioridad.
     */
    public List<FilterVerdict> rank(List<Opportunity> batch) {
        List<FilterVerdict> executable = new ArrayList<>();
        for (Opportunity opp : batch) {
            FilterVerdict v = filter(opp);
            if (v.shouldExecute()) executable.add(v);
        }
        executable.sort(Comparator.comparingDouble(FilterVerdict::priorityScore).reversed());
        if (!batch.isEmpty()) {
            BotLogger.info("🔎 Filtro: " + executable.size() + "/" + batch.size() + " oportunidades ejecutables.");
        }
        return executable;
    }

    // =========================================================================
    // 📚 APRENDIZAJE DE VENUES
    // =========================================================================

    public void updateVenueProfile(String venue, double executionSeconds, boolean success) {
        VenueProfile updated = venueProfiles.compute(key(venue), (k, current) ->
                (current != null ? current : VenueProfile.unknown(k)).learn(executionSeconds, success));
        BotLogger.info(String.format(Locale.US, "📚 Venue %s: %.2fs promedio | confiabilidad %.2f",
                venue, updated.avgExecutionSeconds(), updated.reliability()));
    }

    public VenueProfile profile(String venue) {
        String k = key(venue);
        VenueProfile p = venueProfiles.get(k);
        return p != null ? p : VenueProfile.unknown(k);
    }

    // =========================================================================
    // 🧮 HELPERS
    // =========================================================================

    /** max(0.1, 1 - 0.05·(1 + 10·vol)·edad). No crece con la edad. */
    public static double decayFactor(double ageSeconds, double volatility) {
        double decayRate = BASE_DECAY_RATE * (1 + volatility * 10);
        return Math.max(DECAY_FLOOR, 1.0 - decayRate * Math.max(0.0, ageSeconds));
    }

    static double volatilityScore(double volatility) {
        if (volatility < OPTIMAL_VOL_MIN) return 0.6; // Pocos spreads
        if (volatility <= OPTIMAL_VOL_MAX) return 1.0;
        return Math.max(0.2, 1.0 - (volatility - OPTIMAL_VOL_MAX) * 5); // Los spreads se cierran rápido
    }

    private boolean isDuplicate(Opportunity opp, Instant now) {
        synchronized (seenKeys) {
            Seen last = seenKeys.get(opp.dedupKey());
            if (last != null && !last.opportunityId().equals(opp.id())
                    && Duration.between(last.at(), now).compareTo(duplicateWindow) < 0) {
                return true;
            }
            if (last == null || !last.opportunityId().equals(opp.id())) {
                seenKeys.put(opp.dedupKey(), new Seen(opp.id(), now));
            }
            return false;
        }
    }

    private FilterVerdict reject(Opportunity opp, String reason, double estimate, double decay, double adjusted) {
        BotLogger.logOpportunity(opp.id(), opp.token(), opp.route(), 0.0, adjusted, "REJECT", reason);
        return FilterVerdict.reject(opp.id(), reason, estimate, decay, adjusted);
    }

    private static String key(String venue) {
        return venue.toLowerCase(Locale.ROOT);
    }
}
