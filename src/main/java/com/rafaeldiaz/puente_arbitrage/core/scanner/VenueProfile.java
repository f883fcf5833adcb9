package com.rafaeldiaz.puente_arbitrage.core.scanner;

import java.util.Map;

/**
 * ⏱️ Perfil aprendido de un venue: tiempo promedio de ejecución y confiabilidad.
 * Inmutable; cada observación produce un perfil nuevo.
 */
public record VenueProfile(String venue, double avgExecutionSeconds, double reliability, long observations) {

    public static final double LEARNING_RATE = 0.2;
    public static final double RELIABILITY_GAIN = 0.01;
    public static final double RELIABILITY_PENALTY = 0.05;
    public static final double MIN_RELIABILITY = 0.1;
    public static final double MAX_RELIABILITY = 0.99;

    /** Punto de partida de los venues conocidos (segundos, confiabilidad). */
    public static final Map<String, VenueProfile> DEFAULTS = Map.of(
            "sushiswap", new VenueProfile("sushiswap", 3.0, 0.90, 0),
            "uniswap_v3", new VenueProfile("uniswap_v3", 2.5, 0.95, 0),
            "camelot", new VenueProfile("camelot", 4.0, 0.80, 0),
            "balancer", new VenueProfile("balancer", 5.0, 0.70, 0),
            "dodo", new VenueProfile("dodo", 6.0, 0.60, 0),
            "woofi", new VenueProfile("woofi", 4.5, 0.75, 0),
            "zyberswap", new VenueProfile("zyberswap", 5.5, 0.65, 0)
    );

    /** Venue desconocido: pesimista. */
    public static VenueProfile unknown(String venue) {
        return new VenueProfile(venue, 8.0, 0.5, 0);
    }

    public VenueProfile learn(double executionSeconds, boolean success) {
        double avg = (1 - LEARNING_RATE) * avgExecutionSeconds + LEARNING_RATE * executionSeconds;
        double rel = success ? reliability + RELIABILITY_GAIN : reliability - RELIABILITY_PENALTY;
        rel = Math.max(MIN_RELIABILITY, Math.min(MAX_RELIABILITY, rel));
        return new VenueProfile(venue, avg, rel, observations + 1);
    }
}
