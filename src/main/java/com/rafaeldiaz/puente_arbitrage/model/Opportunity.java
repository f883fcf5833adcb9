package com.rafaeldiaz.puente_arbitrage.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * 🎯 OPORTUNIDAD DE ARBITRAJE
 * Discrepancia de precio de un token entre dos pares (venue, cadena). Producida por el escáner externo.
 * Los campos opcionales se resuelven aquí, una sola vez, con {@link Builder}.
 */
public record Opportunity(
        String id,
        String token,
        String sourceChain,          // Cadena donde compramos
        String targetChain,          // Cadena donde vendemos
        String buyVenue,
        String sellVenue,
        double buyPrice,
        double sellPrice,
        Instant discoveredAt,
        double estimatedProfitUsd,   // Ganancia bruta estimada por el escáner
        double volatility,           // Volatilidad de mercado (0.05 = 5%)
        Duration executionWindow,    // Ventana máxima para ejecutar la saga
        double estimatedBridgeFeeUsd
) {

    public static final double DEFAULT_VOLATILITY = 0.05;
    public static final Duration DEFAULT_EXECUTION_WINDOW = Duration.ofMinutes(2);

    public Opportunity {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(sourceChain, "sourceChain");
        Objects.requireNonNull(targetChain, "targetChain");
        Objects.requireNonNull(buyVenue, "buyVenue");
        Objects.requireNonNull(sellVenue, "sellVenue");
        Objects.requireNonNull(discoveredAt, "discoveredAt");
        Objects.requireNonNull(executionWindow, "executionWindow");
        if (id == null || id.isBlank()) {
            id = "opp_" + token.toUpperCase(Locale.ROOT) + "_" + discoveredAt.toEpochMilli();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Edad en segundos respecto a {@code now}. Nunca negativa. */
    public double ageSeconds(Instant now) {
        return Math.max(0.0, Duration.between(discoveredAt, now).toMillis() / 1000.0);
    }

    public boolean isCrossChain() {
        return !sourceChain.equalsIgnoreCase(targetChain);
    }

    public OperationType operationType() {
        return isCrossChain() ? OperationType.CROSS_CHAIN : OperationType.SAME_CHAIN;
    }

    /** Llave de ruta en vuelo: token + par de cadenas. */
    public String routeKey() {
        return (token + "|" + sourceChain + "|" + targetChain).toUpperCase(Locale.ROOT);
    }

    /** Llave de duplicados del filtro: token + par de venues. */
    public String dedupKey() {
        return (token + "|" + buyVenue + "|" + sellVenue).toLowerCase(Locale.ROOT);
    }

    public String route() {
        return sourceChain + "->" + targetChain;
    }

    public static final class Builder {
        private String id;
        private String token;
        private String sourceChain;
        private String targetChain;
        private String buyVenue;
        private String sellVenue;
        private double buyPrice;
        private double sellPrice;
        private Instant discoveredAt;
        private double estimatedProfitUsd;
        private double volatility = DEFAULT_VOLATILITY;
        private Duration executionWindow = DEFAULT_EXECUTION_WINDOW;
        private double estimatedBridgeFeeUsd;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder token(String token) { this.token = token; return this; }
        public Builder sourceChain(String chain) { this.sourceChain = chain; return this; }
        public Builder targetChain(String chain) { this.targetChain = chain; return this; }
        public Builder buyVenue(String venue) { this.buyVenue = venue; return this; }
        public Builder sellVenue(String venue) { this.sellVenue = venue; return this; }
        public Builder buyPrice(double price) { this.buyPrice = price; return this; }
        public Builder sellPrice(double price) { this.sellPrice = price; return this; }
        public Builder discoveredAt(Instant at) { this.discoveredAt = at; return this; }
        public Builder estimatedProfitUsd(double usd) { this.estimatedProfitUsd = usd; return this; }
        public Builder volatility(double volatility) { this.volatility = volatility; return this; }
        public Builder executionWindow(Duration window) { this.executionWindow = window; return this; }
        public Builder estimatedBridgeFeeUsd(double usd) { this.estimatedBridgeFeeUsd = usd; return this; }

        public Opportunity build() {
            String target = targetChain != null ? targetChain : sourceChain;
            double vol = (Double.isNaN(volatility) || volatility < 0) ? DEFAULT_VOLATILITY : volatility;
            Duration window = executionWindow != null ? executionWindow : DEFAULT_EXECUTION_WINDOW;
            return new Opportunity(id, token, sourceChain, target, buyVenue, sellVenue, buyPrice, sellPrice,
                    discoveredAt, estimatedProfitUsd, vol, window, Math.max(0.0, estimatedBridgeFeeUsd));
        }
    }
}
