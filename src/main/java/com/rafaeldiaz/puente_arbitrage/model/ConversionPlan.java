package com.rafaeldiaz.puente_arbitrage.model;

/**
 * Plan de conversión just-in-time. Calculado, nunca persistido.
 * {@code targetUsd} jamás supera lo disponible por encima de la reserva mínima del activo origen.
 */
public record ConversionPlan(
        String sourceAsset,          // null si no hay plan viable
        double targetUsd,
        boolean viable,
        double totalAvailableUsd,    // Suma disponible (sobre reservas) en todos los activos
        double shortfallUsd,
        String reason
) {

    public static ConversionPlan notNeeded(double totalAvailableUsd) {
        return new ConversionPlan(null, 0.0, true, totalAvailableUsd, 0.0, "Saldo nativo suficiente");
    }

    public static ConversionPlan convert(String asset, double targetUsd, double totalAvailableUsd, double shortfallUsd) {
        return new ConversionPlan(asset, targetUsd, true, totalAvailableUsd, shortfallUsd,
                String.format("Convertir $%.2f de %s", targetUsd, asset));
    }

    public static ConversionPlan infeasible(double totalAvailableUsd, double shortfallUsd, String reason) {
        return new ConversionPlan(null, 0.0, false, totalAvailableUsd, shortfallUsd, reason);
    }

    public boolean requiresConversion() {
        return viable && sourceAsset != null;
    }
}
