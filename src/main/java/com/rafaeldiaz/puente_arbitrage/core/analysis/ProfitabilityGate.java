package com.rafaeldiaz.puente_arbitrage.core.analysis;

import com.rafaeldiaz.puente_arbitrage.core.orchestrator.BotConfig;
import com.rafaeldiaz.puente_arbitrage.model.ChainClass;
import com.rafaeldiaz.puente_arbitrage.model.GasTier;
import com.rafaeldiaz.puente_arbitrage.model.OperationType;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;
import com.rafaeldiaz.puente_arbitrage.model.ProfitabilityVerdict;

import java.util.Locale;

/**
 * 🧮 COMPUERTA DE RENTABILIDAD (El Contador del Gas)
 * Ganancia neta = bruto - gas - fee de puente. Debe superar el piso absoluto por trade
 * y el mínimo del nivel de gas actual. Sin estado: no adivina, calcula.
 */
public class ProfitabilityGate {

    private final double minProfitUsd;
    private final double nativePriceUsd;

    public ProfitabilityGate() {
        this(BotConfig.MIN_PROFIT_USD, BotConfig.NATIVE_PRICE_USD);
    }

    public ProfitabilityGate(double minProfitUsd, double nativePriceUsd) {
        this.minProfitUsd = minProfitUsd;
        this.nativePriceUsd = nativePriceUsd;
    }

    /**
     * Evalúa con el tipo de operación inferido (misma cadena o cross-chain).
     */
    public ProfitabilityVerdict isProfitable(Opportunity opp, double gasGwei, ChainClass chainClass) {
        return isProfitable(opp, gasGwei, chainClass, opp.operationType());
    }

    public ProfitabilityVerdict isProfitable(Opportunity opp, double gasGwei, ChainClass chainClass,
                                             OperationType operation) {
        // 1. NIVEL DE GAS
        GasTier tier = chainClass.classify(gasGwei);
        double tierMinimum = chainClass.minProfitAfterGas(tier);

        // 2. COSTO DE GAS EN USD
        double gasCost = estimateGasCostUsd(gasGwei, chainClass, operation);

        // 3. NETO
        double net = opp.estimatedProfitUsd() - gasCost - opp.estimatedBridgeFeeUsd();
        double required = Math.max(minProfitUsd, tierMinimum);
        boolean profitable = net >= minProfitUsd && net >= tierMinimum;

        String reason = String.format(Locale.US, "%s %s | Bruto $%.2f - Gas $%.2f - Puente $%.2f = Neto $%.2f %s $%.2f",
                chainClass, tier, opp.estimatedProfitUsd(), gasCost, opp.estimatedBridgeFeeUsd(), net,
                profitable ? ">=" : "<", required);
        return new ProfitabilityVerdict(profitable, net, tier, gasCost, required, reason);
    }

    /**
     * units · gwei · 1e-9 · precio nativo, nunca por debajo del piso de la clase de cadena.
     */
    public double estimateGasCostUsd(double gasGwei, ChainClass chainClass, OperationType operation) {
        double raw = operation.gasUnits() * Math.max(0.0, gasGwei) * 1e-9 * nativePriceUsd;
        return Math.max(chainClass.gasCostFloorUsd(), raw);
    }
}
