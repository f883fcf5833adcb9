package com.rafaeldiaz.puente_arbitrage.core.analysis;

import com.rafaeldiaz.puente_arbitrage.model.ChainClass;
import com.rafaeldiaz.puente_arbitrage.model.GasTier;
import com.rafaeldiaz.puente_arbitrage.model.OperationType;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;
import com.rafaeldiaz.puente_arbitrage.model.ProfitabilityVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ProfitabilityGateTest {

    private final ProfitabilityGate gate = new ProfitabilityGate(0.25, 2500.0);

    private Opportunity opp(String src, String dst, double gross, double bridgeFee) {
        return Opportunity.builder()
                .token("ARB").sourceChain(src).targetChain(dst)
                .buyVenue("sushiswap").sellVenue("uniswap_v3")
                .buyPrice(1.0).sellPrice(1.05)
                .discoveredAt(Instant.parse("2025-06-01T12:00:00Z"))
                .estimatedProfitUsd(gross)
                .estimatedBridgeFeeUsd(bridgeFee)
                .build();
    }

    @Test
    @DisplayName("💎 Escenario B: $5 bruto en cadena barata ULTRA_LOW -> rentable, neto ≈ $4.80")
    void scenarioB() {
        ProfitabilityVerdict v = gate.isProfitable(opp("arbitrum", "optimism", 5.0, 0.0), 0.05, ChainClass.CHEAP);

        System.out.println("🧪 " + v.reason());
        assertTrue(v.profitable());
        assertEquals(GasTier.ULTRA_LOW, v.gasTier());
        assertEquals(0.05, ChainClass.CHEAP.minProfitAfterGas(v.gasTier()), 1e-12);
        assertEquals(4.80, v.netProfitUsd(), 1e-9);
    }

    @Test
    @DisplayName("⛽ Niveles de gas por clase de cadena")
    void tierClassification() {
        assertEquals(GasTier.ULTRA_LOW, ChainClass.CHEAP.classify(0.1));
        assertEquals(GasTier.LOW, ChainClass.CHEAP.classify(0.2));
        assertEquals(GasTier.MEDIUM, ChainClass.CHEAP.classify(0.5));
        assertEquals(GasTier.HIGH, ChainClass.CHEAP.classify(0.9));
        assertEquals(GasTier.EXTREME, ChainClass.CHEAP.classify(3.0));

        assertEquals(GasTier.ULTRA_LOW, ChainClass.EXPENSIVE.classify(10));
        assertEquals(GasTier.MEDIUM, ChainClass.EXPENSIVE.classify(30));
        assertEquals(GasTier.EXTREME, ChainClass.EXPENSIVE.classify(61));
    }

    @Test
    @DisplayName("🔥 Mainnet en EXTREME: el gas se come el profit")
    void expensiveExtremeIsRejected() {
        // 200k * 70 gwei * 2500 = $35
        ProfitabilityVerdict v = gate.isProfitable(opp("ethereum", "arbitrum", 30.0, 0.0), 70, ChainClass.EXPENSIVE);

        assertFalse(v.profitable());
        assertEquals(GasTier.EXTREME, v.gasTier());
        assertEquals(35.0, v.gasCostUsd(), 1e-9);
        assertEquals(50.0, v.requiredMinimumUsd(), 1e-9);
    }

    @Test
    @DisplayName("🏦 Misma cadena en MEDIUM usa 150k unidades de gas")
    void sameChainUsesSameChainUnits() {
        ProfitabilityVerdict v = gate.isProfitable(opp("ethereum", "ethereum", 30.0, 0.0), 30, ChainClass.EXPENSIVE);

        assertEquals(11.25, v.gasCostUsd(), 1e-9);
        assertEquals(18.75, v.netProfitUsd(), 1e-9);
        assertTrue(v.profitable());
    }

    @Test
    @DisplayName("🌉 El fee de puente se descuenta y puede dejar el neto bajo el piso absoluto")
    void bridgeFeeCountsAgainstProfit() {
        ProfitabilityVerdict v = gate.isProfitable(opp("arbitrum", "optimism", 1.0, 0.6), 0.05, ChainClass.CHEAP);

        assertEquals(0.2, v.netProfitUsd(), 1e-9);
        assertFalse(v.profitable(), "Neto $0.20 < piso $0.25");
    }

    @Test
    @DisplayName("⚡ Tipo de operación explícito: flashloan usa 300k unidades")
    void explicitOperationType() {
        double gas = gate.estimateGasCostUsd(20, ChainClass.EXPENSIVE, OperationType.FLASHLOAN);
        assertEquals(15.0, gas, 1e-9);
        assertEquals(0.20, gate.estimateGasCostUsd(0.0, ChainClass.CHEAP, OperationType.COMPLEX), 1e-12);
    }
}
