package com.rafaeldiaz.puente_arbitrage.core.analysis;

import com.rafaeldiaz.puente_arbitrage.MutableClock;
import com.rafaeldiaz.puente_arbitrage.connect.ChainClient;
import com.rafaeldiaz.puente_arbitrage.connect.ChainDirectory;
import com.rafaeldiaz.puente_arbitrage.connect.DexRouter;
import com.rafaeldiaz.puente_arbitrage.connect.RetryPolicy;
import com.rafaeldiaz.puente_arbitrage.connect.WalletKeyring;
import com.rafaeldiaz.puente_arbitrage.execution.TransactionDispatcher;
import com.rafaeldiaz.puente_arbitrage.model.AssetBalance;
import com.rafaeldiaz.puente_arbitrage.model.ChainClass;
import com.rafaeldiaz.puente_arbitrage.model.ConversionPlan;
import com.rafaeldiaz.puente_arbitrage.model.FundingResult;
import com.rafaeldiaz.puente_arbitrage.model.PreparedTx;
import com.rafaeldiaz.puente_arbitrage.model.SwapQuote;
import com.rafaeldiaz.puente_arbitrage.model.TxReceipt;
import com.rafaeldiaz.puente_arbitrage.model.WalletSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.AdditionalMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SmartBalanceManagerTest {

    private static final String CHAIN = "arbitrum";
    private static final String WALLET = "0xwallet";

    @Mock private ChainClient client;
    @Mock private DexRouter router;
    @Mock private WalletKeyring keyring;
    @Mock private TransactionDispatcher dispatcher;

    private MutableClock clock;
    private SmartBalanceManager manager;

    @BeforeEach
    void setUp() {
        when(client.chain()).thenReturn(CHAIN);
        when(client.chainClass()).thenReturn(ChainClass.CHEAP);
        when(client.nativeAsset()).thenReturn("ETH");
        when(keyring.address(CHAIN)).thenReturn(WALLET);
        when(client.getTokenBalance(eq(WALLET), anyString()))
                .thenAnswer(inv -> AssetBalance.empty(inv.getArgument(1)));

        clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        ChainDirectory chains = new ChainDirectory(RetryPolicy.none()).register(client);
        manager = new SmartBalanceManager(chains, router, dispatcher, keyring, clock,
                5.0, Duration.ofSeconds(30), "uniswap_v3",
                List.of("DAI", "USDT", "USDC", "WBTC", "WETH"),
                Map.of("DAI", 10.0, "USDT", 10.0, "USDC", 10.0, "WBTC", 20.0, "WETH", 20.0),
                0.03);
    }

    private void nativeUsd(double usd) {
        when(client.getNativeBalance(WALLET)).thenReturn(new AssetBalance("ETH", usd / 2500.0, usd));
    }

    private void token(String asset, double usd) {
        when(client.getTokenBalance(WALLET, asset)).thenReturn(new AssetBalance(asset, usd, usd));
    }

    private WalletSnapshot snapshot(double nativeUsd, Map<String, Double> tokens) {
        Map<String, AssetBalance> assets = new LinkedHashMap<>();
        assets.put("ETH", new AssetBalance("ETH", nativeUsd / 2500.0, nativeUsd));
        tokens.forEach((k, v) -> assets.put(k, new AssetBalance(k, v, v)));
        return new WalletSnapshot(CHAIN, WALLET, "ETH", assets, clock.instant());
    }

    @Test
    @DisplayName("✅ Nativo cubre trade + reserva de gas: sin conversión")
    void sufficientNativeNeedsNoConversion() {
        nativeUsd(100.0);

        FundingResult r = manager.ensureFunds(40.0, CHAIN);

        assertTrue(r.sufficient());
        assertFalse(r.conversionExecuted());
        verifyNoInteractions(router, dispatcher);
    }

    @Test
    @DisplayName("📸 La foto de saldos se reutiliza dentro del TTL y se refresca al forzar o expirar")
    void snapshotCacheHonoursTtl() {
        nativeUsd(100.0);

        manager.ensureFunds(10.0, CHAIN);
        manager.ensureFunds(10.0, CHAIN);
        verify(client, times(1)).getNativeBalance(WALLET);

        manager.ensureFunds(10.0, CHAIN, true);
        verify(client, times(2)).getNativeBalance(WALLET);

        clock.advance(Duration.ofSeconds(31));
        manager.ensureFunds(10.0, CHAIN);
        verify(client, times(3)).getNativeBalance(WALLET);
    }

    @Test
    @DisplayName("🥇 La prioridad fija manda: DAI antes que USDC aunque USDC tenga más")
    void planFollowsConversionPriority() {
        ConversionPlan plan = manager.planConversion(snapshot(0, Map.of("USDC", 500.0, "DAI", 60.0)), 30.0);

        assertTrue(plan.viable());
        assertTrue(plan.requiresConversion());
        assertEquals("DAI", plan.sourceAsset());
        assertEquals(30.0 * 1.03, plan.targetUsd(), 1e-9);
        assertEquals(540.0, plan.totalAvailableUsd(), 1e-9); // (500-10) + (60-10)
    }

    @Test
    @DisplayName("🛡️ Nunca propone gastar bajo la reserva mínima")
    void planRespectsMinimumReserves() {
        // DAI disponible = 40 - 10 = 30: cubre 29.5 pero el colchón de slippage se recorta a 30
        ConversionPlan plan = manager.planConversion(snapshot(0, Map.of("DAI", 40.0)), 29.5);
        assertEquals("DAI", plan.sourceAsset());
        assertEquals(30.0, plan.targetUsd(), 1e-9);

        // Faltante mayor que todo lo disponible: inviable y sin activo propuesto
        ConversionPlan none = manager.planConversion(snapshot(0, Map.of("DAI", 15.0, "WETH", 25.0)), 500.0);
        assertFalse(none.viable());
        assertNull(none.sourceAsset());
        assertEquals(10.0, none.totalAvailableUsd(), 1e-9);
        assertTrue(none.reason().startsWith("Insuficiente"));
    }

    @Test
    @DisplayName("🧩 Saldo fragmentado: la suma alcanza pero ningún activo solo")
    void fragmentedBalancesAreInfeasible() {
        ConversionPlan plan = manager.planConversion(snapshot(0, Map.of("DAI", 40.0, "USDT", 40.0)), 50.0);

        assertFalse(plan.viable());
        assertFalse(plan.requiresConversion());
        assertEquals(60.0, plan.totalAvailableUsd(), 1e-9);
        assertTrue(plan.reason().startsWith("Fragmentado"));
    }

    @Test
    @DisplayName("🔄 Conversión just-in-time con slippage y re-chequeo forzado")
    void conversionIsExecutedAndRechecked() {
        when(client.getNativeBalance(WALLET))
                .thenReturn(new AssetBalance("ETH", 0.004, 10.0))
                .thenReturn(new AssetBalance("ETH", 0.0204, 51.0));
        token("USDC", 200.0);
        SwapQuote quote = new SwapQuote(CHAIN, "uniswap_v3", "USDC", "ETH", 36.05, 0.01442, 0.001);
        when(router.quote(eq(CHAIN), eq("uniswap_v3"), eq("USDC"), eq("ETH"), anyDouble())).thenReturn(quote);
        PreparedTx tx = new PreparedTx(CHAIN, "0xrouter", "0x", BigInteger.ZERO, 250_000, "swap USDC->ETH");
        when(router.swap(eq(quote), anyDouble(), eq(WALLET))).thenReturn(tx);
        when(dispatcher.dispatch(tx)).thenReturn(new TxReceipt("0xconv", CHAIN, true, 120_000, 0.1, 0.01442, null));

        FundingResult r = manager.ensureFunds(40.0, CHAIN);

        assertTrue(r.sufficient(), r.details());
        assertTrue(r.conversionExecuted());
        assertEquals("USDC", r.plan().sourceAsset());
        // faltante = 45 - 10 = 35 -> 35 * 1.03 = 36.05 USDC
        verify(router).quote(eq(CHAIN), eq("uniswap_v3"), eq("USDC"), eq("ETH"), AdditionalMatchers.eq(36.05, 1e-9));
        verify(router).swap(eq(quote), AdditionalMatchers.eq(0.01442 * 0.97, 1e-12), eq(WALLET));
        verify(client, times(2)).getNativeBalance(WALLET);
    }

    @Test
    @DisplayName("❌ Conversión revertida = fondeo fallido, la saga no debe comprar")
    void revertedConversionIsFundingFailure() {
        nativeUsd(10.0);
        token("DAI", 100.0);
        SwapQuote quote = new SwapQuote(CHAIN, "uniswap_v3", "DAI", "ETH", 36.05, 0.0144, 0.001);
        when(router.quote(anyString(), anyString(), anyString(), anyString(), anyDouble())).thenReturn(quote);
        when(router.swap(any(), anyDouble(), anyString()))
                .thenReturn(new PreparedTx(CHAIN, "0xrouter", "0x", BigInteger.ZERO, 250_000, "swap"));
        when(dispatcher.dispatch(any())).thenReturn(TxReceipt.failed(CHAIN, "0xbad", "slippage"));

        FundingResult r = manager.ensureFunds(40.0, CHAIN);

        assertFalse(r.sufficient());
        assertFalse(r.conversionExecuted());
        assertTrue(r.details().contains("slippage"));
    }

    @Test
    @DisplayName("💸 Insuficiencia agregada reporta el faltante")
    void aggregateInsufficiencyReportsShortfall() {
        nativeUsd(1.0);
        token("DAI", 12.0);

        FundingResult r = manager.ensureFunds(40.0, CHAIN);

        assertFalse(r.sufficient());
        assertFalse(r.plan().requiresConversion());
        assertEquals(13.0, manager.snapshot(CHAIN, false).totalUsd(), 1e-9); // nativo + DAI
        assertEquals(44.0, r.plan().shortfallUsd(), 1e-9);
        assertTrue(r.details().contains("44.00"));
        verifyNoInteractions(dispatcher);
    }
}
