package com.rafaeldiaz.puente_arbitrage.core.analysis;

import com.rafaeldiaz.puente_arbitrage.connect.ChainClient;
import com.rafaeldiaz.puente_arbitrage.connect.ChainDirectory;
import com.rafaeldiaz.puente_arbitrage.connect.ChainException;
import com.rafaeldiaz.puente_arbitrage.connect.DexRouter;
import com.rafaeldiaz.puente_arbitrage.connect.WalletKeyring;
import com.rafaeldiaz.puente_arbitrage.core.orchestrator.BotConfig;
import com.rafaeldiaz.puente_arbitrage.execution.TransactionDispatcher;
import com.rafaeldiaz.puente_arbitrage.model.AssetBalance;
import com.rafaeldiaz.puente_arbitrage.model.ConversionPlan;
import com.rafaeldiaz.puente_arbitrage.model.FundingResult;
import com.rafaeldiaz.puente_arbitrage.model.PreparedTx;
import com.rafaeldiaz.puente_arbitrage.model.SwapQuote;
import com.rafaeldiaz.puente_arbitrage.model.TxReceipt;
import com.rafaeldiaz.puente_arbitrage.model.WalletSnapshot;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 🧠 CFO JUST-IN-TIME (Gestor Inteligente de Saldos)
 * Mantiene una foto corta de saldos por cadena y, si el nativo no alcanza para el trade + reserva de gas,
 * convierte UN activo de respaldo respetando su reserva mínima.
 */
public class SmartBalanceManager {

    private static final double DEFAULT_MIN_RESERVE_USD = 10.0;

    private final ChainDirectory chains;
    private final DexRouter router;
    private final TransactionDispatcher dispatcher;
    private final WalletKeyring keyring;
    private final Clock clock;

    private final double gasReserveUsd;
    private final Duration cacheTtl;
    private final String conversionVenue;
    private final List<String> conversionPriority;
    private final Map<String, Double> minReservesUsd;
    private final double maxSlippage;

    // Caché de fotos por cadena
    private final Map<String, WalletSnapshot> snapshotCache = new ConcurrentHashMap<>();

    public SmartBalanceManager(ChainDirectory chains, DexRouter router, TransactionDispatcher dispatcher,
                               WalletKeyring keyring) {
        this(chains, router, dispatcher, keyring, Clock.systemUTC(),
                BotConfig.GAS_RESERVE_USD, Duration.ofMillis(BotConfig.BALANCE_CACHE_MS), BotConfig.CONVERSION_VENUE,
                BotConfig.CONVERSION_PRIORITY, BotConfig.MIN_RESERVES_USD, BotConfig.MAX_SLIPPAGE);
    }

    public SmartBalanceManager(ChainDirectory chains, DexRouter router, TransactionDispatcher dispatcher,
                               WalletKeyring keyring, Clock clock, double gasReserveUsd, Duration cacheTtl,
                               String conversionVenue, List<String> conversionPriority,
                               Map<String, Double> minReservesUsd, double maxSlippage) {
        this.chains = chains;
        this.router = router;
        this.dispatcher = dispatcher;
        this.keyring = keyring;
        this.clock = clock;
        this.gasReserveUsd = gasReserveUsd;
        this.cacheTtl = cacheTtl;
        this.conversionVenue = conversionVenue;
        this.conversionPriority = List.copyOf(conversionPriority);
        this.minReservesUsd = Map.copyOf(minReservesUsd);
        this.maxSlippage = maxSlippage;
    }

    // =========================================================================
    // 💰 FONDEO
    // =========================================================================

    public FundingResult ensureFunds(double requiredUsd, String chain) {
        return ensureFunds(requiredUsd, chain, false);
    }

    public FundingResult ensureFunds(double requiredUsd, String chain, boolean forceRefresh) {
        WalletSnapshot snap;
        try {
            snap = snapshot(chain, forceRefresh);
        } catch (ChainException e) {
            BotLogger.warn("⚠️ CFO: no se pudo leer saldos en " + chain + ": " + e.getMessage());
            return new FundingResult(false, false, "Lectura de saldos fallida: " + e.getMessage(), null);
        }

        double needed = requiredUsd + gasReserveUsd;
        if (snap.nativeUsd() >= needed) {
            return new FundingResult(true, false,
                    String.format(Locale.US, "Nativo $%.2f cubre $%.2f (+ reserva gas $%.2f)",
                            snap.nativeUsd(), requiredUsd, gasReserveUsd),
                    ConversionPlan.notNeeded(availableAboveReserves(snap)));
        }

        double shortfall = needed - snap.nativeUsd();
        ConversionPlan plan = planConversion(snap, shortfall);
        if (!plan.requiresConversion()) {
            BotLogger.warn(String.format(Locale.US, "💸 CFO [%s]: %s (cartera total $%.2f)",
                    chain, plan.reason(), snap.totalUsd()));
            return new FundingResult(false, false, plan.reason(), plan);
        }

        BotLogger.info("🔄 CFO [" + chain + "]: " + plan.reason() + " (faltante $"
                + String.format(Locale.US, "%.2f", shortfall) + ")");
        String failure = executeConversion(snap, plan);
        if (failure != null) {
            BotLogger.warn("❌ CFO [" + chain + "]: conversión fallida: " + failure);
            return new FundingResult(false, false, "Conversión fallida: " + failure, plan);
        }

        // Re-chequeo con foto fresca
        invalidate(chain);
        WalletSnapshot after;
        try {
            after = snapshot(chain, true);
        } catch (ChainException e) {
            return new FundingResult(false, true, "Conversión ejecutada pero re-chequeo fallido: " + e.getMessage(), plan);
        }
        boolean ok = after.nativeUsd() >= needed;
        String details = String.format(Locale.US, "Tras convertir %s: nativo $%.2f / requerido $%.2f",
                plan.sourceAsset(), after.nativeUsd(), needed);
        if (!ok) BotLogger.warn("⚠️ CFO [" + chain + "]: " + details);
        return new FundingResult(ok, true, details, plan);
    }

    /**
     * Escoge UN activo que cubra el faltante. Orden: prioridad fija de conversión y luego
     * el menor disponible suficiente. Nunca propone gastar por debajo de la reserva mínima.
     */
    public ConversionPlan planConversion(WalletSnapshot snap, double shortfallUsd) {
        List<AssetBalance> candidates = new ArrayList<>();
        double totalAvailable = 0.0;
        for (AssetBalance b : snap.assets().values()) {
            if (b.asset().equalsIgnoreCase(snap.nativeAsset())) continue;
            double available = b.usdValue() - minReserve(b.asset());
            if (available <= 0) continue;
            candidates.add(b);
            totalAvailable += available;
        }

        candidates.sort(Comparator.comparingInt((AssetBalance b) -> priorityIndex(b.asset()))
                .thenComparingDouble(b -> b.usdValue() - minReserve(b.asset())));

        for (AssetBalance b : candidates) {
            double available = b.usdValue() - minReserve(b.asset());
            if (available >= shortfallUsd) {
                // Colchón de slippage sin tocar la reserva
                double target = Math.min(available, shortfallUsd * (1 + maxSlippage));
                return ConversionPlan.convert(b.asset(), target, totalAvailable, shortfallUsd);
            }
        }

        String reason = totalAvailable >= shortfallUsd
                ? String.format(Locale.US, "Fragmentado: $%.2f disponible entre activos, ninguno cubre $%.2f",
                totalAvailable, shortfallUsd)
                : String.format(Locale.US, "Insuficiente: faltan $%.2f, disponible sobre reservas $%.2f",
                shortfallUsd, totalAvailable);
        return ConversionPlan.infeasible(totalAvailable, shortfallUsd, reason);
    }

    // =========================================================================
    // 📸 FOTOS DE SALDO
    // =========================================================================

    public WalletSnapshot snapshot(String chain, boolean forceRefresh) {
        String key = chain.toLowerCase(Locale.ROOT);
        WalletSnapshot cached = snapshotCache.get(key);
        if (!forceRefresh && cached != null && !cached.isExpired(clock.instant(), cacheTtl)) {
            return cached;
        }
        WalletSnapshot fresh = fetchSnapshot(chain);
        snapshotCache.put(key, fresh);
        return fresh;
    }

    public void invalidate(String chain) {
        snapshotCache.remove(chain.toLowerCase(Locale.ROOT));
    }

    private WalletSnapshot fetchSnapshot(String chain) {
        ChainClient client = chains.client(chain);
        String wallet = keyring.address(chain);
        Map<String, AssetBalance> assets = new LinkedHashMap<>();
        assets.put(client.nativeAsset(), client.getNativeBalance(wallet));
        for (String asset : conversionPriority) {
            if (asset.equalsIgnoreCase(client.nativeAsset())) continue;
            assets.put(asset, client.getTokenBalance(wallet, asset));
        }
        return new WalletSnapshot(chain, wallet, client.nativeAsset(), assets, clock.instant());
    }

    // =========================================================================
    // 🔧 HELPERS
    // =========================================================================

    /** @return null si la conversión se confirmó, o el motivo del fallo */
    private String executeConversion(WalletSnapshot snap, ConversionPlan plan) {
        AssetBalance source = snap.balance(plan.sourceAsset());
        double unitPrice = source.unitPriceUsd();
        if (unitPrice <= 0) return "Precio desconocido para " + plan.sourceAsset();
        double amountIn = plan.targetUsd() / unitPrice;
        try {
            SwapQuote quote = router.quote(snap.chain(), conversionVenue, plan.sourceAsset(), snap.nativeAsset(), amountIn);
            PreparedTx tx = router.swap(quote, quote.minAmountOut(maxSlippage), snap.wallet());
            TxReceipt receipt = dispatcher.dispatch(tx);
            return receipt.success() ? null : "Revertida: " + receipt.revertReason();
        } catch (ChainException e) {
            return e.getMessage();
        }
    }

    private double availableAboveReserves(WalletSnapshot snap) {
        double total = 0.0;
        for (AssetBalance b : snap.assets().values()) {
            if (b.asset().equalsIgnoreCase(snap.nativeAsset())) continue;
            total += Math.max(0.0, b.usdValue() - minReserve(b.asset()));
        }
        return total;
    }

    private double minReserve(String asset) {
        return minReservesUsd.getOrDefault(asset.toUpperCase(Locale.ROOT), DEFAULT_MIN_RESERVE_USD);
    }

    private int priorityIndex(String asset) {
        int idx = conversionPriority.indexOf(asset.toUpperCase(Locale.ROOT));
        return idx >= 0 ? idx : conversionPriority.size();
    }
}
