package com.rafaeldiaz.puente_arbitrage.execution;

import com.rafaeldiaz.puente_arbitrage.connect.BridgeProvider;
import com.rafaeldiaz.puente_arbitrage.connect.ChainClient;
import com.rafaeldiaz.puente_arbitrage.connect.ChainDirectory;
import com.rafaeldiaz.puente_arbitrage.connect.ChainException;
import com.rafaeldiaz.puente_arbitrage.connect.ReceiptTimeoutException;
import com.rafaeldiaz.puente_arbitrage.connect.DexRouter;
import com.rafaeldiaz.puente_arbitrage.connect.WalletKeyring;
import com.rafaeldiaz.puente_arbitrage.core.analysis.BridgeSelector;
import com.rafaeldiaz.puente_arbitrage.core.analysis.BridgeSelector.BridgeChoice;
import com.rafaeldiaz.puente_arbitrage.core.analysis.SmartBalanceManager;
import com.rafaeldiaz.puente_arbitrage.core.orchestrator.BotConfig;
import com.rafaeldiaz.puente_arbitrage.core.orchestrator.ExecutionCallback;
import com.rafaeldiaz.puente_arbitrage.core.scanner.OpportunityFilter;
import com.rafaeldiaz.puente_arbitrage.model.BridgeCompletion;
import com.rafaeldiaz.puente_arbitrage.model.BridgeStatus;
import com.rafaeldiaz.puente_arbitrage.model.BridgeTransfer;
import com.rafaeldiaz.puente_arbitrage.model.FailureKind;
import com.rafaeldiaz.puente_arbitrage.model.FundingResult;
import com.rafaeldiaz.puente_arbitrage.model.Opportunity;
import com.rafaeldiaz.puente_arbitrage.model.PreparedTx;
import com.rafaeldiaz.puente_arbitrage.model.SagaResult;
import com.rafaeldiaz.puente_arbitrage.model.SagaStage;
import com.rafaeldiaz.puente_arbitrage.model.StrandedPosition;
import com.rafaeldiaz.puente_arbitrage.model.SwapQuote;
import com.rafaeldiaz.puente_arbitrage.model.TxReceipt;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ⚡ SAGA DE ARBITRAJE CROSS-CHAIN
 * validar → fondear → comprar → puentear → esperar → vender. Pasos estrictamente secuenciales,
 * sin reintentos: re-detectar la oportunidad es trabajo del escáner.
 * <p>
 * Antes de BRIDGED cualquier fallo es un FAILED limpio (el capital sigue en origen).
 * Un envío al puente sin recibo cuenta como BRIDGED: su resultado se desconoce.
 * Desde BRIDGED el único final posible distinto de SOLD es STRANDED_FUNDS.
 * {@link #run} nunca lanza.
 */
public class CrossChainArbitrageSaga implements ExecutionCallback {

    /** Parámetros de tamaño de posición. */
    public record Sizing(double hardCapUsd, double totalCapitalUsd, double maxTradePercentage,
                         double minTradeUsd, double profitMultiplier, double maxSlippage) {

        public static Sizing fromConfig() {
            return new Sizing(BotConfig.MAX_CROSS_CHAIN_TRADE_USD, BotConfig.TOTAL_CAPITAL_USD,
                    BotConfig.MAX_TRADE_PERCENTAGE, BotConfig.MIN_TRADE_USD, BotConfig.PROFIT_SIZE_MULTIPLIER,
                    BotConfig.MAX_SLIPPAGE);
        }

        /** min(tope duro, % de cartera, max(profit·multiplicador, piso)). */
        public double tradeSizeUsd(double estimatedProfitUsd) {
            double walletCap = totalCapitalUsd * maxTradePercentage;
            double heuristic = Math.max(estimatedProfitUsd * profitMultiplier, minTradeUsd);
            return Math.min(hardCapUsd, Math.min(walletCap, heuristic));
        }
    }

    private final ChainDirectory chains;
    private final DexRouter router;
    private final BridgeSelector bridges;
    private final SmartBalanceManager balances;
    private final TransactionDispatcher dispatcher;
    private final WalletKeyring keyring;
    private final StrandedFundsLedger ledger;
    private final Sizing sizing;
    private final Clock clock;

    private boolean dryRun = BotConfig.DRY_RUN;
    private Duration bridgePollInterval = Duration.ofMillis(BotConfig.BRIDGE_POLL_INTERVAL_MS);
    private OpportunityFilter venueLearner;

    // Rutas en vuelo (token + par de cadenas)
    private final Set<String> activeRoutes = ConcurrentHashMap.newKeySet();

    public CrossChainArbitrageSaga(ChainDirectory chains, DexRouter router, BridgeSelector bridges,
                                   SmartBalanceManager balances, TransactionDispatcher dispatcher,
                                   WalletKeyring keyring, StrandedFundsLedger ledger) {
        this(chains, router, bridges, balances, dispatcher, keyring, ledger, Sizing.fromConfig(), Clock.systemUTC());
    }

    public CrossChainArbitrageSaga(ChainDirectory chains, DexRouter router, BridgeSelector bridges,
                                   SmartBalanceManager balances, TransactionDispatcher dispatcher,
                                   WalletKeyring keyring, StrandedFundsLedger ledger, Sizing sizing, Clock clock) {
        this.chains = chains;
        this.router = router;
        this.bridges = bridges;
        this.balances = balances;
        this.dispatcher = dispatcher;
        this.keyring = keyring;
        this.ledger = ledger;
        this.sizing = sizing;
        this.clock = clock;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
        if (!dryRun) BotLogger.warn("⚠️ SAGA CROSS-CHAIN: MODO FUEGO REAL ACTIVO");
    }

    public void setBridgePollInterval(Duration interval) {
        this.bridgePollInterval = interval;
    }

    /** Los tiempos y resultados de compra/venta alimentan los perfiles de venue del filtro. */
    public void setVenueLearner(OpportunityFilter filter) {
        this.venueLearner = filter;
    }

    public boolean isRouteActive(Opportunity opp) {
        return activeRoutes.contains(opp.routeKey());
    }

    @Override
    public SagaResult execute(Opportunity opportunity) {
        return run(opportunity);
    }

    public SagaResult run(Opportunity opp) {
        String sagaId = "saga_" + UUID.randomUUID().toString().substring(0, 8);
        SagaTrace trace = new SagaTrace(sagaId, opp.id());
        Instant start = clock.instant();

        // Guardia de ruta activa: at-most-once por token + par de cadenas
        if (!activeRoutes.add(opp.routeKey())) {
            return fail(opp, trace, start, FailureKind.FILTERED, "Ruta " + opp.routeKey() + " ya en vuelo");
        }
        try {
            return runSteps(opp, trace, start);
        } catch (RuntimeException e) {
            BotLogger.error("🔥 Error inesperado en " + sagaId + " (" + trace.stage() + "): " + e.getMessage());
            if (trace.stage().isTerminal()) {
                return buildResult(opp, trace, start, null, "Error tras cierre: " + e.getMessage(), false);
            }
            return trace.stage().fundsLeftSourceChain()
                    ? strand(opp, trace, start, FailureKind.STRANDED_FUNDS, "Error inesperado: " + e.getMessage(),
                    opp.targetChain(), trace.tokenAmount)
                    : fail(opp, trace, start, FailureKind.UNEXPECTED, "Error inesperado: " + e.getMessage());
        } finally {
            activeRoutes.remove(opp.routeKey());
        }
    }

    private SagaResult runSteps(Opportunity opp, SagaTrace trace, Instant start) {
        // =====================================================================
        // 1. VALIDAR (el aborto más barato: nada se movió)
        // =====================================================================
        double age = opp.ageSeconds(clock.instant());
        if (age > opp.executionWindow().toMillis() / 1000.0) {
            return fail(opp, trace, start, FailureKind.FILTERED, String.format(Locale.US,
                    "Fuera de ventana: edad %.1fs > %ds", age, opp.executionWindow().toSeconds()));
        }
        if (!opp.isCrossChain()) {
            return fail(opp, trace, start, FailureKind.FILTERED, "La saga solo opera rutas cross-chain");
        }
        if (!chains.supports(opp.sourceChain()) || !chains.supports(opp.targetChain())) {
            return fail(opp, trace, start, FailureKind.FILTERED, "Cadena no registrada en " + opp.route());
        }
        trace.advance(SagaStage.VALIDATED, clock.instant());

        trace.tradeSizeUsd = sizing.tradeSizeUsd(opp.estimatedProfitUsd());

        if (dryRun) {
            BotLogger.info(String.format(Locale.US, "[DRY-RUN] Saga %s: %s %s | Compra %s / Venta %s | Tamaño $%.2f | Profit est. $%.2f",
                    trace.sagaId(), opp.token(), opp.route(), opp.buyVenue(), opp.sellVenue(),
                    trace.tradeSizeUsd, opp.estimatedProfitUsd()));
            return buildResult(opp, trace, start, null, "[DRY-RUN] Plan validado, sin movimiento de fondos", true);
        }

        // =====================================================================
        // 2. FONDEAR
        // =====================================================================
        FundingResult funding = balances.ensureFunds(trace.tradeSizeUsd, opp.sourceChain());
        if (!funding.sufficient()) {
            return fail(opp, trace, start, FailureKind.FUNDING_FAILURE, "Fondeo insuficiente: " + funding.details());
        }
        trace.advance(SagaStage.FUNDED, clock.instant());

        // =====================================================================
        // 3. COMPRAR (nativo -> token en la cadena origen)
        // =====================================================================
        ChainClient source = chains.client(opp.sourceChain());
        long buyStarted = System.nanoTime();
        try {
            double sourceNativePrice = source.nativePriceUsd();
            double amountIn = trace.tradeSizeUsd / sourceNativePrice;
            SwapQuote quote = router.quote(opp.sourceChain(), opp.buyVenue(), source.nativeAsset(), opp.token(), amountIn);
            PreparedTx tx = router.swap(quote, quote.minAmountOut(sizing.maxSlippage()), keyring.address(opp.sourceChain()));
            TxReceipt receipt = dispatcher.dispatch(tx);
            trace.buyReceipt = receipt;
            learnVenue(opp.buyVenue(), buyStarted, receipt.success());
            // Una tx revertida también quema gas
            trace.buyGasUsd = receipt.gasCostUsd(sourceNativePrice);
            if (!receipt.success()) {
                return fail(opp, trace, start, FailureKind.BUY_FAILURE, "Compra revertida: " + receipt.revertReason());
            }
            trace.tokenAmount = receipt.outputAmount() > 0 ? receipt.outputAmount() : quote.amountOut();
        } catch (ChainException e) {
            learnVenue(opp.buyVenue(), buyStarted, false);
            return fail(opp, trace, start, FailureKind.BUY_FAILURE, "Compra fallida: " + e.getMessage());
        }
        trace.advance(SagaStage.BOUGHT, clock.instant());

        // =====================================================================
        // 4. PUENTEAR (un fallo aquí deja los fondos en origen)
        // =====================================================================
        BridgeChoice choice = bridges.select(opp.sourceChain(), opp.targetChain(), opp.token(), trace.tokenAmount)
                .orElse(null);
        if (choice == null) {
            return fail(opp, trace, start, FailureKind.BRIDGE_INITIATION_FAILURE,
                    "Sin puente para " + opp.token() + " " + opp.route());
        }
        BridgeProvider provider = choice.provider();
        try {
            PreparedTx tx = provider.transfer(choice.quote(), keyring.address(opp.targetChain()));
            TxReceipt receipt = dispatcher.dispatch(tx);
            if (!receipt.success()) {
                return fail(opp, trace, start, FailureKind.BRIDGE_INITIATION_FAILURE,
                        "Envío al puente " + provider.name() + " revertido: " + receipt.revertReason());
            }
            trace.bridgeFeeUsd = choice.quote().feeUsd();
            trace.bridgeTransfer = new BridgeTransfer(provider.name(), receipt.txHash(), opp.sourceChain(),
                    opp.targetChain(), opp.token(), trace.tokenAmount, choice.quote().feeUsd(), receipt,
                    BridgeStatus.PENDING, 0.0);
        } catch (ReceiptTimeoutException e) {
            // La tx salió a la red: los fondos pueden estar en vuelo. Se vigila por su hash.
            trace.bridgeFeeUsd = choice.quote().feeUsd();
            trace.bridgeTransfer = new BridgeTransfer(provider.name(), e.getTxHash(), opp.sourceChain(),
                    opp.targetChain(), opp.token(), trace.tokenAmount, choice.quote().feeUsd(), null,
                    BridgeStatus.PENDING, 0.0);
            trace.advance(SagaStage.BRIDGED, clock.instant());
            return strand(opp, trace, start, FailureKind.BRIDGE_TIMEOUT,
                    "Envío al puente " + provider.name() + " sin recibo: " + e.getMessage(),
                    opp.targetChain(), trace.tokenAmount);
        } catch (ChainException e) {
            return fail(opp, trace, start, FailureKind.BRIDGE_INITIATION_FAILURE,
                    "Puente " + provider.name() + " no iniciado: " + e.getMessage());
        }
        trace.advance(SagaStage.BRIDGED, clock.instant());
        BotLogger.info(String.format(Locale.US, "🌉 Saga %s: %.6f %s en vuelo por %s (fee $%.2f)",
                trace.sagaId(), trace.tokenAmount, opp.token(), provider.name(), trace.bridgeFeeUsd));

        // =====================================================================
        // 5. ESPERAR CONFIRMACIÓN (desde aquí: SOLD o STRANDED_FUNDS)
        // =====================================================================
        BridgeCompletion completion = awaitBridge(provider, trace.bridgeTransfer);
        if (completion.status() == BridgeStatus.PENDING) {
            return strand(opp, trace, start, FailureKind.BRIDGE_TIMEOUT,
                    "Puente " + provider.name() + " sin confirmar tras " + provider.completionTimeout().toMinutes() + " min",
                    opp.targetChain(), trace.tokenAmount);
        }
        trace.bridgeTransfer = trace.bridgeTransfer.withCompletion(completion);
        if (completion.status() == BridgeStatus.FAILED) {
            return strand(opp, trace, start, FailureKind.STRANDED_FUNDS,
                    "Puente " + provider.name() + " reportó fallo", opp.sourceChain(), trace.tokenAmount);
        }
        trace.advance(SagaStage.BRIDGE_CONFIRMED, clock.instant());

        double received = completion.amountReceived() > 0 ? completion.amountReceived() : choice.quote().expectedAmountOut();

        // =====================================================================
        // 6. VENDER (token -> nativo en la cadena destino)
        // =====================================================================
        ChainClient target = chains.client(opp.targetChain());
        long sellStarted = System.nanoTime();
        try {
            double targetNativePrice = target.nativePriceUsd();
            SwapQuote quote = router.quote(opp.targetChain(), opp.sellVenue(), opp.token(), target.nativeAsset(), received);
            PreparedTx tx = router.swap(quote, quote.minAmountOut(sizing.maxSlippage()), keyring.address(opp.targetChain()));
            TxReceipt receipt = dispatcher.dispatch(tx);
            trace.sellReceipt = receipt;
            learnVenue(opp.sellVenue(), sellStarted, receipt.success());
            if (!receipt.success()) {
                return strand(opp, trace, start, FailureKind.STRANDED_FUNDS,
                        "Venta revertida: " + receipt.revertReason(), opp.targetChain(), received);
            }
            trace.sellGasUsd = receipt.gasCostUsd(targetNativePrice);
            double proceeds = (receipt.outputAmount() > 0 ? receipt.outputAmount() : quote.amountOut()) * targetNativePrice;
            trace.advance(SagaStage.SOLD, clock.instant());

            double net = proceeds - trace.tradeSizeUsd - trace.bridgeFeeUsd - (trace.buyGasUsd + trace.sellGasUsd);
            return complete(opp, trace, start, net);
        } catch (ChainException e) {
            learnVenue(opp.sellVenue(), sellStarted, false);
            return strand(opp, trace, start, FailureKind.STRANDED_FUNDS,
                    "Venta fallida: " + e.getMessage(), opp.targetChain(), received);
        }
    }

    /**
     * Sondea el puente hasta su timeout. PENDING al volver significa que venció el plazo.
     */
    private BridgeCompletion awaitBridge(BridgeProvider provider, BridgeTransfer transfer) {
        long deadline = System.nanoTime() + provider.completionTimeout().toNanos();
        while (true) {
            try {
                BridgeCompletion c = provider.awaitCompletion(transfer.sourceChain(), transfer.transferId());
                if (c != null && c.status() != BridgeStatus.PENDING) return c;
            } catch (ChainException e) {
                BotLogger.warn("⚠️ Sondeo de " + provider.name() + " falló: " + e.getMessage());
            }
            if (System.nanoTime() >= deadline) return BridgeCompletion.pending();
            try {
                Thread.sleep(bridgePollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                BotLogger.warn("⏹️ Espera del puente interrumpida (" + transfer.transferId() + ")");
                return BridgeCompletion.pending();
            }
        }
    }

    // =========================================================================
    // 🏁 CIERRES
    // =========================================================================

    private SagaResult complete(Opportunity opp, SagaTrace trace, Instant start, double net) {
        SagaResult result = buildResult(opp, trace, start, null,
                String.format(Locale.US, "✅ CROSS WIN: PnL neto $%.4f", net), false, net, 0.0);
        BotLogger.info("✅ Saga " + trace.sagaId() + " " + opp.token() + " " + opp.route() + ": " + result.message());
        return result;
    }

    private SagaResult fail(Opportunity opp, SagaTrace trace, Instant start, FailureKind kind, String message) {
        trace.advance(SagaStage.FAILED, clock.instant());
        double loss = trace.buyGasUsd;
        SagaResult result = buildResult(opp, trace, start, kind, message, false, 0.0, loss);
        if (kind == FailureKind.FILTERED) {
            BotLogger.info("⏭️ Saga " + trace.sagaId() + " descartada: " + message);
        } else {
            BotLogger.warn("❌ Saga " + trace.sagaId() + " " + kind + ": " + message);
        }
        return result;
    }

    private SagaResult strand(Opportunity opp, SagaTrace trace, Instant start, FailureKind kind, String message,
                              String chainHoldingFunds, double amount) {
        trace.advance(SagaStage.STRANDED_FUNDS, clock.instant());
        // Pérdida acotada a los fees ya gastados; el token varado no se valoriza
        double loss = trace.spentFeesUsd();
        SagaResult result = buildResult(opp, trace, start, kind, message, false, 0.0, loss);
        BridgeTransfer transfer = trace.bridgeTransfer;
        ledger.record(new StrandedPosition(trace.sagaId(), opp.id(), opp.token(), opp.sourceChain(),
                opp.targetChain(), chainHoldingFunds, amount, kind, loss,
                transfer != null ? transfer.bridge() : null, transfer != null ? transfer.transferId() : null,
                clock.instant(), false));
        return result;
    }

    private SagaResult buildResult(Opportunity opp, SagaTrace trace, Instant start, FailureKind kind,
                                   String message, boolean simulated) {
        return buildResult(opp, trace, start, kind, message, simulated, 0.0, 0.0);
    }

    private SagaResult buildResult(Opportunity opp, SagaTrace trace, Instant start, FailureKind kind, String message,
                                   boolean simulated, double net, double loss) {
        SagaResult result = new SagaResult(trace.sagaId(), opp.id(), opp.token(), opp.route(), trace.stage(), kind,
                trace.tradeSizeUsd, trace.buyReceipt, trace.bridgeTransfer, trace.sellReceipt, net, loss, message,
                simulated, Duration.between(start, clock.instant()));
        BotLogger.logSaga(trace.sagaId(), opp.token(), opp.route(), trace.stage().name(),
                kind != null ? kind.name() : (simulated ? "DRY_RUN" : ""), net, loss);
        return result;
    }

    private void learnVenue(String venue, long startedNanos, boolean success) {
        if (venueLearner == null) return;
        double seconds = (System.nanoTime() - startedNanos) / 1e9;
        venueLearner.updateVenueProfile(venue, seconds, success);
    }
}
