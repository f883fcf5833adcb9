package com.rafaeldiaz.puente_arbitrage.connect;

import com.rafaeldiaz.puente_arbitrage.model.AssetBalance;
import com.rafaeldiaz.puente_arbitrage.model.ChainClass;
import com.rafaeldiaz.puente_arbitrage.model.TxReceipt;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 🔁 Decorador que reintenta las LECTURAS de un {@link ChainClient} con la política central.
 * El envío de transacciones firmadas pasa una sola vez: reintentarlo puede duplicar un trade.
 */
public class RetryingChainClient implements ChainClient {

    private final ChainClient delegate;
    private final RetryPolicy policy;

    public RetryingChainClient(ChainClient delegate, RetryPolicy policy) {
        this.delegate = delegate;
        this.policy = policy;
    }

    @Override public String chain() { return delegate.chain(); }
    @Override public ChainClass chainClass() { return delegate.chainClass(); }
    @Override public String nativeAsset() { return delegate.nativeAsset(); }

    @Override
    public AssetBalance getNativeBalance(String wallet) {
        return withRetry("nativeBalance", () -> delegate.getNativeBalance(wallet));
    }

    @Override
    public AssetBalance getTokenBalance(String wallet, String asset) {
        return withRetry("tokenBalance " + asset, () -> delegate.getTokenBalance(wallet, asset));
    }

    @Override
    public double nativePriceUsd() {
        return withRetry("nativePrice", delegate::nativePriceUsd);
    }

    @Override
    public double getGasPriceGwei() {
        return withRetry("gasPrice", delegate::getGasPriceGwei);
    }

    @Override
    public long getNonce(String address) {
        return withRetry("nonce", () -> delegate.getNonce(address));
    }

    @Override
    public String submitSignedTx(byte[] signedTx) {
        return delegate.submitSignedTx(signedTx);
    }

    @Override
    public Optional<TxReceipt> waitForReceipt(String txHash, Duration timeout) {
        return withRetry("receipt " + txHash, () -> delegate.waitForReceipt(txHash, timeout));
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        ChainException last = null;
        for (int attempt = 0; attempt < policy.getMaxAttempts(); attempt++) {
            try {
                return call.get();
            } catch (ChainException e) {
                if (!e.isRetryable()) throw e;
                last = e;
                BotLogger.warn("⚠️ RPC " + chain() + " " + operation + " falló (Intento " + (attempt + 1)
                        + "/" + policy.getMaxAttempts() + "): " + e.getMessage());
            }
            if (attempt + 1 < policy.getMaxAttempts()) {
                try {
                    Thread.sleep(policy.delayMs(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ChainException(chain(), operation + " interrumpido", false, ie);
                }
            }
        }
        throw last;
    }
}
