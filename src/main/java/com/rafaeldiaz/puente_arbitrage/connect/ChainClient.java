package com.rafaeldiaz.puente_arbitrage.connect;

import com.rafaeldiaz.puente_arbitrage.model.AssetBalance;
import com.rafaeldiaz.puente_arbitrage.model.ChainClass;
import com.rafaeldiaz.puente_arbitrage.model.TxReceipt;

import java.time.Duration;
import java.util.Optional;

/**
 * ⛓️ Puerto hacia una cadena EVM. La implementación (RPC, proveedor) vive fuera del núcleo.
 * Toda falla de red se reporta como {@link ChainException}.
 */
public interface ChainClient {

    String chain();

    ChainClass chainClass();

    /** Símbolo del activo nativo (ETH, MATIC...). */
    String nativeAsset();

    AssetBalance getNativeBalance(String wallet);

    AssetBalance getTokenBalance(String wallet, String asset);

    double nativePriceUsd();

    double getGasPriceGwei();

    /** Nonce pendiente según el nodo. */
    long getNonce(String address);

    /** Difunde una transacción firmada y devuelve su hash. */
    String submitSignedTx(byte[] signedTx);

    /** Vacío si no hubo recibo dentro del plazo. */
    Optional<TxReceipt> waitForReceipt(String txHash, Duration timeout);
}
