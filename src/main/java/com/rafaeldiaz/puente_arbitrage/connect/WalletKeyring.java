package com.rafaeldiaz.puente_arbitrage.connect;

import com.rafaeldiaz.puente_arbitrage.model.PreparedTx;

/**
 * 🔑 Custodia de llaves. El núcleo nunca ve la llave privada, solo pide firmas.
 */
public interface WalletKeyring {

    String address(String chain);

    byte[] sign(String chain, PreparedTx tx, long nonce);
}
