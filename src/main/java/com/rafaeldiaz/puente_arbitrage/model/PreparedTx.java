package com.rafaeldiaz.puente_arbitrage.model;

import java.math.BigInteger;

/**
 * Transacción sin firmar construida por un colaborador (router DEX o puente).
 * El núcleo le asigna nonce, la manda a firmar y la despacha.
 */
public record PreparedTx(
        String chain,
        String to,
        String data,
        BigInteger value,
        long gasLimit,
        String description
) {}
