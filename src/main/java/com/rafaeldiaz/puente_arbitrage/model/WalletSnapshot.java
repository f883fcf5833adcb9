package com.rafaeldiaz.puente_arbitrage.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 📸 Foto de saldos de una billetera en una cadena. Propiedad del SmartBalanceManager.
 */
public record WalletSnapshot(
        String chain,
        String wallet,
        String nativeAsset,
        Map<String, AssetBalance> assets,
        Instant fetchedAt
) {

    public WalletSnapshot {
        assets = Map.copyOf(assets);
    }

    public AssetBalance balance(String asset) {
        return assets.getOrDefault(asset, AssetBalance.empty(asset));
    }

    public double nativeUsd() {
        return balance(nativeAsset).usdValue();
    }

    public double totalUsd() {
        return assets.values().stream().mapToDouble(AssetBalance::usdValue).sum();
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) >= 0;
    }
}
