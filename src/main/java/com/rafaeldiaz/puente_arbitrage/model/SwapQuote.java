package com.rafaeldiaz.puente_arbitrage.model;

public record SwapQuote(
        String chain,
        String venue,
        String tokenIn,
        String tokenOut,
        double amountIn,
        double amountOut,
        double priceImpact
) {

    /** Salida mínima aceptable con protección de slippage. */
    public double minAmountOut(double maxSlippage) {
        return amountOut * (1.0 - maxSlippage);
    }
}
