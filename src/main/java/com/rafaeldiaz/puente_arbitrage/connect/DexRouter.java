package com.rafaeldiaz.puente_arbitrage.connect;

import com.rafaeldiaz.puente_arbitrage.model.PreparedTx;
import com.rafaeldiaz.puente_arbitrage.model.SwapQuote;

/**
 * 🔄 Puerto hacia los routers DEX (cotizar y construir swaps).
 */
public interface DexRouter {

    SwapQuote quote(String chain, String venue, String tokenIn, String tokenOut, double amountIn);

    PreparedTx swap(SwapQuote quote, double minAmountOut, String recipient);
}
