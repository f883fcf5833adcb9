package com.rafaeldiaz.puente_arbitrage.execution;

import com.rafaeldiaz.puente_arbitrage.connect.ChainClient;
import com.rafaeldiaz.puente_arbitrage.connect.ChainDirectory;
import com.rafaeldiaz.puente_arbitrage.connect.ChainException;
import com.rafaeldiaz.puente_arbitrage.connect.ReceiptTimeoutException;
import com.rafaeldiaz.puente_arbitrage.connect.WalletKeyring;
import com.rafaeldiaz.puente_arbitrage.core.orchestrator.BotConfig;
import com.rafaeldiaz.puente_arbitrage.model.PreparedTx;
import com.rafaeldiaz.puente_arbitrage.model.TxReceipt;
import com.rafaeldiaz.puente_arbitrage.utils.BotLogger;

import java.time.Duration;
import java.util.Optional;

/**
 * 🚀 DESPACHADOR DE TRANSACCIONES
 * nonce → firma → envío → recibo. Un solo intento por transacción.
 * Sin recibo o con error de envío el nonce queda marcado como incierto.
 */
public class TransactionDispatcher {

    private final ChainDirectory chains;
    private final WalletKeyring keyring;
    private final NonceManager nonces;
    private final Duration receiptTimeout;

    public TransactionDispatcher(ChainDirectory chains, WalletKeyring keyring, NonceManager nonces) {
        this(chains, keyring, nonces, Duration.ofMillis(BotConfig.RECEIPT_TIMEOUT_MS));
    }

    public TransactionDispatcher(ChainDirectory chains, WalletKeyring keyring, NonceManager nonces,
                                 Duration receiptTimeout) {
        this.chains = chains;
        this.keyring = keyring;
        this.nonces = nonces;
        this.receiptTimeout = receiptTimeout;
    }

    /**
     * @return recibo confirmado (puede venir con {@code success=false} si la tx revirtió)
     * @throws ReceiptTimeoutException si la tx salió a la red pero no llegó recibo dentro del plazo
     * @throws ChainException si el envío falla antes de salir a la red
     */
    public TxReceipt dispatch(PreparedTx tx) {
        ChainClient client = chains.client(tx.chain());
        String from = keyring.address(tx.chain());
        try {
            long nonce = nonces.next(client, from);
            byte[] signed = keyring.sign(tx.chain(), tx, nonce);
            String hash = client.submitSignedTx(signed);
            BotLogger.info("📤 [" + tx.chain() + "] " + tx.description() + " | nonce " + nonce + " | " + hash);

            Optional<TxReceipt> receipt = client.waitForReceipt(hash, receiptTimeout);
            if (receipt.isEmpty()) {
                throw new ReceiptTimeoutException(tx.chain(), hash,
                        "Sin recibo para " + hash + " tras " + receiptTimeout.toSeconds() + "s");
            }
            TxReceipt r = receipt.get();
            if (!r.success()) {
                BotLogger.warn("↩️ [" + tx.chain() + "] Revertida " + hash + ": " + r.revertReason());
            }
            return r;
        } catch (RuntimeException e) {
            // Firma, envío o recibo fallidos: el nonce local ya no es confiable
            nonces.markUncertain(tx.chain(), from);
            throw e;
        }
    }
}
