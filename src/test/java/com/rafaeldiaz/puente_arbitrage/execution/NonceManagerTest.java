package com.rafaeldiaz.puente_arbitrage.execution;

import com.rafaeldiaz.puente_arbitrage.connect.ChainClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class NonceManagerTest {

    @Mock private ChainClient arbitrum;
    @Mock private ChainClient base;

    private NonceManager nonces;

    @BeforeEach
    void setUp() {
        when(arbitrum.chain()).thenReturn("arbitrum");
        when(base.chain()).thenReturn("base");
        nonces = new NonceManager();
    }

    @Test
    @DisplayName("🔢 Primer uso consulta al nodo, luego secuencia local")
    void firstUseFetchesThenIncrements() {
        when(arbitrum.getNonce("0xa")).thenReturn(41L);

        assertEquals(41, nonces.next(arbitrum, "0xa"));
        assertEquals(42, nonces.next(arbitrum, "0xa"));
        assertEquals(43, nonces.next(arbitrum, "0xa"));

        verify(arbitrum, times(1)).getNonce("0xa");
        assertEquals(43, nonces.lastIssued("arbitrum", "0xa").getAsLong());
    }

    @Test
    @DisplayName("🧭 Cada (cadena, dirección) lleva su propia secuencia")
    void sequencesAreIndependent() {
        when(arbitrum.getNonce("0xa")).thenReturn(5L);
        when(base.getNonce("0xa")).thenReturn(100L);

        nonces.next(arbitrum, "0xa");
        assertEquals(100, nonces.next(base, "0xa"));
        assertEquals(6, nonces.next(arbitrum, "0xa"));
        assertTrue(nonces.lastIssued("base", "0xb").isEmpty());
    }

    @Test
    @DisplayName("❓ Tras un envío incierto se adopta el valor del nodo")
    void uncertainNonceIsReconciledWithNode() {
        when(arbitrum.getNonce("0xa")).thenReturn(10L, 10L);

        assertEquals(10, nonces.next(arbitrum, "0xa"));
        nonces.markUncertain("arbitrum", "0xa");

        // El nodo nunca vio el 10: se reutiliza
        assertEquals(10, nonces.next(arbitrum, "0xa"));
        assertEquals(11, nonces.next(arbitrum, "0xa"));
        verify(arbitrum, times(2)).getNonce("0xa");
    }
}
