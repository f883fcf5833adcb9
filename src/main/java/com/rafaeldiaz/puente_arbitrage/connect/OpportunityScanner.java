package com.rafaeldiaz.puente_arbitrage.connect;

import com.rafaeldiaz.puente_arbitrage.model.Opportunity;

import java.util.List;

/**
 * Fuente externa de oportunidades candidatas.
 */
public interface OpportunityScanner {

    List<Opportunity> scan();
}
