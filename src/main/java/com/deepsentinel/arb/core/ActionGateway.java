package com.deepsentinel.arb.core;

import com.deepsentinel.arb.domain.ArbitrageAction;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.SimulationResult;
import com.deepsentinel.arb.domain.SubmissionResult;

/**
 * The venue the engine trades against. Implementations report failures through the
 * returned results; anything they throw is treated as an internal error by the engine.
 */
public interface ActionGateway {

    ArbitrageAction buildAction(ArbitrageOpportunity opportunity, double tradeSize);

    SimulationResult simulate(ArbitrageAction action);

    SubmissionResult submit(ArbitrageAction action);
}
