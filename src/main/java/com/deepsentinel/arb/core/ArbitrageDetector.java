package com.deepsentinel.arb.core;

import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.DynamicParameters;
import com.deepsentinel.arb.domain.PoolSnapshot;

import java.util.List;

public interface ArbitrageDetector {

    /**
     * Returns the opportunities newly derived from this set of snapshots.
     */
    List<ArbitrageOpportunity> detect(List<PoolSnapshot> snapshots, DynamicParameters parameters);
}
