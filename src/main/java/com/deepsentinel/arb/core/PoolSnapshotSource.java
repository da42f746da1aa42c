package com.deepsentinel.arb.core;

import com.deepsentinel.arb.domain.PoolSnapshot;

import java.util.List;

/**
 * Pull-model market data feed, called once per tick.
 */
public interface PoolSnapshotSource {

    List<PoolSnapshot> getSnapshots();
}
