package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-blocking "at most one in flight" guard. With {@code GLOBAL} scope every key shares one slot.
 */
public class SingleFlightGuard {

    private static final String GLOBAL_KEY = "*";

    private final ArbProperties.SingleFlightScope scope;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public SingleFlightGuard(ArbProperties.SingleFlightScope scope) {
        this.scope = scope;
    }

    public boolean tryAcquire(String key) {
        return inFlight.add(slot(key));
    }

    public void release(String key) {
        inFlight.remove(slot(key));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private String slot(String key) {
        return scope == ArbProperties.SingleFlightScope.GLOBAL ? GLOBAL_KEY : key;
    }
}
