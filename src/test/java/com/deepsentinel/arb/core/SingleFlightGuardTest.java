package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SingleFlightGuardTest {

    @Test
    void globalScopeSharesOneSlot() {
        SingleFlightGuard guard = new SingleFlightGuard(ArbProperties.SingleFlightScope.GLOBAL);

        assertTrue(guard.tryAcquire("a"));
        assertFalse(guard.tryAcquire("b"));
        assertEquals(1, guard.inFlightCount());

        guard.release("a");
        assertTrue(guard.tryAcquire("b"));
    }

    @Test
    void perOpportunityScopeOnlyBlocksTheSameKey() {
        SingleFlightGuard guard = new SingleFlightGuard(ArbProperties.SingleFlightScope.PER_OPPORTUNITY);

        assertTrue(guard.tryAcquire("a"));
        assertTrue(guard.tryAcquire("b"));
        assertFalse(guard.tryAcquire("a"));
        assertEquals(2, guard.inFlightCount());

        guard.release("a");
        assertEquals(1, guard.inFlightCount());
    }
}
