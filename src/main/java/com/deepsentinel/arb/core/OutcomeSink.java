package com.deepsentinel.arb.core;

import com.deepsentinel.arb.domain.OutcomeRecord;

/**
 * Fire-and-forget consumer of outcome records (persistence, audit logs).
 */
public interface OutcomeSink {

    void emit(OutcomeRecord record);
}
