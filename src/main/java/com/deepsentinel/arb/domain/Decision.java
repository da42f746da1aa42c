package com.deepsentinel.arb.domain;

import lombok.Value;

@Value
public class Decision {
    private static final Decision APPROVED = new Decision(true, null);

    boolean approved;
    RejectionReason reason; // null when approved

    public static Decision approve() {
        return APPROVED;
    }

    public static Decision reject(RejectionReason reason) {
        return new Decision(false, reason);
    }
}
