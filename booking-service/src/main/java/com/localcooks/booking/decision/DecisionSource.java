package com.localcooks.booking.decision;

/** Who asked for a decision. */
public enum DecisionSource {
    MANAGER,
    AUTHORIZATION_EXPIRY
}
