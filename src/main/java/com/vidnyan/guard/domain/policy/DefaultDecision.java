package com.vidnyan.guard.domain.policy;

/**
 * Decision applied when no policy clause matches an edge.
 */
public enum DefaultDecision {
    ALLOW,
    DENY;

    public boolean allows() {
        return this == ALLOW;
    }
}
