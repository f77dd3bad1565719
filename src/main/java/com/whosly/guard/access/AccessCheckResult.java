package com.whosly.guard.access;

/**
 * Answer of the grant store for one database or table.
 */
public final class AccessCheckResult {

    private final boolean allowed;
    private final String reason;

    private AccessCheckResult(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    public static AccessCheckResult allow(String reason) {
        return new AccessCheckResult(true, reason);
    }

    public static AccessCheckResult deny(String reason) {
        return new AccessCheckResult(false, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return (allowed ? "allowed" : "denied") + (reason == null ? "" : ": " + reason);
    }
}
