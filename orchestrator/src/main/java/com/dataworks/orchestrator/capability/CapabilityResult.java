package com.dataworks.orchestrator.capability;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of one capability invocation.
 *
 * @param success true when the capability completed normally
 * @param payload string or structured result (lists, maps); null on failure
 * @param error   failure description; null on success
 */
public record CapabilityResult(boolean success, Object payload, String error) {

    public static final String UNKNOWN_CAPABILITY = "unknown capability";
    public static final String TIMEOUT = "timeout";

    public static CapabilityResult ok(Object payload) {
        return new CapabilityResult(true, payload, null);
    }

    public static CapabilityResult failure(String error) {
        return new CapabilityResult(false, null, error);
    }

    public static CapabilityResult rejected(String reason) {
        return new CapabilityResult(false, null, "rejected: " + reason);
    }

    public static CapabilityResult timeout() {
        return failure(TIMEOUT);
    }

    @JsonIgnore
    public boolean isTimeout() {
        return !success && TIMEOUT.equals(error);
    }
}
