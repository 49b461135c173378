package com.dataworks.orchestrator.sandbox;

/**
 * Verdict of {@link SandboxGuard#validate}: either allowed, or rejected with a reason.
 */
public record ValidationResult(boolean allowed, String reason) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, reason);
    }

    public boolean rejected() {
        return !allowed;
    }
}
