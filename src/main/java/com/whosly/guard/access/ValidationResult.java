package com.whosly.guard.access;

import java.util.Objects;

/**
 * Verdict over a whole SQL batch. A denial names the zero-based index of the
 * first failing statement when the failure is statement specific.
 */
public final class ValidationResult {

    private static final ValidationResult ALLOWED = new ValidationResult(true, null, null);

    private final boolean allowed;
    private final String reason;
    private final Integer statementIndex;

    private ValidationResult(boolean allowed, String reason, Integer statementIndex) {
        this.allowed = allowed;
        this.reason = reason;
        this.statementIndex = statementIndex;
    }

    public static ValidationResult allowed() {
        return ALLOWED;
    }

    public static ValidationResult denied(String reason) {
        return new ValidationResult(false, Objects.requireNonNull(reason, "reason"), null);
    }

    public static ValidationResult denied(String reason, int statementIndex) {
        return new ValidationResult(false, Objects.requireNonNull(reason, "reason"), statementIndex);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getReason() {
        return reason;
    }

    /**
     * @return index of the failing statement, null when allowed or not statement specific
     */
    public Integer getStatementIndex() {
        return statementIndex;
    }

    ValidationResult withReason(String newReason) {
        return new ValidationResult(allowed, newReason, statementIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidationResult)) {
            return false;
        }
        ValidationResult that = (ValidationResult) o;
        return allowed == that.allowed
                && Objects.equals(reason, that.reason)
                && Objects.equals(statementIndex, that.statementIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowed, reason, statementIndex);
    }

    @Override
    public String toString() {
        return allowed ? "ValidationResult{allowed}"
                : "ValidationResult{denied, statementIndex=" + statementIndex + ", reason='" + reason + "'}";
    }
}
