package io.ledger.core.protocol;

import java.util.Objects;

/**
 * Outcome of applying one record: either accepted, or rejected with a reason.
 * Rejections are routine and travel as values.
 */
public final class ApplyResult {
    private static final ApplyResult OK = new ApplyResult(true, null, null);

    public final boolean ok;
    public final RejectionReason reason;
    public final String message;

    private ApplyResult(boolean ok, RejectionReason reason, String message) {
        this.ok = ok; this.reason = reason; this.message = message;
    }

    public static ApplyResult ok() { return OK; }

    public static ApplyResult rejected(RejectionReason reason, String message) {
        return new ApplyResult(false, Objects.requireNonNull(reason, "reason"), message);
    }

    public boolean isRejected() { return !ok; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApplyResult)) return false;
        ApplyResult that = (ApplyResult) o;
        return ok == that.ok && reason == that.reason && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ok, reason, message);
    }

    @Override public String toString() {
        return ok ? "OK" : ("REJECTED[" + reason + "]: " + message);
    }
}
