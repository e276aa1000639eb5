package ai.agentcap.router.orch.retry;

import ai.agentcap.router.model.InvocationErrorKind;

import java.util.Locale;

/**
 * Maps executor error text to an {@link InvocationErrorKind}.
 *
 * <p>"not found" and "missing required" denote caller errors that retrying cannot fix.</p>
 */
public final class FailureClassifier {

    static final String TIMEOUT_MARKER = "timed out";

    private FailureClassifier() {
    }

    public static boolean isCallerError(String error) {
        if (error == null) {
            return false;
        }
        String m = error.toLowerCase(Locale.ROOT);
        return m.contains("not found") || m.contains("missing required");
    }

    public static boolean isTimeout(String error) {
        return error != null && error.toLowerCase(Locale.ROOT).contains(TIMEOUT_MARKER);
    }

    public static InvocationErrorKind classify(String error) {
        if (isCallerError(error)) {
            return InvocationErrorKind.CALLER_ERROR;
        }
        if (isTimeout(error)) {
            return InvocationErrorKind.TIMEOUT;
        }
        return InvocationErrorKind.TRANSIENT_EXECUTION;
    }
}
