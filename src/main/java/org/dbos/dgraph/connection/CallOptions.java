package org.dbos.dgraph.connection;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * Per-call settings: an optional deadline and an optional cancellation signal.
 * A call without a deadline uses the connection-level default.
 */
public final class CallOptions {
    public static final CallOptions DEFAULT = new CallOptions(null, null);

    private final Duration deadline;
    private final CompletionStage<?> cancellation;

    private CallOptions(Duration deadline, CompletionStage<?> cancellation) {
        this.deadline = deadline;
        this.cancellation = cancellation;
    }

    public static CallOptions withDeadline(Duration deadline) {
        return DEFAULT.deadline(deadline);
    }

    public static CallOptions withCancellation(CompletionStage<?> cancellation) {
        return DEFAULT.cancellation(cancellation);
    }

    public CallOptions deadline(Duration deadline) {
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("Deadline must be positive: " + deadline);
        }
        return new CallOptions(deadline, cancellation);
    }

    /**
     * Cancel the call when the given stage completes, normally or not.
     * @param cancellation  the cancellation signal.
     * @return              new {@link CallOptions}.
     */
    public CallOptions cancellation(CompletionStage<?> cancellation) {
        return new CallOptions(deadline, cancellation);
    }

    public Duration getDeadline() {
        return deadline;
    }

    public CompletionStage<?> getCancellation() {
        return cancellation;
    }

    public static CallOptions orDefault(CallOptions options) {
        return options == null ? DEFAULT : options;
    }
}
