package org.carma.influence.mechanism;

/**
 * Boundary to the external text-generation service.
 *
 * Implementations:
 * - OpenAiInferenceBackend: real calls to an OpenAI-compatible chat completions endpoint
 * - RetryingInferenceBackend: retries transient failures of another backend with backoff
 * - MockInferenceBackend: deterministic offline responses for dry runs and tests
 *
 * Failures are returned as values, never thrown, so callers can tell a transient
 * transport problem from a permanent one.
 */
public interface InferenceBackend {

    /**
     * Result of one completion call.
     */
    final class InferenceResult {

        public enum Status { SUCCESS, TRANSIENT_FAILURE, PERMANENT_FAILURE }

        private final Status status;
        private final String text;
        private final String error;
        private final long durationMs;

        private InferenceResult(Status status, String text, String error, long durationMs) {
            this.status = status;
            this.text = text;
            this.error = error;
            this.durationMs = durationMs;
        }

        public static InferenceResult success(String text, long durationMs) {
            return new InferenceResult(Status.SUCCESS, text != null ? text : "", null, durationMs);
        }

        /**
         * Timeouts, rate limits, transport errors: worth retrying.
         */
        public static InferenceResult transientFailure(String error, long durationMs) {
            return new InferenceResult(Status.TRANSIENT_FAILURE, null, error, durationMs);
        }

        public static InferenceResult permanentFailure(String error, long durationMs) {
            return new InferenceResult(Status.PERMANENT_FAILURE, null, error, durationMs);
        }

        public Status getStatus() { return status; }
        public boolean isSuccess() { return status == Status.SUCCESS; }
        public boolean isTransientFailure() { return status == Status.TRANSIENT_FAILURE; }
        public String getText() { return text; }
        public String getError() { return error; }
        public long getDurationMs() { return durationMs; }

        @Override
        public String toString() {
            return isSuccess()
                ? String.format("InferenceResult[OK, %dms, %d chars]", durationMs, text.length())
                : String.format("InferenceResult[%s, %dms: %s]", status, durationMs, error);
        }
    }

    /**
     * Run one completion. Blocking; bounded by the backend's per-call timeout.
     */
    InferenceResult complete(InferenceRequest request);

    /**
     * Name of this backend (for logging).
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Release resources held by the backend.
     */
    default void shutdown() {
    }
}
