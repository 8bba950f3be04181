package org.carma.influence.mechanism;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.carma.influence.config.HarnessConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries transient failures of another backend with exponential backoff.
 *
 * Permanent failures and successes pass straight through. When the attempts are
 * exhausted the last transient failure is returned, so the caller sees a value and
 * decides what the failed turn means.
 */
public class RetryingInferenceBackend implements InferenceBackend {

    private static final Logger log = LoggerFactory.getLogger(RetryingInferenceBackend.class);

    private final InferenceBackend delegate;
    private final Retry retry;
    private final int maxAttempts;

    public RetryingInferenceBackend(InferenceBackend delegate, int maxAttempts,
                                    Duration initialBackoff, double backoffMultiplier) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;

        RetryConfig config = RetryConfig.<InferenceResult>custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                Math.max(1L, initialBackoff.toMillis()), Math.max(1.0, backoffMultiplier)))
            .retryOnResult(InferenceResult::isTransientFailure)
            .failAfterMaxAttempts(false)
            .build();
        this.retry = Retry.of("inference-" + delegate.getName(), config);
        this.retry.getEventPublisher().onRetry(event ->
            log.debug("Retrying inference call (attempt {} of {}) after {}",
                event.getNumberOfRetryAttempts() + 1, maxAttempts, event.getWaitInterval()));
    }

    public RetryingInferenceBackend(InferenceBackend delegate, HarnessConfig.Inference inference) {
        this(delegate, inference.maxAttempts(), inference.initialBackoff(), inference.backoffMultiplier());
    }

    @Override
    public InferenceResult complete(InferenceRequest request) {
        InferenceResult result = retry.executeSupplier(() -> delegate.complete(request));
        if (result.isTransientFailure()) {
            log.warn("Inference for {} still failing after {} attempts: {}",
                request.role(), maxAttempts, result.getError());
        }
        return result;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String getName() {
        return "Retrying(" + delegate.getName() + ")";
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }
}
