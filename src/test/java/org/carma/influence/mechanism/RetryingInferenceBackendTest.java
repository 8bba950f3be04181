package org.carma.influence.mechanism;

import org.carma.influence.mechanism.InferenceBackend.InferenceResult;
import org.carma.influence.model.Role;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryingInferenceBackendTest {

    private static final InferenceRequest REQUEST =
        new InferenceRequest(Role.CRITIC, "", "Decide [seed=1] [round=1]", 0.7, 1, true);

    @Mock
    private InferenceBackend delegate;

    private RetryingInferenceBackend retrying(int attempts) {
        return new RetryingInferenceBackend(delegate, attempts, Duration.ofMillis(1), 1.5);
    }

    @Test
    void retriesTransientFailuresUntilSuccess() {
        when(delegate.complete(any())).thenReturn(
            InferenceResult.transientFailure("HTTP 503", 1),
            InferenceResult.transientFailure("timeout", 1),
            InferenceResult.success("{\"decision\":\"APPROVE\"}", 1));

        InferenceResult result = retrying(3).complete(REQUEST);

        assertThat(result.isSuccess()).isTrue();
        verify(delegate, times(3)).complete(REQUEST);
    }

    @Test
    void returnsLastTransientFailureWhenAttemptsRunOut() {
        when(delegate.complete(any())).thenReturn(InferenceResult.transientFailure("HTTP 429", 1));

        InferenceResult result = retrying(3).complete(REQUEST);

        assertThat(result.isTransientFailure()).isTrue();
        assertThat(result.getError()).isEqualTo("HTTP 429");
        verify(delegate, times(3)).complete(REQUEST);
    }

    @Test
    void permanentFailuresAreNotRetried() {
        when(delegate.complete(any())).thenReturn(InferenceResult.permanentFailure("HTTP 401", 1));

        InferenceResult result = retrying(5).complete(REQUEST);

        assertThat(result.getStatus()).isEqualTo(InferenceResult.Status.PERMANENT_FAILURE);
        verify(delegate, times(1)).complete(REQUEST);
    }

    @Test
    void singleAttemptMeansNoRetry() {
        when(delegate.complete(any())).thenReturn(InferenceResult.transientFailure("HTTP 500", 1));

        retrying(1).complete(REQUEST);

        verify(delegate, times(1)).complete(REQUEST);
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> retrying(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shutdownReachesDelegate() {
        retrying(2).shutdown();

        verify(delegate).shutdown();
    }
}
