package com.phillippitts.swarmcouncil.service.workflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class CancellationTokenTest {

    @Test
    void noneNeverCancels() {
        CancellationToken token = CancellationToken.none();

        assertThat(token.isCancellable()).isFalse();
        assertThat(token.isCancelled()).isFalse();
        assertThatThrownBy(token::cancel).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void manualTokenCancelsOnRequest() {
        CancellationToken token = CancellationToken.manual();
        assertThat(token.isCancelled()).isFalse();

        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).isEqualTo("Workflow cancelled");
    }

    @Test
    void timeoutTokenExpires() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(50));

        await().atMost(Duration.ofSeconds(2)).until(token::isCancelled);
        assertThat(token.reason()).isEqualTo("Workflow deadline exceeded");
    }

    @Test
    void zeroTimeoutMeansNoDeadline() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ZERO);

        assertThat(token.isCancellable()).isTrue();
        assertThat(token.isCancelled()).isFalse();
    }
}
