package com.codeforge.orchestrator.llm;

import com.codeforge.orchestrator.support.ScriptedTextGenerator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for ResilientTextGenerator. Backoff is zero so nothing sleeps.
 */
class ResilientTextGeneratorTest {

    static final List<Message> HELLO = List.of(Message.user("hello"));

    final ScriptedTextGenerator delegate = new ScriptedTextGenerator();

    ResilientTextGenerator resilient(int attempts) {
        return new ResilientTextGenerator(delegate, Duration.ofSeconds(5), attempts, 0);
    }

    @Test
    void complete_firstAttemptSucceeds() {
        delegate.reply("hi there");

        assertThat(resilient(3).complete("m", HELLO, "sys")).isEqualTo("hi there");
        assertThat(delegate.calls()).hasSize(1);
        assertThat(delegate.calls().get(0).systemPrompt()).isEqualTo("sys");
    }

    @Test
    void complete_transientFailuresAreRetried() {
        delegate.fail(new ExternalServiceException(503, "overloaded"))
                .fail(new ExternalServiceException(429, "slow down"))
                .reply("finally");

        assertThat(resilient(3).complete("m", HELLO, "sys")).isEqualTo("finally");
        assertThat(delegate.calls()).hasSize(3);
    }

    @Test
    void complete_attemptsExhausted_surfacesExternalServiceError() {
        delegate.fail(new ExternalServiceException(500, "boom"))
                .fail(new ExternalServiceException(502, "bad gateway"));

        ExternalServiceException e = catchThrowableOfType(() -> resilient(2).complete("m", HELLO, "sys"),
                ExternalServiceException.class);

        assertThat(e).hasMessageContaining("failed after 2 attempts").hasMessageContaining("502");
        assertThat(e.isRetryable()).isFalse();
        assertThat(delegate.calls()).hasSize(2);
    }

    @Test
    void complete_nonRetryableStatus_failsImmediately() {
        delegate.fail(new ExternalServiceException(401, "invalid x-api-key")).reply("never used");

        assertThatThrownBy(() -> resilient(3).complete("m", HELLO, "sys"))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("401");
        assertThat(delegate.calls()).hasSize(1);
    }

    @Test
    void complete_slowCall_timesOutAndIsRetried() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger attempts = new AtomicInteger();
        TextGenerationClient slowThenFast = (model, messages, systemPrompt) -> {
            if (attempts.getAndIncrement() == 0) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "too late";
            }
            return "fast";
        };

        try {
            ResilientTextGenerator generator = new ResilientTextGenerator(slowThenFast, Duration.ofMillis(200), 2, 0);
            assertThat(generator.complete("m", HELLO, "sys")).isEqualTo("fast");
            assertThat(attempts.get()).isEqualTo(2);
        } finally {
            release.countDown();
        }
    }

    @Test
    void statusCodes_classifiedAsTransientOrNot() {
        assertThat(new ExternalServiceException(408, "").isRetryable()).isTrue();
        assertThat(new ExternalServiceException(429, "").isRetryable()).isTrue();
        assertThat(new ExternalServiceException(503, "").isRetryable()).isTrue();
        assertThat(new ExternalServiceException(400, "").isRetryable()).isFalse();
        assertThat(new ExternalServiceException(404, "").statusCode()).isEqualTo(404);
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThatThrownBy(() -> resilient(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
