package com.foursite.growth.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
class RetryConfigTest {

    private RetryTemplate retryTemplate;

    @BeforeEach
    void setUp() {
        IngestionProperties properties = new IngestionProperties();
        properties.getRetry().setInitialDelay(Duration.ofMillis(1));
        properties.getRetry().setMaxDelay(Duration.ofMillis(2));
        retryTemplate = new RetryConfig().ingestionRetryTemplate(properties);
    }

    @Test
    void transientFailureIsRetriedAndReported(CapturedOutput output) {
        AtomicInteger attempts = new AtomicInteger();

        String result = retryTemplate.execute(context -> {
            if (attempts.incrementAndGet() == 1) {
                throw new QueryTimeoutException("lock wait timeout");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(2);
        assertThat(output.getOut()).contains("Transient store failure on attempt 1");
    }

    @Test
    void businessFailureIsNeitherRetriedNorReportedAsTransient(CapturedOutput output) {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryTemplate.execute(context -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("uk_share_events_idempotency");
        })).isInstanceOf(DataIntegrityViolationException.class);

        assertThat(attempts).hasValue(1);
        assertThat(output.getOut()).doesNotContain("Transient store failure");
    }

    @Test
    void transientCheckWalksTheCauseChain() {
        assertThat(RetryConfig.isTransient(new QueryTimeoutException("timeout"))).isTrue();
        assertThat(RetryConfig.isTransient(new IllegalStateException("wrapped",
                new CannotCreateTransactionException("no connection")))).isTrue();
        assertThat(RetryConfig.isTransient(new DataIntegrityViolationException("duplicate"))).isFalse();
        assertThat(RetryConfig.isTransient(new IllegalArgumentException("bad input"))).isFalse();
    }
}
