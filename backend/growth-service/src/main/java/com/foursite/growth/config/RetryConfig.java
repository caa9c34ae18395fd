package com.foursite.growth.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;

/**
 * Retry policy for transient store failures at the ingestion boundary
 */
@Configuration
@Slf4j
public class RetryConfig {

    public static final String INGESTION_RETRY = "ingestionRetryTemplate";

    static final List<Class<? extends Throwable>> TRANSIENT_FAILURES =
            List.of(TransientDataAccessException.class, CannotCreateTransactionException.class);

    @Bean(INGESTION_RETRY)
    public RetryTemplate ingestionRetryTemplate(IngestionProperties properties) {
        IngestionProperties.Retry retry = properties.getRetry();
        return RetryTemplate.builder()
                .maxAttempts(retry.getMaxAttempts())
                .exponentialBackoff(retry.getInitialDelay().toMillis(), retry.getMultiplier(),
                        retry.getMaxDelay().toMillis())
                .retryOn(TRANSIENT_FAILURES)
                .traversingCauses()
                .withListener(new RetryListener() {
                    @Override
                    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                                 Throwable throwable) {
                        if (isTransient(throwable)) {
                            log.warn("Transient store failure on attempt {}: {}", context.getRetryCount(),
                                    throwable.toString());
                        } else {
                            log.debug("Store call failed, not retried: {}", throwable.toString());
                        }
                    }
                })
                .build();
    }

    /**
     * True when the error, or any of its causes, is a failure worth retrying
     */
    public static boolean isTransient(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            for (Class<? extends Throwable> type : TRANSIENT_FAILURES) {
                if (type.isInstance(cause)) {
                    return true;
                }
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }
}
