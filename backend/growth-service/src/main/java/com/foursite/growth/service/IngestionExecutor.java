package com.foursite.growth.service;

import com.foursite.growth.config.RetryConfig;
import com.foursite.growth.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs an ingestion write in its own transaction, retrying the whole transaction on transient
 * store failures. Once retries are exhausted the failure surfaces as {@link TransientStoreException}.
 */
@Component
@RequiredArgsConstructor
public class IngestionExecutor {

    @Qualifier(RetryConfig.INGESTION_RETRY)
    private final RetryTemplate ingestionRetryTemplate;
    private final TransactionTemplate transactionTemplate;

    public <T> T execute(String operation, TransactionCallback<T> action) {
        try {
            return ingestionRetryTemplate.execute(context -> transactionTemplate.execute(action));
        } catch (RuntimeException e) {
            if (RetryConfig.isTransient(e)) {
                throw new TransientStoreException(operation + " failed after retries", e);
            }
            throw e;
        }
    }
}
