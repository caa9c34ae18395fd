package com.foursite.growth.config;

import com.foursite.growth.exception.InvalidThresholdException;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "growth.showcase")
@Data
public class ShowcaseProperties implements InitializingBean {

    private String cron = "0 0 3 * * *";

    /**
     * Site ids per share-event read while ranking
     */
    private int batchSize = 500;

    private int defaultPageSize = 20;

    private int maxPageSize = 100;

    @Override
    public void afterPropertiesSet() {
        if (batchSize <= 0) {
            throw new InvalidThresholdException("growth.showcase.batch-size must be positive, got " + batchSize);
        }
        if (defaultPageSize <= 0 || maxPageSize < defaultPageSize) {
            throw new InvalidThresholdException("growth.showcase page sizes must satisfy 0 < default <= max");
        }
    }
}
