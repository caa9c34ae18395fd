package com.foursite.growth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "growth.dispatch")
@Data
public class DispatchProperties {

    /** Run trigger dispatch on the dispatch executor instead of the committing thread */
    private boolean async = true;

    private int corePoolSize = 4;

    private int maxPoolSize = 8;

    private int queueCapacity = 1000;
}
