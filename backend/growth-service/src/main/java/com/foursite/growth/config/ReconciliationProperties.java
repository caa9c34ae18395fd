package com.foursite.growth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "growth.reconciliation")
@Data
public class ReconciliationProperties {

    private String cron = "0 */15 * * * *";
}
