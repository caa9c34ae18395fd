package com.foursite.growth.job;

import com.foursite.growth.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationJob {

    private final ReconciliationService reconciliationService;

    @Scheduled(cron = "${growth.reconciliation.cron:0 */15 * * * *}", zone = "UTC")
    public void run() {
        try {
            reconciliationService.runAll();
        } catch (Exception e) {
            log.error("Reconciliation sweep failed", e);
        }
    }
}
