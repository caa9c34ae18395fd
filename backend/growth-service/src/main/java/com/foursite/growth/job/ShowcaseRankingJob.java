package com.foursite.growth.job;

import com.foursite.growth.service.ShowcaseRanker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic showcase re-ranking
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShowcaseRankingJob {

    private final ShowcaseRanker showcaseRanker;

    @Scheduled(cron = "${growth.showcase.cron:0 0 3 * * *}", zone = "UTC")
    public void run() {
        try {
            showcaseRanker.refresh();
        } catch (Exception e) {
            log.error("Showcase ranking failed, previous ranking kept", e);
        }
    }
}
