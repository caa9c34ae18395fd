package com.foursite.growth.service;

import com.foursite.growth.config.FeaturingProperties;
import com.foursite.growth.entity.FeaturingEvent;
import com.foursite.growth.entity.FeaturingSource;
import com.foursite.growth.entity.Site;
import com.foursite.growth.exception.InvariantViolationException;
import com.foursite.growth.exception.NotFoundException;
import com.foursite.growth.repository.FeaturingEventRepository;
import com.foursite.growth.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Auto-featuring state machine per site. A multiple fires at most once: the site's
 * lastTriggeredMultiple guards re-delivery and the featuring event log has a unique
 * (site, multiple) key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeaturingDispatcher {

    private final SiteRepository siteRepository;
    private final FeaturingEventRepository featuringEventRepository;
    private final FeaturingProperties featuringProperties;
    private final Clock clock;

    /**
     * Handle a committed share that reached {@code multiple}
     *
     * @return true if a featuring window was granted
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean onShareRecorded(String siteId, long multiple) {
        long threshold = featuringProperties.getShareThreshold();
        if (multiple <= 0 || multiple % threshold != 0) {
            throw new IllegalArgumentException(multiple + " is not a multiple of " + threshold);
        }
        Site site = lockSite(siteId);
        if (multiple > site.getTotalShares()) {
            throw new InvariantViolationException("Site " + siteId + " has " + site.getTotalShares()
                    + " shares but was notified of multiple " + multiple);
        }
        if (multiple <= site.getLastTriggeredMultiple()) {
            log.debug("Site {} already featured for multiple {}", siteId, multiple);
            return false;
        }
        fire(site, multiple, FeaturingSource.NOTIFICATION);
        return true;
    }

    /**
     * Fire once for the highest multiple the site reached without a trigger
     *
     * @return true if a featuring window was granted
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean reconcileSite(String siteId) {
        Site site = lockSite(siteId);
        long reached = site.reachedMultiple(featuringProperties.getShareThreshold());
        if (reached <= site.getLastTriggeredMultiple()) {
            return false;
        }
        log.warn("Site {} missed featuring notification, reached {} but last triggered {}",
                siteId, reached, site.getLastTriggeredMultiple());
        fire(site, reached, FeaturingSource.RECONCILIATION);
        return true;
    }

    private void fire(Site site, long multiple, FeaturingSource source) {
        Instant now = clock.instant();
        Duration duration = featuringProperties.durationFor(site.getTier());
        site.setLastTriggeredMultiple(multiple);
        site.extendFeaturedUntil(now.plus(duration));

        featuringEventRepository.save(FeaturingEvent.builder()
                .siteId(site.getId())
                .shareMultiple(multiple)
                .tier(site.getTier())
                .durationSeconds(duration.getSeconds())
                .featuredUntil(site.getAutoFeaturedUntil())
                .triggeredAt(now)
                .source(source)
                .build());
        log.info("Auto-featured site {} at {} shares until {} ({})",
                site.getId(), multiple, site.getAutoFeaturedUntil(), source);
    }

    private Site lockSite(String siteId) {
        return siteRepository.findByIdForUpdate(siteId)
                .orElseThrow(() -> NotFoundException.site(siteId));
    }
}
