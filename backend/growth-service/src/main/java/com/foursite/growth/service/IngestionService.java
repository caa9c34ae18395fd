package com.foursite.growth.service;

import com.foursite.growth.config.FeaturingProperties;
import com.foursite.growth.config.IngestionProperties;
import com.foursite.growth.dto.RecordShareRequest;
import com.foursite.growth.dto.ShareResultDto;
import com.foursite.growth.entity.ShareEvent;
import com.foursite.growth.entity.Site;
import com.foursite.growth.event.ShareRecordedEvent;
import com.foursite.growth.exception.ConflictException;
import com.foursite.growth.exception.NotFoundException;
import com.foursite.growth.repository.ShareEventRepository;
import com.foursite.growth.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Share ingestion. Each idempotency key is applied exactly once; the site row lock makes each
 * accepted share observe a distinct total, so a featuring multiple is reached by exactly one caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final SiteRepository siteRepository;
    private final ShareEventRepository shareEventRepository;
    private final IngestionExecutor ingestionExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final FeaturingProperties featuringProperties;
    private final IngestionProperties ingestionProperties;
    private final Clock clock;

    public ShareResultDto recordShare(RecordShareRequest request) {
        Instant now = clock.instant();
        Instant occurredAt = request.getOccurredAt() != null ? request.getOccurredAt() : now;
        if (occurredAt.isAfter(now.plus(ingestionProperties.getMaxClockSkew()))) {
            throw new IllegalArgumentException("occurredAt " + occurredAt + " is in the future");
        }
        try {
            return ingestionExecutor.execute("Record share",
                    status -> applyShare(request, occurredAt));
        } catch (DataIntegrityViolationException e) {
            // another request with the same key committed first
            log.debug("Share key {} applied concurrently", request.getIdempotencyKey());
            return duplicate(request.getSiteId());
        }
    }

    private ShareResultDto applyShare(RecordShareRequest request, Instant occurredAt) {
        Site site = siteRepository.findByIdForUpdate(request.getSiteId())
                .orElseThrow(() -> NotFoundException.site(request.getSiteId()));

        if (shareEventRepository.findByIdempotencyKey(request.getIdempotencyKey()).isPresent()) {
            log.debug("Share key {} already applied", request.getIdempotencyKey());
            return ShareResultDto.builder()
                    .accepted(false)
                    .siteId(site.getId())
                    .newShareCount(site.getTotalShares())
                    .build();
        }
        if (site.isRetired()) {
            throw new ConflictException("SITE_RETIRED", "Site " + site.getId() + " is retired");
        }

        shareEventRepository.saveAndFlush(ShareEvent.builder()
                .siteId(site.getId())
                .platform(request.getPlatform())
                .occurredAt(occurredAt)
                .recordedAt(clock.instant())
                .idempotencyKey(request.getIdempotencyKey())
                .build());

        long newTotal = site.recordShare(request.getPlatform());
        long threshold = featuringProperties.getShareThreshold();
        Long crossed = newTotal % threshold == 0 ? newTotal : null;

        eventPublisher.publishEvent(new ShareRecordedEvent(site.getId(), request.getPlatform(), newTotal, crossed,
                occurredAt));
        log.debug("Recorded {} share for site {}, total {}", request.getPlatform(), site.getId(), newTotal);

        return ShareResultDto.builder()
                .accepted(true)
                .siteId(site.getId())
                .newShareCount(newTotal)
                .crossedMultiple(crossed)
                .build();
    }

    private ShareResultDto duplicate(String siteId) {
        Site site = siteRepository.findById(siteId)
                .orElseThrow(() -> NotFoundException.site(siteId));
        return ShareResultDto.builder()
                .accepted(false)
                .siteId(siteId)
                .newShareCount(site.getTotalShares())
                .build();
    }
}
