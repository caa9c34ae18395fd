package com.foursite.growth.service;

import com.foursite.growth.dto.FeaturingEventDto;
import com.foursite.growth.dto.RegisterSiteRequest;
import com.foursite.growth.dto.SiteStatsDto;
import com.foursite.growth.entity.Member;
import com.foursite.growth.entity.SharePlatform;
import com.foursite.growth.entity.Site;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.entity.ViralBoostLevel;
import com.foursite.growth.exception.ConflictException;
import com.foursite.growth.exception.NotFoundException;
import com.foursite.growth.repository.FeaturingEventRepository;
import com.foursite.growth.repository.MemberRepository;
import com.foursite.growth.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Site lifecycle and engagement counters other than shares
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteService {

    private final SiteRepository siteRepository;
    private final MemberRepository memberRepository;
    private final FeaturingEventRepository featuringEventRepository;
    private final MemberService memberService;
    private final IngestionExecutor ingestionExecutor;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // ==================== Registration ====================

    /**
     * Register a site for its owner. Registering the same site again returns it unchanged.
     */
    public SiteStatsDto registerSite(RegisterSiteRequest request) {
        memberService.ensureExists(request.getOwnerId());
        try {
            return transactionTemplate.execute(status -> applyRegistration(request));
        } catch (DataIntegrityViolationException e) {
            log.debug("Site {} registered concurrently", request.getSiteId());
            return getSiteStats(request.getSiteId());
        }
    }

    private SiteStatsDto applyRegistration(RegisterSiteRequest request) {
        Member owner = memberRepository.findByIdForUpdate(request.getOwnerId())
                .orElseThrow(() -> NotFoundException.member(request.getOwnerId()));
        Instant now = clock.instant();
        if (request.getOwnerTier() != null) {
            owner.setPaidPro(request.getOwnerTier() == SubscriptionTier.PRO);
            if (owner.refreshTier(now)) {
                memberService.propagateTier(owner);
            }
        }

        Site existing = siteRepository.findById(request.getSiteId()).orElse(null);
        if (existing != null) {
            if (!existing.getOwnerId().equals(request.getOwnerId())) {
                throw new ConflictException("SITE_OWNER_MISMATCH",
                        "Site " + request.getSiteId() + " belongs to another owner");
            }
            log.info("Site {} already registered", request.getSiteId());
            return toStats(existing, now);
        }

        Site site = Site.builder()
                .id(request.getSiteId())
                .ownerId(owner.getId())
                .createdAt(now)
                .build();
        site.applyTier(owner.getTier());
        site = siteRepository.saveAndFlush(site);
        log.info("Registered site {} for owner {} ({})", site.getId(), owner.getId(), site.getTier());
        return toStats(site, now);
    }

    // ==================== Counters ====================

    /**
     * Add pageviews to a site
     *
     * @return the new pageview count
     */
    public long recordPageview(String siteId, long count) {
        if (count < 1) {
            throw new IllegalArgumentException("Pageview count must be at least 1");
        }
        return ingestionExecutor.execute("Record pageview", status -> {
            int updated = siteRepository.incrementPageviews(siteId, count, clock.instant());
            Site site = siteRepository.findById(siteId)
                    .orElseThrow(() -> NotFoundException.site(siteId));
            if (updated == 0) {
                throw new ConflictException("SITE_RETIRED", "Site " + siteId + " is retired");
            }
            return site.getPageviews();
        });
    }

    /**
     * Soft-retire a site. It keeps its history but leaves the showcase.
     */
    @Transactional
    public SiteStatsDto retireSite(String siteId) {
        Site site = siteRepository.findByIdForUpdate(siteId)
                .orElseThrow(() -> NotFoundException.site(siteId));
        if (!site.isRetired()) {
            site.retire();
            log.info("Retired site {}", siteId);
        }
        return toStats(site, clock.instant());
    }

    // ==================== Statistics ====================

    @Transactional(readOnly = true)
    public SiteStatsDto getSiteStats(String siteId) {
        Site site = siteRepository.findById(siteId)
                .orElseThrow(() -> NotFoundException.site(siteId));
        return toStats(site, clock.instant());
    }

    @Transactional(readOnly = true)
    public List<FeaturingEventDto> getFeaturingHistory(String siteId) {
        if (!siteRepository.existsById(siteId)) {
            throw NotFoundException.site(siteId);
        }
        return featuringEventRepository.findBySiteIdOrderByShareMultipleAsc(siteId).stream()
                .map(e -> FeaturingEventDto.builder()
                        .shareMultiple(e.getShareMultiple())
                        .tier(e.getTier())
                        .durationSeconds(e.getDurationSeconds())
                        .featuredUntil(e.getFeaturedUntil())
                        .triggeredAt(e.getTriggeredAt())
                        .source(e.getSource())
                        .build())
                .collect(Collectors.toList());
    }

    private static SiteStatsDto toStats(Site site, Instant now) {
        ViralBoostLevel level = site.getBoostLevel();
        ViralBoostLevel next = level.next();
        Map<SharePlatform, Long> platformShares = new EnumMap<>(SharePlatform.class);
        platformShares.putAll(site.getPlatformShares());
        return SiteStatsDto.builder()
                .siteId(site.getId())
                .ownerId(site.getOwnerId())
                .tier(site.getTier())
                .pageviews(site.getPageviews())
                .totalShares(site.getTotalShares())
                .platformShares(platformShares)
                .boostLevel(level)
                .sharesToNextLevel(level.getSharesToNextLevel(site.getTotalShares()))
                .nextLevel(next != null ? next.name() : null)
                .lastTriggeredMultiple(site.getLastTriggeredMultiple())
                .featured(site.isFeatured(now))
                .autoFeaturedUntil(site.getAutoFeaturedUntil())
                .showcaseEligible(site.isShowcaseEligible())
                .retired(site.isRetired())
                .createdAt(site.getCreatedAt())
                .build();
    }
}
