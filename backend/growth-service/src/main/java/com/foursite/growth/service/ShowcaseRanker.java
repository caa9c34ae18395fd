package com.foursite.growth.service;

import com.foursite.growth.config.ShowcaseProperties;
import com.foursite.growth.config.TransactionConfig;
import com.foursite.growth.dto.ShowcaseRefreshDto;
import com.foursite.growth.entity.ShowcaseEntry;
import com.foursite.growth.entity.Site;
import com.foursite.growth.repository.ShareEventRepository;
import com.foursite.growth.repository.ShareSample;
import com.foursite.growth.repository.ShowcaseEntryRepository;
import com.foursite.growth.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rebuilds the showcase: scores every eligible site against one snapshot, orders them totally and
 * replaces the published ranking in a single transaction. A failed run leaves the previous ranking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShowcaseRanker {

    static final Comparator<ShowcaseCandidate> RANKING_ORDER = Comparator
            .comparingDouble(ShowcaseCandidate::score).reversed()
            .thenComparing(ShowcaseCandidate::createdAt)
            .thenComparing(ShowcaseCandidate::siteId);

    private final SiteRepository siteRepository;
    private final ShareEventRepository shareEventRepository;
    private final ShowcaseEntryRepository showcaseEntryRepository;
    private final ViralScoreCalculator scoreCalculator;
    private final ReconciliationService reconciliationService;
    private final ShowcaseProperties showcaseProperties;
    private final TransactionTemplate transactionTemplate;
    @Qualifier(TransactionConfig.SNAPSHOT)
    private final TransactionTemplate snapshotTransactionTemplate;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ShowcaseRefreshDto refresh() {
        if (!running.compareAndSet(false, true)) {
            log.info("Showcase ranking already running, skipped");
            return ShowcaseRefreshDto.builder().executed(false).build();
        }
        try {
            long started = System.nanoTime();
            try {
                reconciliationService.reconcileFeaturing();
            } catch (RuntimeException e) {
                log.warn("Featuring reconciliation before ranking failed: {}", e.toString());
            }

            Instant now = clock.instant();
            List<ShowcaseCandidate> ranked = snapshotTransactionTemplate.execute(status -> rank(scoreEligible(now)));
            List<ShowcaseEntry> entries = new ArrayList<>(ranked.size());
            for (int i = 0; i < ranked.size(); i++) {
                ShowcaseCandidate candidate = ranked.get(i);
                entries.add(ShowcaseEntry.builder()
                        .showcaseRank(i + 1)
                        .siteId(candidate.siteId())
                        .ownerId(candidate.ownerId())
                        .score(candidate.score())
                        .generatedAt(now)
                        .build());
            }
            transactionTemplate.executeWithoutResult(status -> {
                showcaseEntryRepository.deleteAllInBatch();
                showcaseEntryRepository.saveAll(entries);
            });

            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            log.info("Published showcase ranking of {} sites in {} ms", entries.size(), elapsed);
            return ShowcaseRefreshDto.builder()
                    .executed(true)
                    .rankedSites(entries.size())
                    .generatedAt(now)
                    .durationMillis(elapsed)
                    .build();
        } finally {
            running.set(false);
        }
    }

    private List<ShowcaseCandidate> scoreEligible(Instant now) {
        List<Site> sites = siteRepository.findByShowcaseEligibleTrue();
        Instant since = scoreCalculator.horizonStart(now);
        int batchSize = showcaseProperties.getBatchSize();

        Map<String, List<ShareSample>> sharesBySite = new HashMap<>();
        for (int from = 0; from < sites.size(); from += batchSize) {
            List<String> ids = sites.subList(from, Math.min(from + batchSize, sites.size())).stream()
                    .map(Site::getId)
                    .toList();
            for (ShareSample sample : shareEventRepository.findSamples(ids, since, now)) {
                sharesBySite.computeIfAbsent(sample.siteId(), id -> new ArrayList<>()).add(sample);
            }
        }

        List<ShowcaseCandidate> candidates = new ArrayList<>(sites.size());
        for (Site site : sites) {
            double score = scoreCalculator.score(site.getTier(), site.getPageviews(),
                    sharesBySite.getOrDefault(site.getId(), List.of()), now);
            candidates.add(new ShowcaseCandidate(site.getId(), site.getOwnerId(), site.getCreatedAt(), score));
        }
        return candidates;
    }

    /**
     * Order candidates by score desc, then createdAt asc, then site id asc
     */
    static List<ShowcaseCandidate> rank(List<ShowcaseCandidate> candidates) {
        List<ShowcaseCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(RANKING_ORDER);
        return ranked;
    }
}
