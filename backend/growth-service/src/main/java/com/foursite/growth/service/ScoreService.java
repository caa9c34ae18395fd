package com.foursite.growth.service;

import com.foursite.growth.dto.ScoreDto;
import com.foursite.growth.entity.Site;
import com.foursite.growth.exception.NotFoundException;
import com.foursite.growth.repository.ShareEventRepository;
import com.foursite.growth.repository.ShareSample;
import com.foursite.growth.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class ScoreService {

    private final SiteRepository siteRepository;
    private final ShareEventRepository shareEventRepository;
    private final ViralScoreCalculator scoreCalculator;
    private final Clock clock;

    /**
     * Live viral score of a site, computed the same way the showcase ranker computes it
     */
    @Transactional(readOnly = true)
    public ScoreDto getScore(String siteId) {
        Site site = siteRepository.findById(siteId)
                .orElseThrow(() -> NotFoundException.site(siteId));
        Instant now = clock.instant();
        List<ShareSample> shares = shareEventRepository.findSamples(List.of(siteId),
                scoreCalculator.horizonStart(now), now);
        return ScoreDto.builder()
                .siteId(siteId)
                .tier(site.getTier())
                .score(scoreCalculator.score(site.getTier(), site.getPageviews(), shares, now))
                .computedAt(now)
                .build();
    }
}
