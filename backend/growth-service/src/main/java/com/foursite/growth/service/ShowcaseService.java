package com.foursite.growth.service;

import com.foursite.growth.config.ShowcaseProperties;
import com.foursite.growth.dto.ShowcaseEntryDto;
import com.foursite.growth.repository.ShowcaseEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ShowcaseService {

    private final ShowcaseEntryRepository showcaseEntryRepository;
    private final ShowcaseProperties showcaseProperties;

    /**
     * A page of the published ranking. The limit is clamped to the configured maximum.
     */
    @Transactional(readOnly = true)
    public List<ShowcaseEntryDto> getShowcase(Integer limit, Integer offset) {
        int size = limit == null ? showcaseProperties.getDefaultPageSize()
                : Math.max(1, Math.min(limit, showcaseProperties.getMaxPageSize()));
        int skip = offset == null ? 0 : offset;
        if (skip < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        return showcaseEntryRepository.findByShowcaseRankBetweenOrderByShowcaseRankAsc(skip + 1, skip + size).stream()
                .map(e -> ShowcaseEntryDto.builder()
                        .rank(e.getShowcaseRank())
                        .siteId(e.getSiteId())
                        .ownerId(e.getOwnerId())
                        .score(e.getScore())
                        .generatedAt(e.getGeneratedAt())
                        .build())
                .collect(Collectors.toList());
    }
}
