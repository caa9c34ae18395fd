package com.foursite.growth.support;

import com.foursite.growth.dto.RegisterSiteRequest;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.repository.CommissionLedgerEntryRepository;
import com.foursite.growth.repository.FeaturingEventRepository;
import com.foursite.growth.repository.MemberRepository;
import com.foursite.growth.repository.MilestoneRecordRepository;
import com.foursite.growth.repository.PayoutRepository;
import com.foursite.growth.repository.ReferralEdgeRepository;
import com.foursite.growth.repository.ShareEventRepository;
import com.foursite.growth.repository.ShowcaseEntryRepository;
import com.foursite.growth.repository.SiteRepository;
import com.foursite.growth.service.SiteService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

/**
 * Base class for tests running against the full application context and an in-memory database.
 * Every test starts from empty tables and a fixed clock.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class BaseIntegrationTest {

    protected static final Instant START = Instant.parse("2026-06-15T12:00:00Z");

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected SiteService siteService;

    @Autowired
    protected SiteRepository siteRepository;

    @Autowired
    protected MemberRepository memberRepository;

    @Autowired
    protected ShareEventRepository shareEventRepository;

    @Autowired
    protected FeaturingEventRepository featuringEventRepository;

    @Autowired
    protected ReferralEdgeRepository referralEdgeRepository;

    @Autowired
    protected CommissionLedgerEntryRepository ledgerRepository;

    @Autowired
    protected PayoutRepository payoutRepository;

    @Autowired
    protected MilestoneRecordRepository milestoneRecordRepository;

    @Autowired
    protected ShowcaseEntryRepository showcaseEntryRepository;

    @BeforeEach
    void resetState() {
        clock.setInstant(START);
        ledgerRepository.deleteAllInBatch();
        payoutRepository.deleteAllInBatch();
        referralEdgeRepository.deleteAllInBatch();
        milestoneRecordRepository.deleteAllInBatch();
        featuringEventRepository.deleteAllInBatch();
        shareEventRepository.deleteAllInBatch();
        showcaseEntryRepository.deleteAllInBatch();
        siteRepository.deleteAll();
        memberRepository.deleteAllInBatch();
    }

    protected void registerSite(String siteId, String ownerId, SubscriptionTier ownerTier) {
        siteService.registerSite(new RegisterSiteRequest(siteId, ownerId, ownerTier));
    }
}
