package com.foursite.growth.service;

import com.foursite.growth.config.TransactionConfig;
import com.foursite.growth.dto.MemberDto;
import com.foursite.growth.entity.Member;
import com.foursite.growth.entity.Site;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.exception.NotFoundException;
import com.foursite.growth.repository.MemberRepository;
import com.foursite.growth.repository.SiteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Member tiers and their propagation onto owned sites
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemberService {

    private final MemberRepository memberRepository;
    private final SiteRepository siteRepository;
    private final TransactionTemplate transactionTemplate;
    @Qualifier(TransactionConfig.REQUIRES_NEW)
    private final TransactionTemplate requiresNewTransactionTemplate;
    private final Clock clock;

    /**
     * Create the member on first reference. Concurrent creation of the same id is tolerated.
     */
    public void ensureExists(String userId) {
        if (memberRepository.existsById(userId)) {
            return;
        }
        try {
            requiresNewTransactionTemplate.executeWithoutResult(status -> {
                if (!memberRepository.existsById(userId)) {
                    memberRepository.saveAndFlush(Member.builder()
                            .id(userId)
                            .createdAt(clock.instant())
                            .build());
                    log.info("Created member {}", userId);
                }
            });
        } catch (DataIntegrityViolationException e) {
            log.debug("Member {} created concurrently", userId);
        }
    }

    /**
     * Apply the tier reported by billing and push the effective tier to the member's sites
     */
    public MemberDto updateTier(String userId, SubscriptionTier tier) {
        ensureExists(userId);
        return transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            Member member = lockMember(userId);
            member.setPaidPro(tier == SubscriptionTier.PRO);
            if (member.refreshTier(now)) {
                log.info("Member {} tier is now {}", userId, member.getTier());
            }
            int sitesUpdated = propagateTier(member);
            return toDto(member, sitesUpdated);
        });
    }

    /**
     * Extend the member's time-bounded pro grant inside the caller's transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Member grantPro(String userId, Instant until) {
        Member member = lockMember(userId);
        member.extendProGrant(until);
        if (member.refreshTier(clock.instant())) {
            log.info("Member {} upgraded to {} until {}", userId, member.getTier(), member.getProExpiresAt());
        }
        propagateTier(member);
        return member;
    }

    /**
     * Drop an expired pro grant.
     *
     * @return true if the member was downgraded
     */
    @Transactional
    public boolean expireGrant(String userId) {
        Member member = lockMember(userId);
        if (!member.refreshTier(clock.instant())) {
            return false;
        }
        int sites = propagateTier(member);
        log.info("Pro grant of member {} expired, {} site(s) downgraded", userId, sites);
        return true;
    }

    @Transactional(readOnly = true)
    public MemberDto getMember(String userId) {
        Member member = memberRepository.findById(userId)
                .orElseThrow(() -> NotFoundException.member(userId));
        return toDto(member, 0);
    }

    /**
     * Mirror the member's tier onto every site they own, under the site row locks
     *
     * @return number of sites that changed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int propagateTier(Member member) {
        List<Site> sites = siteRepository.findByOwnerIdForUpdate(member.getId());
        int changed = 0;
        for (Site site : sites) {
            if (site.applyTier(member.getTier())) {
                changed++;
            }
        }
        return changed;
    }

    private Member lockMember(String userId) {
        return memberRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> NotFoundException.member(userId));
    }

    private static MemberDto toDto(Member member, int sitesUpdated) {
        return MemberDto.builder()
                .id(member.getId())
                .tier(member.getTier())
                .paidPro(member.isPaidPro())
                .proExpiresAt(member.getProExpiresAt())
                .sitesUpdated(sitesUpdated)
                .build();
    }
}
