package com.foursite.growth.service;

import com.foursite.growth.config.MilestoneProperties;
import com.foursite.growth.entity.MilestoneRecord;
import com.foursite.growth.entity.ReferralStatus;
import com.foursite.growth.repository.MilestoneRecordRepository;
import com.foursite.growth.repository.ReferralEdgeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MilestoneDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-02-10T08:00:00Z");

    @Mock
    private ReferralEdgeRepository referralEdgeRepository;

    @Mock
    private MilestoneRecordRepository milestoneRecordRepository;

    @Mock
    private MemberService memberService;

    @Mock
    private TransactionTemplate transactionTemplate;

    private MilestoneDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new MilestoneDispatcher(referralEdgeRepository, milestoneRecordRepository, memberService,
                new MilestoneProperties(), transactionTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void belowThresholdGrantsNothing() {
        when(referralEdgeRepository.countByReferrerIdAndStatus("alice", ReferralStatus.ACTIVE)).thenReturn(9L);

        assertThat(dispatcher.evaluate("alice")).isEmpty();

        verify(memberService, never()).grantPro(anyString(), any());
    }

    @Test
    void tenthReferralGrantsTwelveMonthsOfPro() {
        when(referralEdgeRepository.countByReferrerIdAndStatus("alice", ReferralStatus.ACTIVE)).thenReturn(10L);
        when(milestoneRecordRepository.existsByUserIdAndMilestoneType("alice", "10-referrals-free-pro")).thenReturn(false);
        when(milestoneRecordRepository.saveAndFlush(any(MilestoneRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        runCallbacks();

        List<MilestoneRecord> granted = dispatcher.evaluate("alice");

        assertThat(granted).hasSize(1);
        assertThat(granted.get(0).getQualifyingCount()).isEqualTo(10);
        assertThat(granted.get(0).getFiredAt()).isEqualTo(NOW);
        verify(memberService).ensureExists("alice");
        verify(memberService).grantPro("alice", Instant.parse("2027-02-10T08:00:00Z"));
    }

    @Test
    void alreadyGrantedMilestoneIsSkipped() {
        when(referralEdgeRepository.countByReferrerIdAndStatus("alice", ReferralStatus.ACTIVE)).thenReturn(25L);
        when(milestoneRecordRepository.existsByUserIdAndMilestoneType("alice", "10-referrals-free-pro")).thenReturn(true);

        assertThat(dispatcher.evaluate("alice")).isEmpty();

        verify(milestoneRecordRepository, never()).saveAndFlush(any());
    }

    @Test
    void losingTheInsertRaceGrantsNothing() {
        when(referralEdgeRepository.countByReferrerIdAndStatus("alice", ReferralStatus.ACTIVE)).thenReturn(10L);
        when(milestoneRecordRepository.existsByUserIdAndMilestoneType("alice", "10-referrals-free-pro"))
                .thenReturn(false, true);
        when(milestoneRecordRepository.saveAndFlush(any(MilestoneRecord.class)))
                .thenThrow(new DataIntegrityViolationException("uk_milestone_records_user_type"));
        runCallbacks();

        assertThat(dispatcher.evaluate("alice")).isEmpty();

        verify(memberService, never()).grantPro(anyString(), any());
    }

    @SuppressWarnings("unchecked")
    private void runCallbacks() {
        when(transactionTemplate.execute(any())).thenAnswer(inv ->
                ((TransactionCallback<Object>) inv.getArgument(0)).doInTransaction(null));
    }
}
