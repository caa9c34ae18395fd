package com.foursite.growth.service;

import com.foursite.growth.config.MilestoneProperties;
import com.foursite.growth.dto.MilestoneProgressDto;
import com.foursite.growth.dto.MilestoneRecordDto;
import com.foursite.growth.entity.MilestoneRecord;
import com.foursite.growth.entity.ReferralStatus;
import com.foursite.growth.repository.MilestoneRecordRepository;
import com.foursite.growth.repository.ReferralEdgeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class MilestoneService {

    private final MilestoneRecordRepository milestoneRecordRepository;
    private final ReferralEdgeRepository referralEdgeRepository;
    private final MilestoneProperties milestoneProperties;

    /**
     * Milestones already granted to the user, oldest first
     */
    @Transactional(readOnly = true)
    public List<MilestoneRecordDto> getMilestoneStatus(String userId) {
        return milestoneRecordRepository.findByUserIdOrderByFiredAtAsc(userId).stream()
                .map(r -> MilestoneRecordDto.builder()
                        .milestoneType(r.getMilestoneType())
                        .qualifyingCount(r.getQualifyingCount())
                        .firedAt(r.getFiredAt())
                        .build())
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<MilestoneProgressDto> getProgress(String userId) {
        long active = referralEdgeRepository.countByReferrerIdAndStatus(userId, ReferralStatus.ACTIVE);
        Map<String, MilestoneRecord> records = milestoneRecordRepository.findByUserIdOrderByFiredAtAsc(userId).stream()
                .collect(Collectors.toMap(MilestoneRecord::getMilestoneType, Function.identity()));
        return milestoneProperties.getDefinitions().stream()
                .map(definition -> {
                    MilestoneRecord record = records.get(definition.getType());
                    return MilestoneProgressDto.builder()
                            .milestoneType(definition.getType())
                            .referralThreshold(definition.getReferralThreshold())
                            .activeReferrals(active)
                            .referralsRemaining(Math.max(0, definition.getReferralThreshold() - active))
                            .achieved(record != null)
                            .firedAt(record != null ? record.getFiredAt() : null)
                            .build();
                })
                .collect(Collectors.toList());
    }
}
