package com.foursite.growth.repository;

import com.foursite.growth.entity.MilestoneRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MilestoneRecordRepository extends JpaRepository<MilestoneRecord, UUID> {

    boolean existsByUserIdAndMilestoneType(String userId, String milestoneType);

    List<MilestoneRecord> findByUserIdOrderByFiredAtAsc(String userId);
}
