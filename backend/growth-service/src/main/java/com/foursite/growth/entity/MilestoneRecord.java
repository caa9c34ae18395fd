package com.foursite.growth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * MilestoneRecord entity - proof that a one-time referral reward was granted
 */
@Entity
@Table(name = "milestone_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_milestone_user_type", columnNames = {"user_id", "milestone_type"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MilestoneRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "milestone_type", nullable = false, length = 64)
    private String milestoneType;

    @Column(name = "qualifying_count", nullable = false)
    private long qualifyingCount;

    @Column(name = "fired_at", nullable = false)
    private Instant firedAt;
}
