package com.foursite.growth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * ShowcaseEntry entity - one row of the published leaderboard
 */
@Entity
@Table(name = "showcase_entries",
        indexes = @Index(name = "idx_showcase_rank", columnList = "showcase_rank"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShowcaseEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "showcase_rank", nullable = false)
    private int showcaseRank;

    @Column(name = "site_id", nullable = false, length = 64)
    private String siteId;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(nullable = false)
    private double score;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;
}
