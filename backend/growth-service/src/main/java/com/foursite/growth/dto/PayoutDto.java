package com.foursite.growth.dto;

import com.foursite.growth.entity.PayoutStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * DTO for payout info
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayoutDto {

    private UUID id;
    private String userId;
    private BigDecimal amount;
    private PayoutStatus status;
    private String externalReference;
    private int entryCount;
    private Instant createdAt;
    private Instant processedAt;
    private String errorMessage;
}
