package com.foursite.growth.dto;

import com.foursite.growth.entity.SubscriptionTier;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the tier reported by billing
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTierRequest {

    @NotNull(message = "Tier is required")
    private SubscriptionTier tier;
}
