package com.foursite.growth.dto;

import com.foursite.growth.entity.SubscriptionTier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a generated site
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterSiteRequest {

    @NotBlank(message = "Site id is required")
    @Size(max = 64, message = "Site id must be at most 64 characters")
    private String siteId;

    @NotBlank(message = "Owner id is required")
    @Size(max = 64, message = "Owner id must be at most 64 characters")
    private String ownerId;

    /** Owner's billing tier, when known; leaves the member unchanged if omitted */
    private SubscriptionTier ownerTier;
}
