package com.foursite.growth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for confirming a payout with the payment provider's reference
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompletePayoutRequest {

    @NotBlank(message = "External reference is required")
    @Size(max = 128, message = "External reference must be at most 128 characters")
    private String externalReference;
}
