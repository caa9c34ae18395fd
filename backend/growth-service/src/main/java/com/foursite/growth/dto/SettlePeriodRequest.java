package com.foursite.growth.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request DTO for settling one billing period of a referral
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettlePeriodRequest {

    @NotNull(message = "Referral id is required")
    private UUID referralEdgeId;

    @NotBlank(message = "Period is required")
    @Pattern(regexp = "^\\d{4}-\\d{2}$", message = "Period must be formatted yyyy-MM")
    private String period;

    @NotNull(message = "Revenue is required")
    @DecimalMin(value = "0", message = "Revenue must not be negative")
    private BigDecimal revenue;
}
