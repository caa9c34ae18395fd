package com.foursite.growth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for a referee converting to a paying member
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordConversionRequest {

    @NotBlank(message = "Referrer id is required")
    @Size(max = 64, message = "Referrer id must be at most 64 characters")
    private String referrerId;

    @NotBlank(message = "Referee id is required")
    @Size(max = 64, message = "Referee id must be at most 64 characters")
    private String refereeId;

    private Instant occurredAt;
}
