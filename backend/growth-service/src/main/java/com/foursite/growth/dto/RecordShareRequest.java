package com.foursite.growth.dto;

import com.foursite.growth.entity.SharePlatform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for recording an external share
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordShareRequest {

    @NotBlank(message = "Site id is required")
    private String siteId;

    @NotNull(message = "Platform is required")
    private SharePlatform platform;

    @NotBlank(message = "Idempotency key is required")
    @Size(max = 128, message = "Idempotency key must be at most 128 characters")
    private String idempotencyKey;

    /** Defaults to the engine clock when omitted */
    private Instant occurredAt;
}
