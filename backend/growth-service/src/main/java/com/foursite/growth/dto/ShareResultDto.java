package com.foursite.growth.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of recording a share. accepted=false means the idempotency key was already applied.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShareResultDto {

    private boolean accepted;
    private String siteId;
    private long newShareCount;
    /** Featuring multiple reached by this share, null when none */
    private Long crossedMultiple;
}
