package com.foursite.growth.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for adding pageviews to a site
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageviewRequest {

    @Min(value = 1, message = "Count must be at least 1")
    private long count = 1;
}
