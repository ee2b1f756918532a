package com.tradescan.backend.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; null fields keep their current value. {@code unlimitedDaily=true} removes the daily cap.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitUpdateRequest {

    @Min(1)
    private Integer maxPerMinute;

    @Min(1)
    private Integer maxPerDay;

    private Boolean unlimitedDaily;
}
