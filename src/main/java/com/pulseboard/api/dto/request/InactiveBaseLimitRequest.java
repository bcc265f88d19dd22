package com.pulseboard.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request body for POST /api/settings/inactive-base-limit. */
@Data
@NoArgsConstructor
public class InactiveBaseLimitRequest {

    @NotNull(message = "limit is required")
    @Min(value = 0, message = "limit must be zero or positive")
    private Integer limit;
}
