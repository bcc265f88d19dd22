package com.pulseboard.api.dto.response;

import lombok.Builder;
import lombok.Getter;

/** Response DTO for the inactive base-limit settings endpoints. */
@Getter
@Builder
public class InactiveBaseLimitResponse {

    /** Base number of off-screen rows that may keep a subscription. */
    private final int limit;

    /** False when a POST asked for the value that was already stored. */
    private final boolean changed;
}
