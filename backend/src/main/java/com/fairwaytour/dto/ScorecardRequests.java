package com.fairwaytour.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public final class ScorecardRequests {

    private ScorecardRequests() {
    }

    public record UpdateScoreRequest(
            @NotNull(message = "shots is required")
            @Min(value = -1, message = "shots must be -1 (picked up) or at least 0")
            Integer shots
    ) {
    }

    /**
     * A null total clears the manual entry and the hole-by-hole card counts again.
     */
    public record ManualScoreRequest(
            @Positive(message = "total must be positive")
            Integer total
    ) {
    }

    public record DisqualifyRequest(
            @NotNull(message = "disqualified is required")
            Boolean disqualified,

            @Size(max = 500, message = "reason must be at most 500 characters")
            String reason
    ) {
    }
}
