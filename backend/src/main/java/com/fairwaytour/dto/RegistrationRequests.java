package com.fairwaytour.dto;

import com.fairwaytour.model.RegistrationMode;
import com.fairwaytour.model.RegistrationStatus;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public final class RegistrationRequests {

    private RegistrationRequests() {
    }

    public record RegisterRequest(
            @NotNull(message = "mode is required")
            RegistrationMode mode
    ) {
    }

    public record AddToGroupRequest(
            @NotEmpty(message = "playerIds must not be empty")
            @Size(max = 16, message = "playerIds must contain at most 16 entries")
            List<@NotNull(message = "playerIds must not contain null") UUID> playerIds
    ) {
    }

    public record RemoveFromGroupRequest(
            @NotNull(message = "playerId is required")
            UUID playerId
    ) {
    }

    public record UpdateStatusRequest(
            @NotNull(message = "status is required")
            RegistrationStatus status
    ) {
    }
}
