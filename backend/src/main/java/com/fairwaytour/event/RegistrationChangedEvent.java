package com.fairwaytour.event;

import com.fairwaytour.model.RegistrationStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RegistrationChangedEvent(
        UUID competitionId,
        UUID playerId,
        RegistrationStatus previousStatus,
        RegistrationStatus newStatus,
        UUID teeTimeId,
        OffsetDateTime occurredAt
) implements FairwayDomainEvent {
}
