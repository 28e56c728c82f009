package com.fairwaytour.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ParticipantLockChangedEvent(
        UUID competitionId,
        UUID participantId,
        boolean locked,
        OffsetDateTime occurredAt
) implements FairwayDomainEvent {
}
