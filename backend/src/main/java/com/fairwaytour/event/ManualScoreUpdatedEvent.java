package com.fairwaytour.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ManualScoreUpdatedEvent(
        UUID competitionId,
        UUID participantId,
        Integer total,
        OffsetDateTime occurredAt
) implements FairwayDomainEvent {
}
