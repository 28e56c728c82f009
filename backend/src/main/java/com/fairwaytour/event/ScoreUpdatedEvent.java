package com.fairwaytour.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ScoreUpdatedEvent(
        UUID competitionId,
        UUID participantId,
        int hole,
        int shots,
        OffsetDateTime occurredAt
) implements FairwayDomainEvent {
}
