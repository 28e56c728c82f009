package com.fairwaytour.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CompetitionReopenedEvent(
        UUID competitionId,
        UUID tourId,
        OffsetDateTime occurredAt
) implements FairwayDomainEvent {
}
