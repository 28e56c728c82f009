package com.fairwaytour.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CompetitionFinalizedEvent(
        UUID competitionId,
        UUID tourId,
        int resultCount,
        OffsetDateTime occurredAt
) implements FairwayDomainEvent {
}
