package com.fairwaytour.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ParticipantDisqualifiedEvent(
        UUID competitionId,
        UUID participantId,
        boolean disqualified,
        OffsetDateTime occurredAt
) implements FairwayDomainEvent {
}
