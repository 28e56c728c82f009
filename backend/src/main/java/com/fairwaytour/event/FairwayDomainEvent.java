package com.fairwaytour.event;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Mutation boundary that read and cache layers subscribe to for invalidation.
 * Delivered to listeners only after the publishing transaction commits.
 */
public interface FairwayDomainEvent {

    UUID competitionId();

    OffsetDateTime occurredAt();
}
