package com.fairwaytour.dto;

import com.fairwaytour.model.AvailabilityStatus;
import com.fairwaytour.model.RegistrationStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class RegistrationResponses {

    private RegistrationResponses() {
    }

    public record Registration(
            UUID registrationId,
            UUID competitionId,
            UUID playerId,
            RegistrationStatus status,
            UUID teeTimeId,
            UUID participantId,
            UUID groupCreatedBy,
            OffsetDateTime registeredAt,
            OffsetDateTime startedAt,
            OffsetDateTime finishedAt
    ) {
    }

    public record AvailablePlayer(
            UUID playerId,
            String name,
            BigDecimal handicap,
            AvailabilityStatus status,
            UUID teeTimeId
    ) {
    }

    public record GroupMember(
            UUID playerId,
            String name,
            BigDecimal handicap,
            UUID participantId,
            RegistrationStatus registrationStatus,
            Integer teeOrder,
            boolean isYou,
            boolean isCreator
    ) {
    }

    /**
     * A tee time with its members. {@code teeTimeId == null} with no players is the
     * "no group yet" answer.
     */
    public record PlayingGroup(
            UUID teeTimeId,
            UUID competitionId,
            Integer startHole,
            UUID groupCreatedBy,
            List<GroupMember> players,
            int maxPlayers
    ) {
        public static PlayingGroup empty(UUID competitionId, int maxPlayers) {
            return new PlayingGroup(null, competitionId, null, null, List.of(), maxPlayers);
        }
    }

    public record StartPlaying(
            UUID competitionId,
            UUID playerId,
            UUID teeTimeId,
            UUID participantId,
            RegistrationStatus status
    ) {
    }

    public record ActiveRound(
            UUID competitionId,
            String competitionName,
            LocalDate competitionDate,
            UUID tourId,
            UUID participantId,
            UUID teeTimeId,
            RegistrationStatus status,
            int holesPlayed,
            Integer grossScore,
            boolean locked
    ) {
    }
}
