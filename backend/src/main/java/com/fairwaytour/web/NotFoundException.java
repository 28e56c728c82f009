package com.fairwaytour.web;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class NotFoundException extends FairwayException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "not_found", message);
    }

    public static NotFoundException competition(UUID competitionId) {
        return new NotFoundException("Competition not found: " + competitionId);
    }

    public static NotFoundException player(UUID playerId) {
        return new NotFoundException("Player not found: " + playerId);
    }

    public static NotFoundException participant(UUID participantId) {
        return new NotFoundException("Participant not found: " + participantId);
    }

    public static NotFoundException registration(UUID competitionId, UUID playerId) {
        return new NotFoundException(
                "Registration not found for player " + playerId + " in competition " + competitionId
        );
    }

    public static NotFoundException tour(UUID tourId) {
        return new NotFoundException("Tour not found: " + tourId);
    }
}
