package com.fairwaytour.model;

/**
 * Group-builder view of a player's registration.
 */
public enum AvailabilityStatus {
    LOOKING_FOR_GROUP,
    AVAILABLE,
    IN_GROUP,
    PLAYING,
    FINISHED;

    public static AvailabilityStatus fromRegistrationStatus(RegistrationStatus status) {
        if (status == null) {
            return AVAILABLE;
        }
        return switch (status) {
            case LOOKING_FOR_GROUP -> LOOKING_FOR_GROUP;
            case REGISTERED -> IN_GROUP;
            case PLAYING -> PLAYING;
            case FINISHED -> FINISHED;
            case WITHDRAWN -> AVAILABLE;
        };
    }
}
