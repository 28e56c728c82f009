package com.fairwaytour.model;

public enum RegistrationStatus {
    LOOKING_FOR_GROUP,
    REGISTERED,
    PLAYING,
    FINISHED,
    WITHDRAWN;

    public boolean isTerminal() {
        return this == FINISHED || this == WITHDRAWN;
    }

    public boolean hasStartedPlay() {
        return this == PLAYING || this == FINISHED;
    }
}
