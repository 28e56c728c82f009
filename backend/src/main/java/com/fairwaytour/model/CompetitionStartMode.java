package com.fairwaytour.model;

public enum CompetitionStartMode {
    SCHEDULED,
    OPEN
}
