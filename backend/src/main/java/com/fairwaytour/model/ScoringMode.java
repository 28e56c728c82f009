package com.fairwaytour.model;

public enum ScoringMode {
    GROSS,
    NET,
    BOTH
}
