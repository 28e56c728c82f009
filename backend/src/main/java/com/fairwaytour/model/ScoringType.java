package com.fairwaytour.model;

public enum ScoringType {
    GROSS,
    NET
}
