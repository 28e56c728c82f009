package com.fairwaytour.model;

public enum TourEnrollmentStatus {
    ACTIVE,
    PENDING,
    INACTIVE
}
