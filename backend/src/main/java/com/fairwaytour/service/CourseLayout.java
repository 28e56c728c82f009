package com.fairwaytour.service;

import com.fairwaytour.model.CourseTee;

import java.util.List;

/**
 * The hole layout a competition is scored against. {@code tee} is null when the competition has no tee,
 * in which case {@code pars} is empty and the hole count falls back to the configured default.
 */
public record CourseLayout(
        CourseTee tee,
        List<Integer> pars,
        int holeCount
) {

    public boolean parsKnown() {
        return !pars.isEmpty();
    }
}
