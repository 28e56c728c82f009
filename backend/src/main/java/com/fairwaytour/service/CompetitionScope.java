package com.fairwaytour.service;

import com.fairwaytour.model.PointTemplate;
import com.fairwaytour.model.ScoringMode;

import java.util.UUID;

/**
 * Whether a competition counts toward a tour. Standalone competitions carry no enrollment
 * requirement and award no tour points.
 */
public interface CompetitionScope {

    record Standalone() implements CompetitionScope {
    }

    /**
     * @param pointTemplate the tour's template, null when the tour falls back to the default formula
     */
    record TourLinked(
            UUID tourId,
            String tourName,
            ScoringMode tourScoringMode,
            PointTemplate pointTemplate
    ) implements CompetitionScope {
    }
}
