package com.fairwaytour.service;

import com.fairwaytour.config.FairwayRuntimeProperties;
import com.fairwaytour.model.CourseTee;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Course handicap (handicap strokes for the round).
 *
 * Formula: strokes = round(handicapIndex * slopeRating / 113)
 * With the course rating adjustment enabled: round(handicapIndex * slopeRating / 113 + (courseRating - par))
 */
@Component
public class HandicapCalculator {

    private final FairwayRuntimeProperties fairwayRuntimeProperties;

    public HandicapCalculator(FairwayRuntimeProperties fairwayRuntimeProperties) {
        this.fairwayRuntimeProperties = fairwayRuntimeProperties;
    }

    /**
     * @param handicapIndex participant's handicap snapshot; null counts as scratch
     * @param tee assigned tee; null falls back to the standard slope and no rating offset
     * @return handicap strokes, negative for plus handicaps
     */
    public int handicapStrokes(BigDecimal handicapIndex, CourseTee tee) {
        if (handicapIndex == null) {
            return 0;
        }
        FairwayRuntimeProperties.Handicap config = fairwayRuntimeProperties.getHandicap();
        int standardSlope = config.getStandardSlopeRating();
        int slope = tee != null && tee.getSlopeRating() != null ? tee.getSlopeRating() : standardSlope;

        double courseHandicap = handicapIndex.doubleValue() * slope / standardSlope;
        if (config.isApplyCourseRatingAdjustment()
                && tee != null
                && tee.getCourseRating() != null
                && !tee.getPars().isEmpty()) {
            courseHandicap += tee.getCourseRating().doubleValue() - tee.totalPar();
        }
        return (int) Math.round(courseHandicap);
    }
}
