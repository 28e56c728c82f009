package com.fairwaytour.service;

import com.fairwaytour.config.FairwayRuntimeProperties;
import com.fairwaytour.model.CourseTee;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HandicapCalculatorTest {

    @Test
    void scalesHandicapIndexBySlopeAndRoundsHalfUp() {
        HandicapCalculator calculator = new HandicapCalculator(new FairwayRuntimeProperties());

        assertEquals(12, calculator.handicapStrokes(new BigDecimal("10.4"), tee(125, null)));
        assertEquals(18, calculator.handicapStrokes(new BigDecimal("18.0"), tee(113, null)));
    }

    @Test
    void missingTeeFallsBackToStandardSlope() {
        HandicapCalculator calculator = new HandicapCalculator(new FairwayRuntimeProperties());

        assertEquals(10, calculator.handicapStrokes(new BigDecimal("10.4"), null));
        assertEquals(11, calculator.handicapStrokes(new BigDecimal("10.5"), tee(null, null)));
    }

    @Test
    void missingHandicapIndexGivesNoStrokes() {
        HandicapCalculator calculator = new HandicapCalculator(new FairwayRuntimeProperties());

        assertEquals(0, calculator.handicapStrokes(null, tee(140, null)));
    }

    @Test
    void plusHandicapYieldsNegativeStrokes() {
        HandicapCalculator calculator = new HandicapCalculator(new FairwayRuntimeProperties());

        assertEquals(-3, calculator.handicapStrokes(new BigDecimal("-3.0"), tee(113, null)));
    }

    @Test
    void courseRatingAdjustmentAddsRatingMinusParWhenEnabled() {
        FairwayRuntimeProperties properties = new FairwayRuntimeProperties();
        properties.getHandicap().setApplyCourseRatingAdjustment(true);
        HandicapCalculator calculator = new HandicapCalculator(properties);

        assertEquals(13, calculator.handicapStrokes(new BigDecimal("10.4"), tee(113, new BigDecimal("74.2"))));
        assertEquals(10, calculator.handicapStrokes(new BigDecimal("10.4"), tee(113, null)));
    }

    private static CourseTee tee(Integer slopeRating, BigDecimal courseRating) {
        CourseTee tee = new CourseTee();
        tee.setTeeId(UUID.randomUUID());
        tee.setName("Yellow");
        tee.setSlopeRating(slopeRating);
        tee.setCourseRating(courseRating);
        tee.setPars(new ArrayList<>(Collections.nCopies(18, 4)));
        return tee;
    }
}
