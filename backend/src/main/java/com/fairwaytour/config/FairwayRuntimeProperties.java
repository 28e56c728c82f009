package com.fairwaytour.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime knobs for registration, handicap and finalization rules.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "fairway")
public class FairwayRuntimeProperties {

    private Registration registration = new Registration();
    private Handicap handicap = new Handicap();
    private Finalization finalization = new Finalization();
    private Api api = new Api();

    @Getter
    @Setter
    public static class Registration {
        private int maxGroupSize = 4;
        /**
         * Enforces open_start/open_end on self-registration when they are set.
         */
        private boolean enforceOpenWindow = true;
    }

    @Getter
    @Setter
    public static class Handicap {
        private int standardSlopeRating = 113;
        private int defaultHoleCount = 18;
        /**
         * Adds (course rating - par) before rounding, WHS course handicap form.
         */
        private boolean applyCourseRatingAdjustment = false;
    }

    @Getter
    @Setter
    public static class Finalization {
        /**
         * When false, finalize is rejected while any non-DQ scorecard is incomplete.
         */
        private boolean allowIncompleteScorecards = true;
    }

    @Getter
    @Setter
    public static class Api {
        private String playerIdHeader = "X-Player-Id";
        private String adminHeader = "X-Fairway-Admin";
    }
}
