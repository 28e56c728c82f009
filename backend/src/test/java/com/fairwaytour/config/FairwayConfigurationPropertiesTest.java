package com.fairwaytour.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FairwayConfigurationPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(FairwayRuntimeProperties.class);

    @Test
    void contextStartsWithFairwayPropertyBean() {
        contextRunner.run(context -> assertTrue(context.containsBean("fairwayRuntimeProperties")));
    }

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            FairwayRuntimeProperties fairway = context.getBean(FairwayRuntimeProperties.class);

            assertEquals(4, fairway.getRegistration().getMaxGroupSize());
            assertTrue(fairway.getRegistration().isEnforceOpenWindow());
            assertEquals(113, fairway.getHandicap().getStandardSlopeRating());
            assertEquals(18, fairway.getHandicap().getDefaultHoleCount());
            assertFalse(fairway.getHandicap().isApplyCourseRatingAdjustment());
            assertTrue(fairway.getFinalization().isAllowIncompleteScorecards());
            assertEquals("X-Player-Id", fairway.getApi().getPlayerIdHeader());
            assertEquals("X-Fairway-Admin", fairway.getApi().getAdminHeader());
        });
    }

    @Test
    void bindsOverrides() {
        contextRunner
                .withPropertyValues(
                        "fairway.registration.max-group-size=3",
                        "fairway.registration.enforce-open-window=false",
                        "fairway.handicap.default-hole-count=9",
                        "fairway.handicap.apply-course-rating-adjustment=true",
                        "fairway.finalization.allow-incomplete-scorecards=false",
                        "fairway.api.admin-header=X-Club-Admin"
                )
                .run(context -> {
                    FairwayRuntimeProperties fairway = context.getBean(FairwayRuntimeProperties.class);

                    assertEquals(3, fairway.getRegistration().getMaxGroupSize());
                    assertFalse(fairway.getRegistration().isEnforceOpenWindow());
                    assertEquals(9, fairway.getHandicap().getDefaultHoleCount());
                    assertTrue(fairway.getHandicap().isApplyCourseRatingAdjustment());
                    assertFalse(fairway.getFinalization().isAllowIncompleteScorecards());
                    assertEquals("X-Club-Admin", fairway.getApi().getAdminHeader());
                });
    }
}
