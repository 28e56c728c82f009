package com.fairwaytour.service;

import com.fairwaytour.model.PointTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

@Component
public class PointsCalculator {

    /**
     * Looks up the exact position key, then the "default" entry; a template without either yields 0.
     */
    public int pointsForRank(int rank, Map<String, Integer> pointsStructure) {
        if (rank <= 0 || pointsStructure == null) {
            return 0;
        }
        Integer exact = pointsStructure.get(Integer.toString(rank));
        if (exact != null) {
            return exact;
        }
        return pointsStructure.getOrDefault(PointTemplate.DEFAULT_POSITION_KEY, 0);
    }

    /**
     * Fallback when a tour has no point template:
     * 1st gets n + 2, 2nd gets n, k-th gets max(0, n - (k - 1)).
     */
    public int defaultFormulaPoints(int rank, int numberOfPlayers) {
        if (rank <= 0) {
            return 0;
        }
        if (rank == 1) {
            return numberOfPlayers + 2;
        }
        if (rank == 2) {
            return numberOfPlayers;
        }
        return Math.max(0, numberOfPlayers - (rank - 1));
    }

    public int awardedPoints(int rank, PointTemplate template, int numberOfPlayers, BigDecimal multiplier) {
        int basePoints = template != null
                ? pointsForRank(rank, template.getPointsStructure())
                : defaultFormulaPoints(rank, numberOfPlayers);
        BigDecimal effectiveMultiplier = multiplier != null ? multiplier : BigDecimal.ONE;
        return BigDecimal.valueOf(basePoints)
                .multiply(effectiveMultiplier)
                .setScale(0, RoundingMode.HALF_UP)
                .intValueExact();
    }
}
