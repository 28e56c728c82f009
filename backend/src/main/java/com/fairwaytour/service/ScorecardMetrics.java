package com.fairwaytour.service;

import java.util.List;

/**
 * Derived figures for one scorecard. Hole values: positive = strokes, 0 = not played, -1 = picked up.
 * A manual total stands for a complete round of that many strokes with no hole breakdown.
 */
public record ScorecardMetrics(
        int holeCount,
        int holesPlayed,
        int grossScore,
        int relativeToPar,
        boolean pickedUp,
        boolean complete,
        boolean manual
) {

    public static final int PICKED_UP = -1;

    public static ScorecardMetrics of(List<Integer> scores, Integer manualTotal, List<Integer> pars, int holeCount) {
        if (manualTotal != null) {
            int totalPar = 0;
            if (pars != null) {
                for (Integer par : pars) {
                    totalPar += par != null ? par : 0;
                }
            }
            return new ScorecardMetrics(holeCount, holeCount, manualTotal, manualTotal - totalPar, false, true, true);
        }

        int holesPlayed = 0;
        int gross = 0;
        int relativeToPar = 0;
        boolean pickedUp = false;
        boolean allScored = true;

        for (int i = 0; i < holeCount; i++) {
            int shots = holeScore(scores, i);
            if (shots > 0) {
                holesPlayed++;
                gross += shots;
                if (pars != null && i < pars.size() && pars.get(i) != null) {
                    relativeToPar += shots - pars.get(i);
                }
            } else if (shots == PICKED_UP) {
                holesPlayed++;
                pickedUp = true;
                allScored = false;
            } else {
                allScored = false;
            }
        }
        return new ScorecardMetrics(holeCount, holesPlayed, gross, relativeToPar, pickedUp, allScored, false);
    }

    static int holeScore(List<Integer> scores, int index) {
        if (scores == null || index >= scores.size()) {
            return 0;
        }
        Integer value = scores.get(index);
        return value != null ? value : 0;
    }
}
