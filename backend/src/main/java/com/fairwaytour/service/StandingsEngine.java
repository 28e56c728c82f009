package com.fairwaytour.service;

import com.fairwaytour.model.ScoringType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Ranks a competition field by gross or net total, lower is better.
 *
 * Ties on total are broken by count-back over the last half, last third, last sixth and
 * last hole of the card (holes 10-18, 13-18, 16-18, 18 on an 18-hole card), then hole by
 * hole from the last hole backward. Net count-back deducts the matching share of handicap
 * strokes. Count-back only runs between two complete hole-by-hole cards, so an incomplete or
 * manual-total card level on total is neither better nor worse than anyone in its block.
 * Every ranked entry sits at 1 + the number of entries strictly better.
 */
@Component
public class StandingsEngine {

    public enum RankingPolicy {
        /**
         * Every non-DQ card with at least one hole played is ranked.
         */
        LIVE,
        /**
         * Only complete cards (every hole scored, no pick-ups) are ranked.
         */
        COMPLETE_CARDS_ONLY
    }

    public List<RankedEntry> rank(
            List<Entrant> entrants,
            ScoringType scoringType,
            List<Integer> pars,
            int holeCount,
            RankingPolicy policy
    ) {
        List<ScoredEntrant> eligible = new ArrayList<>();
        List<ScoredEntrant> unranked = new ArrayList<>();
        for (Entrant entrant : entrants) {
            ScorecardMetrics metrics = ScorecardMetrics.of(entrant.scores(), entrant.manualScoreTotal(), pars, holeCount);
            int total = scoringType == ScoringType.NET
                    ? metrics.grossScore() - entrant.handicapStrokes()
                    : metrics.grossScore();
            ScoredEntrant scored = new ScoredEntrant(entrant, metrics, total);
            if (isRankable(scored, policy)) {
                eligible.add(scored);
            } else {
                unranked.add(scored);
            }
        }

        Comparator<ScoredEntrant> byName = Comparator
                .comparing((ScoredEntrant scored) -> scored.entrant().playerName(), Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
                .thenComparing(scored -> scored.entrant().participantId());
        eligible.sort(Comparator.comparingInt(ScoredEntrant::total).thenComparing(byName));
        unranked.sort(byName);

        List<Integer> segments = countBackSegments(holeCount);
        List<PositionedEntrant> positioned = new ArrayList<>(eligible.size());
        int blockStart = 0;
        while (blockStart < eligible.size()) {
            int total = eligible.get(blockStart).total();
            int blockEnd = blockStart;
            while (blockEnd < eligible.size() && eligible.get(blockEnd).total() == total) {
                blockEnd++;
            }
            List<ScoredEntrant> block = eligible.subList(blockStart, blockEnd);
            for (ScoredEntrant candidate : block) {
                int strictlyBetter = blockStart;
                for (ScoredEntrant other : block) {
                    if (other != candidate && compareCountBack(other, candidate, segments, scoringType, holeCount) < 0) {
                        strictlyBetter++;
                    }
                }
                positioned.add(new PositionedEntrant(candidate, strictlyBetter + 1));
            }
            blockStart = blockEnd;
        }
        positioned.sort(Comparator
                .comparingInt(PositionedEntrant::position)
                .thenComparing(PositionedEntrant::scored, byName));

        boolean parsKnown = pars != null && !pars.isEmpty();
        List<RankedEntry> ranked = new ArrayList<>(entrants.size());
        for (PositionedEntrant entry : positioned) {
            ranked.add(toRankedEntry(entry.scored(), entry.position(), scoringType, parsKnown));
        }
        for (ScoredEntrant scored : unranked) {
            ranked.add(toRankedEntry(scored, null, scoringType, parsKnown));
        }
        return ranked;
    }

    static List<Integer> countBackSegments(int holeCount) {
        Set<Integer> segments = new LinkedHashSet<>();
        for (int divisor : new int[]{2, 3, 6}) {
            int length = holeCount / divisor;
            if (length >= 1) {
                segments.add(length);
            }
        }
        for (int length = 1; length <= holeCount; length++) {
            segments.add(length);
        }
        return List.copyOf(segments);
    }

    private static boolean isRankable(ScoredEntrant scored, RankingPolicy policy) {
        if (scored.entrant().disqualified() || scored.metrics().holesPlayed() == 0) {
            return false;
        }
        return policy == RankingPolicy.LIVE || scored.metrics().complete();
    }

    private static int compareCountBack(
            ScoredEntrant a,
            ScoredEntrant b,
            List<Integer> segments,
            ScoringType scoringType,
            int holeCount
    ) {
        if (!countsBack(a) || !countsBack(b)) {
            return 0;
        }
        for (int length : segments) {
            double left = segmentTotal(a, length, scoringType, holeCount);
            double right = segmentTotal(b, length, scoringType, holeCount);
            int result = Double.compare(left, right);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static boolean countsBack(ScoredEntrant scored) {
        return scored.metrics().complete() && !scored.metrics().manual();
    }

    private static double segmentTotal(ScoredEntrant scored, int length, ScoringType scoringType, int holeCount) {
        List<Integer> scores = scored.entrant().scores();
        int sum = 0;
        for (int i = holeCount - length; i < holeCount; i++) {
            sum += Math.max(0, ScorecardMetrics.holeScore(scores, i));
        }
        if (scoringType == ScoringType.NET) {
            return sum - (double) scored.entrant().handicapStrokes() * length / holeCount;
        }
        return sum;
    }

    private static RankedEntry toRankedEntry(
            ScoredEntrant scored,
            Integer position,
            ScoringType scoringType,
            boolean parsKnown
    ) {
        Entrant entrant = scored.entrant();
        ScorecardMetrics metrics = scored.metrics();
        boolean hasScore = metrics.holesPlayed() > 0;
        Integer gross = hasScore ? metrics.grossScore() : null;
        Integer net = hasScore ? metrics.grossScore() - entrant.handicapStrokes() : null;
        Integer relativeToPar = null;
        if (hasScore && parsKnown) {
            relativeToPar = scoringType == ScoringType.NET
                    ? metrics.relativeToPar() - entrant.handicapStrokes()
                    : metrics.relativeToPar();
        }
        return new RankedEntry(
                entrant.participantId(),
                entrant.playerId(),
                entrant.playerName(),
                entrant.categoryId(),
                position,
                gross,
                net,
                hasScore ? scored.total() : null,
                relativeToPar,
                entrant.handicapStrokes(),
                metrics.holesPlayed(),
                metrics.complete(),
                metrics.pickedUp(),
                entrant.disqualified()
        );
    }

    public record Entrant(
            UUID participantId,
            UUID playerId,
            String playerName,
            UUID categoryId,
            List<Integer> scores,
            Integer manualScoreTotal,
            int handicapStrokes,
            boolean disqualified
    ) {
    }

    public record RankedEntry(
            UUID participantId,
            UUID playerId,
            String playerName,
            UUID categoryId,
            Integer position,
            Integer grossScore,
            Integer netScore,
            Integer total,
            Integer relativeToPar,
            int handicapStrokes,
            int holesPlayed,
            boolean complete,
            boolean pickedUp,
            boolean disqualified
    ) {
        public boolean isRanked() {
            return position != null;
        }
    }

    private record ScoredEntrant(
            Entrant entrant,
            ScorecardMetrics metrics,
            int total
    ) {
    }

    private record PositionedEntrant(
            ScoredEntrant scored,
            int position
    ) {
    }
}
