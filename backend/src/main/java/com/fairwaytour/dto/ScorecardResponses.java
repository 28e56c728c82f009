package com.fairwaytour.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class ScorecardResponses {

    private ScorecardResponses() {
    }

    public record Scorecard(
            UUID participantId,
            UUID competitionId,
            UUID playerId,
            UUID teeTimeId,
            List<Integer> scores,
            Integer manualScoreTotal,
            int holeCount,
            int holesPlayed,
            Integer grossScore,
            Integer netScore,
            Integer relativeToPar,
            BigDecimal handicapIndex,
            int handicapStrokes,
            boolean complete,
            boolean pickedUp,
            boolean locked,
            OffsetDateTime lockedAt,
            boolean disqualified,
            String dqReason,
            OffsetDateTime updatedAt
    ) {
    }
}
