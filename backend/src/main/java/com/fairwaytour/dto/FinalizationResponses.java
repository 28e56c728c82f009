package com.fairwaytour.dto;

import com.fairwaytour.model.ScoringType;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class FinalizationResponses {

    private FinalizationResponses() {
    }

    public record FinalResult(
            UUID resultId,
            UUID participantId,
            UUID playerId,
            String playerName,
            ScoringType scoringType,
            Integer position,
            int points,
            Integer grossScore,
            Integer netScore,
            Integer relativeToPar,
            int holesPlayed,
            boolean complete,
            boolean disqualified,
            OffsetDateTime calculatedAt
    ) {
    }

    public record Finalization(
            UUID competitionId,
            boolean resultsFinal,
            OffsetDateTime resultsFinalizedAt,
            int resultCount
    ) {
    }

    public record FinalResults(
            UUID competitionId,
            ScoringType scoringType,
            OffsetDateTime resultsFinalizedAt,
            List<FinalResult> results
    ) {
    }
}
