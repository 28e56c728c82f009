package com.fairwaytour.dto;

import com.fairwaytour.model.ScoringType;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class StandingsResponses {

    private StandingsResponses() {
    }

    public record LeaderboardEntry(
            Integer position,
            UUID participantId,
            UUID playerId,
            String playerName,
            Integer grossScore,
            Integer netScore,
            Integer relativeToPar,
            Integer handicapStrokes,
            int holesPlayed,
            boolean complete,
            boolean disqualified,
            Integer points
    ) {
    }

    public record Leaderboard(
            UUID competitionId,
            String competitionName,
            ScoringType scoringType,
            UUID categoryId,
            boolean resultsFinal,
            OffsetDateTime resultsFinalizedAt,
            List<LeaderboardEntry> entries
    ) {
    }

    public record TourCompetitionResult(
            UUID competitionId,
            String competitionName,
            LocalDate competitionDate,
            Integer position,
            int points,
            Integer relativeToPar
    ) {
    }

    public record TourStanding(
            int position,
            UUID playerId,
            String playerName,
            int totalPoints,
            int competitionsPlayed,
            List<TourCompetitionResult> competitions
    ) {
    }

    public record TourStandings(
            UUID tourId,
            String tourName,
            ScoringType scoringType,
            UUID categoryId,
            int finalizedCompetitions,
            List<TourStanding> standings
    ) {
    }
}
