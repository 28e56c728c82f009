package com.fairwaytour.mapper;

import com.fairwaytour.dto.FinalizationResponses;
import com.fairwaytour.dto.RegistrationResponses;
import com.fairwaytour.dto.ScorecardResponses;
import com.fairwaytour.dto.StandingsResponses;
import com.fairwaytour.model.Competition;
import com.fairwaytour.model.FinalResult;
import com.fairwaytour.model.Participant;
import com.fairwaytour.model.Registration;
import com.fairwaytour.model.RegistrationStatus;
import com.fairwaytour.service.ScorecardMetrics;
import com.fairwaytour.service.StandingsEngine;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class FairwayResponseMapper {

    public RegistrationResponses.Registration toRegistrationResponse(Registration registration) {
        return toRegistrationResponse(registration, registration.getStatus());
    }

    /**
     * Snapshot with an overridden status, used for withdrawn registrations whose row is already gone.
     */
    public RegistrationResponses.Registration toRegistrationResponse(
            Registration registration,
            RegistrationStatus status
    ) {
        return new RegistrationResponses.Registration(
                registration.getRegistrationId(),
                registration.getCompetitionId(),
                registration.getPlayerId(),
                status,
                registration.getTeeTimeId(),
                registration.getParticipantId(),
                registration.getGroupCreatedBy(),
                registration.getRegisteredAt(),
                registration.getStartedAt(),
                registration.getFinishedAt()
        );
    }

    public ScorecardResponses.Scorecard toScorecardResponse(
            Participant participant,
            ScorecardMetrics metrics,
            boolean parsKnown,
            int handicapStrokes
    ) {
        boolean hasScore = metrics.holesPlayed() > 0;
        return new ScorecardResponses.Scorecard(
                participant.getParticipantId(),
                participant.getCompetitionId(),
                participant.getPlayerId(),
                participant.getTeeTimeId(),
                List.copyOf(participant.getScores()),
                participant.getManualScoreTotal(),
                metrics.holeCount(),
                metrics.holesPlayed(),
                hasScore ? metrics.grossScore() : null,
                hasScore ? metrics.grossScore() - handicapStrokes : null,
                hasScore && parsKnown ? metrics.relativeToPar() : null,
                participant.getHandicapIndex(),
                handicapStrokes,
                metrics.complete(),
                metrics.pickedUp(),
                participant.isLocked(),
                participant.getLockedAt(),
                participant.isDisqualified(),
                participant.getDqReason(),
                participant.getUpdatedAt()
        );
    }

    public StandingsResponses.LeaderboardEntry toLeaderboardEntry(StandingsEngine.RankedEntry entry) {
        return new StandingsResponses.LeaderboardEntry(
                entry.position(),
                entry.participantId(),
                entry.playerId(),
                entry.playerName(),
                entry.grossScore(),
                entry.netScore(),
                entry.relativeToPar(),
                entry.handicapStrokes(),
                entry.holesPlayed(),
                entry.complete(),
                entry.disqualified(),
                null
        );
    }

    public StandingsResponses.LeaderboardEntry toLeaderboardEntry(FinalResult result, Integer position) {
        Integer handicapStrokes = result.getGrossScore() != null && result.getNetScore() != null
                ? result.getGrossScore() - result.getNetScore()
                : null;
        return new StandingsResponses.LeaderboardEntry(
                position,
                result.getParticipantId(),
                result.getPlayerId(),
                result.getPlayerName(),
                result.getGrossScore(),
                result.getNetScore(),
                result.getRelativeToPar(),
                handicapStrokes,
                result.getHolesPlayed(),
                result.isComplete(),
                result.isDisqualified(),
                result.getPoints()
        );
    }

    public FinalizationResponses.FinalResult toFinalResultResponse(FinalResult result) {
        return new FinalizationResponses.FinalResult(
                result.getResultId(),
                result.getParticipantId(),
                result.getPlayerId(),
                result.getPlayerName(),
                result.getScoringType(),
                result.getPosition(),
                result.getPoints(),
                result.getGrossScore(),
                result.getNetScore(),
                result.getRelativeToPar(),
                result.getHolesPlayed(),
                result.isComplete(),
                result.isDisqualified(),
                result.getCalculatedAt()
        );
    }

    public List<FinalizationResponses.FinalResult> toFinalResultResponses(Collection<FinalResult> results) {
        return results.stream().map(this::toFinalResultResponse).toList();
    }

    public FinalizationResponses.Finalization toFinalizationResponse(Competition competition, int resultCount) {
        return new FinalizationResponses.Finalization(
                competition.getCompetitionId(),
                competition.isResultsFinal(),
                competition.getResultsFinalizedAt(),
                resultCount
        );
    }
}
