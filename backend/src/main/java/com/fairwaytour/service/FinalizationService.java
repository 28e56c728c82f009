package com.fairwaytour.service;

import com.fairwaytour.config.FairwayRuntimeProperties;
import com.fairwaytour.dto.FinalizationResponses;
import com.fairwaytour.event.CompetitionFinalizedEvent;
import com.fairwaytour.event.CompetitionReopenedEvent;
import com.fairwaytour.mapper.FairwayResponseMapper;
import com.fairwaytour.model.Competition;
import com.fairwaytour.model.FinalResult;
import com.fairwaytour.model.ScoringMode;
import com.fairwaytour.model.ScoringType;
import com.fairwaytour.model.TourEnrollmentStatus;
import com.fairwaytour.repository.CompetitionRepository;
import com.fairwaytour.repository.FinalResultRepository;
import com.fairwaytour.repository.TourEnrollmentRepository;
import com.fairwaytour.web.AlreadyFinalizedException;
import com.fairwaytour.web.ConflictException;
import com.fairwaytour.web.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One-way snapshot of a competition's results into final_results. Once written, the snapshot is the
 * only source for that competition's leaderboard and tour points until an admin reopens it.
 */
@Service
public class FinalizationService {

    private static final Logger log = LoggerFactory.getLogger(FinalizationService.class);

    private final CompetitionRepository competitionRepository;
    private final FinalResultRepository finalResultRepository;
    private final TourEnrollmentRepository tourEnrollmentRepository;
    private final CompetitionScopeResolver competitionScopeResolver;
    private final CompetitionStandingsService competitionStandingsService;
    private final StandingsEngine standingsEngine;
    private final PointsCalculator pointsCalculator;
    private final FairwayResponseMapper fairwayResponseMapper;
    private final FairwayRuntimeProperties fairwayRuntimeProperties;
    private final ApplicationEventPublisher applicationEventPublisher;

    public FinalizationService(
            CompetitionRepository competitionRepository,
            FinalResultRepository finalResultRepository,
            TourEnrollmentRepository tourEnrollmentRepository,
            CompetitionScopeResolver competitionScopeResolver,
            CompetitionStandingsService competitionStandingsService,
            StandingsEngine standingsEngine,
            PointsCalculator pointsCalculator,
            FairwayResponseMapper fairwayResponseMapper,
            FairwayRuntimeProperties fairwayRuntimeProperties,
            ApplicationEventPublisher applicationEventPublisher
    ) {
        this.competitionRepository = competitionRepository;
        this.finalResultRepository = finalResultRepository;
        this.tourEnrollmentRepository = tourEnrollmentRepository;
        this.competitionScopeResolver = competitionScopeResolver;
        this.competitionStandingsService = competitionStandingsService;
        this.standingsEngine = standingsEngine;
        this.pointsCalculator = pointsCalculator;
        this.fairwayResponseMapper = fairwayResponseMapper;
        this.fairwayRuntimeProperties = fairwayRuntimeProperties;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Transactional
    public FinalizationResponses.Finalization finalizeCompetition(UUID competitionId) {
        Competition competition = competitionRepository.findByCompetitionIdForUpdate(competitionId)
                .orElseThrow(() -> NotFoundException.competition(competitionId));
        if (competition.isResultsFinal()) {
            log.warn("Rejected finalize of already final competition: competitionId={}", competitionId);
            throw new AlreadyFinalizedException(competitionId);
        }

        CompetitionScope scope = competitionScopeResolver.resolve(competition);
        CompetitionStandingsService.CompetitionField field = competitionStandingsService.loadField(competition);
        CourseLayout layout = field.layout();
        if (!fairwayRuntimeProperties.getFinalization().isAllowIncompleteScorecards()) {
            requireCompleteScorecards(field);
        }

        OffsetDateTime now = OffsetDateTime.now();
        List<FinalResult> rows = new ArrayList<>();
        for (ScoringType scoringType : scoringTypes(competition.getScoringMode())) {
            List<StandingsEngine.RankedEntry> ranked = standingsEngine.rank(
                    field.entrants(),
                    scoringType,
                    layout.pars(),
                    layout.holeCount(),
                    StandingsEngine.RankingPolicy.COMPLETE_CARDS_ONLY
            );
            int numberOfPlayers = numberOfPlayers(scope, ranked);
            for (StandingsEngine.RankedEntry entry : ranked) {
                rows.add(toFinalResult(competition, scope, scoringType, entry, numberOfPlayers, now));
            }
        }
        finalResultRepository.saveAll(rows);

        competition.setResultsFinal(true);
        competition.setResultsFinalizedAt(now);
        competition.setUpdatedAt(now);
        Competition saved = competitionRepository.save(competition);
        applicationEventPublisher.publishEvent(new CompetitionFinalizedEvent(
                competitionId,
                competition.getTourId(),
                rows.size(),
                now
        ));

        log.info(
                "Finalized competition: competitionId={}, scoringMode={}, participants={}, results={}",
                competitionId,
                competition.getScoringMode(),
                field.entrants().size(),
                rows.size()
        );
        return fairwayResponseMapper.toFinalizationResponse(saved, rows.size());
    }

    @Transactional
    public FinalizationResponses.Finalization reopen(UUID competitionId) {
        Competition competition = competitionRepository.findByCompetitionIdForUpdate(competitionId)
                .orElseThrow(() -> NotFoundException.competition(competitionId));
        if (!competition.isResultsFinal()) {
            throw ConflictException.notFinalized("Competition results are not final: " + competitionId);
        }

        int deleted = finalResultRepository.deleteByCompetitionId(competitionId);
        OffsetDateTime now = OffsetDateTime.now();
        competition.setResultsFinal(false);
        competition.setResultsFinalizedAt(null);
        competition.setUpdatedAt(now);
        Competition saved = competitionRepository.save(competition);
        applicationEventPublisher.publishEvent(new CompetitionReopenedEvent(
                competitionId,
                competition.getTourId(),
                now
        ));

        log.info("Reopened competition: competitionId={}, deletedResults={}", competitionId, deleted);
        return fairwayResponseMapper.toFinalizationResponse(saved, 0);
    }

    @Transactional(readOnly = true)
    public FinalizationResponses.FinalResults getFinalResults(UUID competitionId, ScoringType requestedScoringType) {
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> NotFoundException.competition(competitionId));
        if (!competition.isResultsFinal()) {
            throw ConflictException.notFinalized("Competition results are not final: " + competitionId);
        }
        ScoringType scoringType = requestedScoringType != null
                ? requestedScoringType
                : CompetitionStandingsService.defaultScoringType(competition.getScoringMode());
        List<FinalResult> rows = finalResultRepository
                .findByCompetitionIdAndScoringTypeOrderByPositionAscPlayerNameAsc(competitionId, scoringType);
        return new FinalizationResponses.FinalResults(
                competitionId,
                scoringType,
                competition.getResultsFinalizedAt(),
                fairwayResponseMapper.toFinalResultResponses(rows)
        );
    }

    static List<ScoringType> scoringTypes(ScoringMode scoringMode) {
        if (scoringMode == ScoringMode.BOTH) {
            return List.of(ScoringType.GROSS, ScoringType.NET);
        }
        return List.of(scoringMode == ScoringMode.NET ? ScoringType.NET : ScoringType.GROSS);
    }

    private void requireCompleteScorecards(CompetitionStandingsService.CompetitionField field) {
        CourseLayout layout = field.layout();
        long incomplete = field.entrants().stream()
                .filter(entrant -> !entrant.disqualified())
                .filter(entrant -> !ScorecardMetrics.of(
                        entrant.scores(),
                        entrant.manualScoreTotal(),
                        layout.pars(),
                        layout.holeCount()
                ).complete())
                .count();
        if (incomplete > 0) {
            throw ConflictException.incompleteScorecards(
                    incomplete + " scorecard(s) are incomplete for competition "
                            + field.competition().getCompetitionId()
            );
        }
    }

    /**
     * Field size for the default points formula: active tour enrollments, else the ranked finishers.
     */
    private int numberOfPlayers(CompetitionScope scope, List<StandingsEngine.RankedEntry> ranked) {
        int finishers = (int) ranked.stream().filter(StandingsEngine.RankedEntry::isRanked).count();
        if (scope instanceof CompetitionScope.TourLinked tour) {
            long enrolled = tourEnrollmentRepository.countByTourIdAndStatus(tour.tourId(), TourEnrollmentStatus.ACTIVE);
            return enrolled > 0 ? (int) enrolled : finishers;
        }
        return finishers;
    }

    private FinalResult toFinalResult(
            Competition competition,
            CompetitionScope scope,
            ScoringType scoringType,
            StandingsEngine.RankedEntry entry,
            int numberOfPlayers,
            OffsetDateTime now
    ) {
        int points = 0;
        if (entry.isRanked() && scope instanceof CompetitionScope.TourLinked tour) {
            points = pointsCalculator.awardedPoints(
                    entry.position(),
                    tour.pointTemplate(),
                    numberOfPlayers,
                    competition.getPointsMultiplier()
            );
        }
        FinalResult row = new FinalResult();
        row.setResultId(UUID.randomUUID());
        row.setCompetitionId(competition.getCompetitionId());
        row.setParticipantId(entry.participantId());
        row.setPlayerId(entry.playerId());
        row.setPlayerName(entry.playerName() != null ? entry.playerName() : entry.playerId().toString());
        row.setScoringType(scoringType);
        row.setPosition(entry.position());
        row.setPoints(points);
        row.setGrossScore(entry.grossScore());
        row.setNetScore(entry.netScore());
        row.setRelativeToPar(entry.relativeToPar());
        row.setHolesPlayed(entry.holesPlayed());
        row.setComplete(entry.complete());
        row.setDisqualified(entry.disqualified());
        row.setCalculatedAt(now);
        return row;
    }
}
