package com.fairwaytour.service;

import com.fairwaytour.dto.StandingsResponses;
import com.fairwaytour.mapper.FairwayResponseMapper;
import com.fairwaytour.model.Competition;
import com.fairwaytour.model.CourseTee;
import com.fairwaytour.model.FinalResult;
import com.fairwaytour.model.Participant;
import com.fairwaytour.model.Player;
import com.fairwaytour.model.ScoringMode;
import com.fairwaytour.model.ScoringType;
import com.fairwaytour.model.TourCategory;
import com.fairwaytour.model.TourEnrollment;
import com.fairwaytour.repository.CompetitionRepository;
import com.fairwaytour.repository.FinalResultRepository;
import com.fairwaytour.repository.ParticipantRepository;
import com.fairwaytour.repository.PlayerRepository;
import com.fairwaytour.repository.TourCategoryRepository;
import com.fairwaytour.repository.TourEnrollmentRepository;
import com.fairwaytour.web.NotFoundException;
import com.fairwaytour.web.ValidationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Competition leaderboards. Live while the competition is open, read from the
 * final_results snapshot once it is final.
 */
@Service
public class CompetitionStandingsService {

    private final CompetitionRepository competitionRepository;
    private final ParticipantRepository participantRepository;
    private final PlayerRepository playerRepository;
    private final TourEnrollmentRepository tourEnrollmentRepository;
    private final TourCategoryRepository tourCategoryRepository;
    private final FinalResultRepository finalResultRepository;
    private final CourseLayoutResolver courseLayoutResolver;
    private final HandicapCalculator handicapCalculator;
    private final StandingsEngine standingsEngine;
    private final FairwayResponseMapper fairwayResponseMapper;

    public CompetitionStandingsService(
            CompetitionRepository competitionRepository,
            ParticipantRepository participantRepository,
            PlayerRepository playerRepository,
            TourEnrollmentRepository tourEnrollmentRepository,
            TourCategoryRepository tourCategoryRepository,
            FinalResultRepository finalResultRepository,
            CourseLayoutResolver courseLayoutResolver,
            HandicapCalculator handicapCalculator,
            StandingsEngine standingsEngine,
            FairwayResponseMapper fairwayResponseMapper
    ) {
        this.competitionRepository = competitionRepository;
        this.participantRepository = participantRepository;
        this.playerRepository = playerRepository;
        this.tourEnrollmentRepository = tourEnrollmentRepository;
        this.tourCategoryRepository = tourCategoryRepository;
        this.finalResultRepository = finalResultRepository;
        this.courseLayoutResolver = courseLayoutResolver;
        this.handicapCalculator = handicapCalculator;
        this.standingsEngine = standingsEngine;
        this.fairwayResponseMapper = fairwayResponseMapper;
    }

    @Transactional(readOnly = true)
    public StandingsResponses.Leaderboard getLeaderboard(
            UUID competitionId,
            ScoringType requestedScoringType,
            UUID categoryId
    ) {
        Competition competition = competitionRepository.findById(competitionId)
                .orElseThrow(() -> NotFoundException.competition(competitionId));
        ScoringType scoringType = requestedScoringType != null
                ? requestedScoringType
                : defaultScoringType(competition.getScoringMode());
        Set<UUID> categoryMembers = categoryId != null ? categoryMembers(competition, categoryId) : null;

        List<StandingsResponses.LeaderboardEntry> entries;
        if (competition.isResultsFinal()) {
            entries = finalLeaderboard(competitionId, scoringType, categoryMembers);
        } else {
            CompetitionField field = loadField(competition);
            List<StandingsEngine.Entrant> entrants = categoryMembers == null
                    ? field.entrants()
                    : field.entrants().stream()
                    .filter(entrant -> categoryMembers.contains(entrant.playerId()))
                    .toList();
            entries = standingsEngine.rank(
                            entrants,
                            scoringType,
                            field.layout().pars(),
                            field.layout().holeCount(),
                            StandingsEngine.RankingPolicy.LIVE
                    ).stream()
                    .map(fairwayResponseMapper::toLeaderboardEntry)
                    .toList();
        }

        return new StandingsResponses.Leaderboard(
                competition.getCompetitionId(),
                competition.getName(),
                scoringType,
                categoryId,
                competition.isResultsFinal(),
                competition.getResultsFinalizedAt(),
                entries
        );
    }

    /**
     * Loads every participant of the competition with a handicap-stroke allowance for the tee the
     * participant's category plays from, or the competition tee.
     */
    @Transactional(readOnly = true)
    public CompetitionField loadField(Competition competition) {
        CourseLayout layout = courseLayoutResolver.resolve(competition);
        Map<UUID, CourseTee> categoryTees = courseLayoutResolver.resolveCategoryTees(competition);
        List<Participant> participants =
                participantRepository.findByCompetitionIdOrderByCreatedAtAsc(competition.getCompetitionId());
        Map<UUID, Player> playersById = playerRepository.findAllById(
                        participants.stream().map(Participant::getPlayerId).collect(Collectors.toSet())
                ).stream()
                .collect(Collectors.toMap(Player::getPlayerId, Function.identity()));
        Map<UUID, UUID> categoryByPlayer = new HashMap<>();
        if (competition.getTourId() != null) {
            for (TourEnrollment enrollment : tourEnrollmentRepository.findByTourId(competition.getTourId())) {
                if (enrollment.getCategoryId() != null) {
                    categoryByPlayer.put(enrollment.getPlayerId(), enrollment.getCategoryId());
                }
            }
        }

        List<StandingsEngine.Entrant> entrants = participants.stream()
                .map(participant -> {
                    Player player = playersById.get(participant.getPlayerId());
                    UUID categoryId = categoryByPlayer.get(participant.getPlayerId());
                    CourseTee handicapTee = categoryId != null
                            ? categoryTees.getOrDefault(categoryId, layout.tee())
                            : layout.tee();
                    return new StandingsEngine.Entrant(
                            participant.getParticipantId(),
                            participant.getPlayerId(),
                            player != null ? player.getName() : null,
                            categoryId,
                            participant.getScores(),
                            participant.getManualScoreTotal(),
                            handicapCalculator.handicapStrokes(participant.getHandicapIndex(), handicapTee),
                            participant.isDisqualified()
                    );
                })
                .toList();
        return new CompetitionField(competition, layout, entrants);
    }

    static ScoringType defaultScoringType(ScoringMode scoringMode) {
        return scoringMode == ScoringMode.NET ? ScoringType.NET : ScoringType.GROSS;
    }

    private List<StandingsResponses.LeaderboardEntry> finalLeaderboard(
            UUID competitionId,
            ScoringType scoringType,
            Set<UUID> categoryMembers
    ) {
        List<FinalResult> rows = finalResultRepository
                .findByCompetitionIdAndScoringTypeOrderByPositionAscPlayerNameAsc(competitionId, scoringType);
        if (categoryMembers == null) {
            return rows.stream()
                    .map(row -> fairwayResponseMapper.toLeaderboardEntry(row, row.getPosition()))
                    .toList();
        }
        List<FinalResult> filtered = rows.stream()
                .filter(row -> categoryMembers.contains(row.getPlayerId()))
                .toList();
        List<Integer> storedPositions = filtered.stream()
                .map(FinalResult::getPosition)
                .filter(Objects::nonNull)
                .toList();
        return filtered.stream()
                .map(row -> {
                    Integer position = null;
                    if (row.getPosition() != null) {
                        long better = storedPositions.stream().filter(p -> p < row.getPosition()).count();
                        position = (int) better + 1;
                    }
                    return fairwayResponseMapper.toLeaderboardEntry(row, position);
                })
                .toList();
    }

    private Set<UUID> categoryMembers(Competition competition, UUID categoryId) {
        if (competition.getTourId() == null) {
            throw new ValidationException("category filter applies to tour competitions only");
        }
        TourCategory category = tourCategoryRepository.findById(categoryId)
                .filter(candidate -> competition.getTourId().equals(candidate.getTourId()))
                .orElseThrow(() -> new NotFoundException("Category not found: " + categoryId));
        return tourEnrollmentRepository.findByTourId(competition.getTourId()).stream()
                .filter(enrollment -> category.getCategoryId().equals(enrollment.getCategoryId()))
                .map(TourEnrollment::getPlayerId)
                .collect(Collectors.toSet());
    }

    public record CompetitionField(
            Competition competition,
            CourseLayout layout,
            List<StandingsEngine.Entrant> entrants
    ) {
    }
}
