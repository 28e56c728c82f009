package com.fairwaytour.service;

import com.fairwaytour.dto.StandingsResponses;
import com.fairwaytour.model.Competition;
import com.fairwaytour.model.FinalResult;
import com.fairwaytour.model.ScoringType;
import com.fairwaytour.model.Tour;
import com.fairwaytour.model.TourCategory;
import com.fairwaytour.model.TourEnrollment;
import com.fairwaytour.repository.CompetitionRepository;
import com.fairwaytour.repository.FinalResultRepository;
import com.fairwaytour.repository.TourCategoryRepository;
import com.fairwaytour.repository.TourEnrollmentRepository;
import com.fairwaytour.repository.TourRepository;
import com.fairwaytour.web.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Season standings for a tour, summed from the final_results of its finalized competitions.
 * Live scores never feed into tour points.
 */
@Service
public class TourStandingsService {

    private static final Logger log = LoggerFactory.getLogger(TourStandingsService.class);

    private static final Comparator<PlayerTotals> STANDING_ORDER = Comparator
            .comparingInt(PlayerTotals::totalPoints).reversed()
            .thenComparing(Comparator.comparingInt(PlayerTotals::competitionsPlayed).reversed())
            .thenComparing(PlayerTotals::playerName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(PlayerTotals::playerId);

    private final TourRepository tourRepository;
    private final TourCategoryRepository tourCategoryRepository;
    private final TourEnrollmentRepository tourEnrollmentRepository;
    private final CompetitionRepository competitionRepository;
    private final FinalResultRepository finalResultRepository;

    public TourStandingsService(
            TourRepository tourRepository,
            TourCategoryRepository tourCategoryRepository,
            TourEnrollmentRepository tourEnrollmentRepository,
            CompetitionRepository competitionRepository,
            FinalResultRepository finalResultRepository
    ) {
        this.tourRepository = tourRepository;
        this.tourCategoryRepository = tourCategoryRepository;
        this.tourEnrollmentRepository = tourEnrollmentRepository;
        this.competitionRepository = competitionRepository;
        this.finalResultRepository = finalResultRepository;
    }

    @Transactional(readOnly = true)
    public StandingsResponses.TourStandings getStandings(
            UUID tourId,
            UUID categoryId,
            ScoringType requestedScoringType
    ) {
        Tour tour = tourRepository.findById(tourId)
                .orElseThrow(() -> NotFoundException.tour(tourId));
        ScoringType scoringType = requestedScoringType != null
                ? requestedScoringType
                : CompetitionStandingsService.defaultScoringType(tour.getScoringMode());
        Set<UUID> categoryMembers = categoryId != null ? categoryMembers(tourId, categoryId) : null;

        List<Competition> competitions =
                competitionRepository.findByTourIdAndResultsFinalTrueOrderByCompetitionDateAscCreatedAtAsc(tourId);
        Map<UUID, Competition> competitionsById = competitions.stream()
                .collect(Collectors.toMap(Competition::getCompetitionId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<FinalResult> rows = competitionsById.isEmpty()
                ? List.of()
                : finalResultRepository.findByCompetitionIdInAndScoringType(competitionsById.keySet(), scoringType);

        Map<UUID, PlayerTotals> totalsByPlayer = new LinkedHashMap<>();
        for (FinalResult row : rows) {
            if (row.getPosition() == null) {
                continue;
            }
            if (categoryMembers != null && !categoryMembers.contains(row.getPlayerId())) {
                continue;
            }
            Competition competition = competitionsById.get(row.getCompetitionId());
            PlayerTotals totals = totalsByPlayer.computeIfAbsent(
                    row.getPlayerId(),
                    playerId -> new PlayerTotals(playerId, row.getPlayerName())
            );
            totals.add(new StandingsResponses.TourCompetitionResult(
                    competition.getCompetitionId(),
                    competition.getName(),
                    competition.getCompetitionDate(),
                    row.getPosition(),
                    row.getPoints(),
                    row.getRelativeToPar()
            ));
        }

        List<PlayerTotals> sorted = new ArrayList<>(totalsByPlayer.values());
        sorted.sort(STANDING_ORDER);

        List<StandingsResponses.TourStanding> standings = new ArrayList<>(sorted.size());
        int position = 0;
        for (int i = 0; i < sorted.size(); i++) {
            PlayerTotals current = sorted.get(i);
            if (i == 0 || !current.sharesPositionWith(sorted.get(i - 1))) {
                position = i + 1;
            }
            standings.add(current.toStanding(position, competitionsById));
        }

        log.debug(
                "Computed tour standings: tourId={}, scoringType={}, categoryId={}, players={}",
                tourId,
                scoringType,
                categoryId,
                standings.size()
        );
        return new StandingsResponses.TourStandings(
                tour.getTourId(),
                tour.getName(),
                scoringType,
                categoryId,
                competitions.size(),
                standings
        );
    }

    private Set<UUID> categoryMembers(UUID tourId, UUID categoryId) {
        TourCategory category = tourCategoryRepository.findById(categoryId)
                .filter(candidate -> tourId.equals(candidate.getTourId()))
                .orElseThrow(() -> new NotFoundException("Category not found: " + categoryId));
        return tourEnrollmentRepository.findByTourId(tourId).stream()
                .filter(enrollment -> category.getCategoryId().equals(enrollment.getCategoryId()))
                .map(TourEnrollment::getPlayerId)
                .collect(Collectors.toSet());
    }

    private static final class PlayerTotals {
        private final UUID playerId;
        private final String playerName;
        private final List<StandingsResponses.TourCompetitionResult> competitions = new ArrayList<>();
        private int totalPoints;

        private PlayerTotals(UUID playerId, String playerName) {
            this.playerId = playerId;
            this.playerName = playerName;
        }

        private void add(StandingsResponses.TourCompetitionResult result) {
            competitions.add(result);
            totalPoints += result.points();
        }

        private UUID playerId() {
            return playerId;
        }

        private String playerName() {
            return playerName;
        }

        private int totalPoints() {
            return totalPoints;
        }

        private int competitionsPlayed() {
            return competitions.size();
        }

        private boolean sharesPositionWith(PlayerTotals other) {
            return totalPoints == other.totalPoints && competitionsPlayed() == other.competitionsPlayed();
        }

        private StandingsResponses.TourStanding toStanding(int position, Map<UUID, Competition> competitionsById) {
            List<UUID> competitionOrder = new ArrayList<>(competitionsById.keySet());
            List<StandingsResponses.TourCompetitionResult> ordered = competitions.stream()
                    .sorted(Comparator.comparingInt(result -> competitionOrder.indexOf(result.competitionId())))
                    .toList();
            return new StandingsResponses.TourStanding(
                    position,
                    playerId,
                    playerName,
                    totalPoints,
                    competitionsPlayed(),
                    ordered
            );
        }
    }
}
