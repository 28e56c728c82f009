package com.fairwaytour.service;

import com.fairwaytour.config.FairwayRuntimeProperties;
import com.fairwaytour.model.CompetitionCategoryTee;
import com.fairwaytour.model.Competition;
import com.fairwaytour.model.CourseTee;
import com.fairwaytour.model.TourEnrollment;
import com.fairwaytour.repository.CompetitionCategoryTeeRepository;
import com.fairwaytour.repository.CourseTeeRepository;
import com.fairwaytour.repository.TourEnrollmentRepository;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class CourseLayoutResolver {

    private final CourseTeeRepository courseTeeRepository;
    private final CompetitionCategoryTeeRepository competitionCategoryTeeRepository;
    private final TourEnrollmentRepository tourEnrollmentRepository;
    private final FairwayRuntimeProperties fairwayRuntimeProperties;

    public CourseLayoutResolver(
            CourseTeeRepository courseTeeRepository,
            CompetitionCategoryTeeRepository competitionCategoryTeeRepository,
            TourEnrollmentRepository tourEnrollmentRepository,
            FairwayRuntimeProperties fairwayRuntimeProperties
    ) {
        this.courseTeeRepository = courseTeeRepository;
        this.competitionCategoryTeeRepository = competitionCategoryTeeRepository;
        this.tourEnrollmentRepository = tourEnrollmentRepository;
        this.fairwayRuntimeProperties = fairwayRuntimeProperties;
    }

    public CourseLayout resolve(Competition competition) {
        CourseTee tee = competition.getTeeId() != null
                ? courseTeeRepository.findById(competition.getTeeId()).orElse(null)
                : null;
        if (tee == null || tee.getPars() == null || tee.getPars().isEmpty()) {
            return new CourseLayout(tee, List.of(), fairwayRuntimeProperties.getHandicap().getDefaultHoleCount());
        }
        return new CourseLayout(tee, List.copyOf(tee.getPars()), tee.getPars().size());
    }

    /**
     * Category id to the tee that category plays from. Empty for standalone competitions.
     */
    public Map<UUID, CourseTee> resolveCategoryTees(Competition competition) {
        if (competition.getTourId() == null) {
            return Map.of();
        }
        List<CompetitionCategoryTee> mappings =
                competitionCategoryTeeRepository.findByCompetitionId(competition.getCompetitionId());
        if (mappings.isEmpty()) {
            return Map.of();
        }
        Map<UUID, CourseTee> teesById = courseTeeRepository.findAllById(
                        mappings.stream().map(CompetitionCategoryTee::getTeeId).collect(Collectors.toSet())
                ).stream()
                .collect(Collectors.toMap(CourseTee::getTeeId, Function.identity()));
        Map<UUID, CourseTee> teesByCategory = new HashMap<>();
        for (CompetitionCategoryTee mapping : mappings) {
            CourseTee tee = teesById.get(mapping.getTeeId());
            if (tee != null) {
                teesByCategory.put(mapping.getCategoryId(), tee);
            }
        }
        return teesByCategory;
    }

    /**
     * Tee whose ratings set one player's course handicap: the player's category tee when the competition
     * assigns one, else the competition tee.
     */
    public CourseTee resolveHandicapTee(Competition competition, CourseLayout layout, UUID playerId) {
        if (competition.getTourId() == null) {
            return layout.tee();
        }
        UUID categoryId = tourEnrollmentRepository.findByTourIdAndPlayerId(competition.getTourId(), playerId)
                .map(TourEnrollment::getCategoryId)
                .orElse(null);
        if (categoryId == null) {
            return layout.tee();
        }
        return competitionCategoryTeeRepository
                .findByCompetitionIdAndCategoryId(competition.getCompetitionId(), categoryId)
                .flatMap(mapping -> courseTeeRepository.findById(mapping.getTeeId()))
                .orElse(layout.tee());
    }
}
