package com.fairwaytour.service;

import com.fairwaytour.model.Competition;
import com.fairwaytour.model.PointTemplate;
import com.fairwaytour.model.Tour;
import com.fairwaytour.repository.PointTemplateRepository;
import com.fairwaytour.repository.TourRepository;
import com.fairwaytour.web.NotFoundException;
import org.springframework.stereotype.Component;

@Component
public class CompetitionScopeResolver {

    private final TourRepository tourRepository;
    private final PointTemplateRepository pointTemplateRepository;

    public CompetitionScopeResolver(
            TourRepository tourRepository,
            PointTemplateRepository pointTemplateRepository
    ) {
        this.tourRepository = tourRepository;
        this.pointTemplateRepository = pointTemplateRepository;
    }

    public CompetitionScope resolve(Competition competition) {
        if (competition.getTourId() == null) {
            return new CompetitionScope.Standalone();
        }
        Tour tour = tourRepository.findById(competition.getTourId())
                .orElseThrow(() -> NotFoundException.tour(competition.getTourId()));
        PointTemplate template = null;
        if (tour.getPointTemplateId() != null) {
            template = pointTemplateRepository.findById(tour.getPointTemplateId()).orElse(null);
        }
        return new CompetitionScope.TourLinked(
                tour.getTourId(),
                tour.getName(),
                tour.getScoringMode(),
                template
        );
    }
}
