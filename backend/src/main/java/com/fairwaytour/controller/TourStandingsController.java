package com.fairwaytour.controller;

import com.fairwaytour.dto.StandingsResponses;
import com.fairwaytour.model.ScoringType;
import com.fairwaytour.service.TourStandingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/tours")
public class TourStandingsController {

    private final TourStandingsService tourStandingsService;

    public TourStandingsController(TourStandingsService tourStandingsService) {
        this.tourStandingsService = tourStandingsService;
    }

    @GetMapping("/{tourId}/standings")
    public ResponseEntity<StandingsResponses.TourStandings> getStandings(
            @PathVariable UUID tourId,
            @RequestParam(name = "category", required = false) UUID categoryId,
            @RequestParam(name = "scoring_type", required = false) ScoringType scoringType
    ) {
        return ResponseEntity.ok(tourStandingsService.getStandings(tourId, categoryId, scoringType));
    }
}
