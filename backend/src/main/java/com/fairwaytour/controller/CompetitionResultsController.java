package com.fairwaytour.controller;

import com.fairwaytour.dto.FinalizationResponses;
import com.fairwaytour.dto.StandingsResponses;
import com.fairwaytour.model.ScoringType;
import com.fairwaytour.service.CompetitionStandingsService;
import com.fairwaytour.service.FinalizationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/competitions")
public class CompetitionResultsController {

    private final CompetitionStandingsService competitionStandingsService;
    private final FinalizationService finalizationService;

    public CompetitionResultsController(
            CompetitionStandingsService competitionStandingsService,
            FinalizationService finalizationService
    ) {
        this.competitionStandingsService = competitionStandingsService;
        this.finalizationService = finalizationService;
    }

    @GetMapping("/{competitionId}/leaderboard")
    public ResponseEntity<StandingsResponses.Leaderboard> getLeaderboard(
            @PathVariable UUID competitionId,
            @RequestParam(name = "scoring_type", required = false) ScoringType scoringType,
            @RequestParam(name = "category", required = false) UUID categoryId
    ) {
        return ResponseEntity.ok(competitionStandingsService.getLeaderboard(competitionId, scoringType, categoryId));
    }

    @PostMapping("/{competitionId}/finalize")
    public ResponseEntity<FinalizationResponses.Finalization> finalizeCompetition(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(finalizationService.finalizeCompetition(competitionId));
    }

    @PostMapping("/{competitionId}/reopen")
    public ResponseEntity<FinalizationResponses.Finalization> reopen(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(finalizationService.reopen(competitionId));
    }

    @GetMapping("/{competitionId}/results")
    public ResponseEntity<FinalizationResponses.FinalResults> getFinalResults(
            @PathVariable UUID competitionId,
            @RequestParam(name = "scoring_type", required = false) ScoringType scoringType
    ) {
        return ResponseEntity.ok(finalizationService.getFinalResults(competitionId, scoringType));
    }
}
