package com.fairwaytour.controller;

import com.fairwaytour.dto.ScorecardRequests;
import com.fairwaytour.dto.ScorecardResponses;
import com.fairwaytour.service.ScorecardLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api")
public class ScorecardController {

    private final ScorecardLedgerService scorecardLedgerService;

    public ScorecardController(ScorecardLedgerService scorecardLedgerService) {
        this.scorecardLedgerService = scorecardLedgerService;
    }

    @PutMapping("/game-scores/{participantId}/hole/{hole}")
    public ResponseEntity<ScorecardResponses.Scorecard> updateScore(
            @PathVariable UUID participantId,
            @PathVariable int hole,
            @Valid @RequestBody ScorecardRequests.UpdateScoreRequest request
    ) {
        return ResponseEntity.ok(scorecardLedgerService.updateScore(participantId, hole, request.shots()));
    }

    @GetMapping("/participants/{participantId}")
    public ResponseEntity<ScorecardResponses.Scorecard> getScorecard(@PathVariable UUID participantId) {
        return ResponseEntity.ok(scorecardLedgerService.getScorecard(participantId));
    }

    @PostMapping("/participants/{participantId}/lock")
    public ResponseEntity<ScorecardResponses.Scorecard> lock(@PathVariable UUID participantId) {
        return ResponseEntity.ok(scorecardLedgerService.lock(participantId));
    }

    @PostMapping("/participants/{participantId}/unlock")
    public ResponseEntity<ScorecardResponses.Scorecard> unlock(@PathVariable UUID participantId) {
        return ResponseEntity.ok(scorecardLedgerService.unlock(participantId));
    }

    @PutMapping("/participants/{participantId}/manual-score")
    public ResponseEntity<ScorecardResponses.Scorecard> setManualScore(
            @PathVariable UUID participantId,
            @Valid @RequestBody ScorecardRequests.ManualScoreRequest request
    ) {
        return ResponseEntity.ok(scorecardLedgerService.setManualScore(participantId, request.total()));
    }

    @PostMapping("/participants/{participantId}/dq")
    public ResponseEntity<ScorecardResponses.Scorecard> setDisqualified(
            @PathVariable UUID participantId,
            @Valid @RequestBody ScorecardRequests.DisqualifyRequest request
    ) {
        return ResponseEntity.ok(
                scorecardLedgerService.setDisqualified(participantId, request.disqualified(), request.reason())
        );
    }
}
