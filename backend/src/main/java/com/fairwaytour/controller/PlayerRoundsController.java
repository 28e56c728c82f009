package com.fairwaytour.controller;

import com.fairwaytour.dto.RegistrationResponses;
import com.fairwaytour.service.RegistrationService;
import com.fairwaytour.web.CallerContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/players")
public class PlayerRoundsController {

    private final RegistrationService registrationService;

    public PlayerRoundsController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    /**
     * Empty list for anonymous callers instead of an error.
     */
    @GetMapping("/me/active-rounds")
    public ResponseEntity<List<RegistrationResponses.ActiveRound>> getActiveRounds(CallerContext caller) {
        return ResponseEntity.ok(registrationService.getActiveRounds(caller.playerId()));
    }
}
