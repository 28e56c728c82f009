package com.fairwaytour.controller;

import com.fairwaytour.dto.RegistrationRequests;
import com.fairwaytour.dto.RegistrationResponses;
import com.fairwaytour.service.RegistrationService;
import com.fairwaytour.web.CallerContext;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/competitions")
public class CompetitionRegistrationController {

    private final RegistrationService registrationService;

    public CompetitionRegistrationController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @PostMapping("/{competitionId}/register")
    public ResponseEntity<RegistrationResponses.Registration> register(
            @PathVariable UUID competitionId,
            @Valid @RequestBody RegistrationRequests.RegisterRequest request,
            CallerContext caller
    ) {
        RegistrationResponses.Registration registration =
                registrationService.register(competitionId, caller.requirePlayerId(), request.mode());
        return ResponseEntity.status(HttpStatus.CREATED).body(registration);
    }

    @DeleteMapping("/{competitionId}/register")
    public ResponseEntity<RegistrationResponses.Registration> withdraw(
            @PathVariable UUID competitionId,
            CallerContext caller
    ) {
        return ResponseEntity.ok(registrationService.withdraw(competitionId, caller.requirePlayerId()));
    }

    @GetMapping("/{competitionId}/my-registration")
    public ResponseEntity<RegistrationResponses.Registration> getMyRegistration(
            @PathVariable UUID competitionId,
            CallerContext caller
    ) {
        return ResponseEntity.ok(registrationService.getRegistration(competitionId, caller.requirePlayerId()));
    }

    @GetMapping("/{competitionId}/available-players")
    public ResponseEntity<List<RegistrationResponses.AvailablePlayer>> listAvailablePlayers(
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.ok(registrationService.listAvailablePlayers(competitionId));
    }

    @GetMapping("/{competitionId}/group")
    public ResponseEntity<RegistrationResponses.PlayingGroup> getMyGroup(
            @PathVariable UUID competitionId,
            CallerContext caller
    ) {
        return ResponseEntity.ok(registrationService.getGroup(competitionId, caller.playerId()));
    }

    @GetMapping("/{competitionId}/groups")
    public ResponseEntity<List<RegistrationResponses.PlayingGroup>> listGroups(
            @PathVariable UUID competitionId,
            CallerContext caller
    ) {
        return ResponseEntity.ok(registrationService.listGroups(competitionId, caller.playerId()));
    }

    @PostMapping("/{competitionId}/group/add")
    public ResponseEntity<RegistrationResponses.PlayingGroup> addToGroup(
            @PathVariable UUID competitionId,
            @Valid @RequestBody RegistrationRequests.AddToGroupRequest request,
            CallerContext caller
    ) {
        return ResponseEntity.ok(
                registrationService.addToGroup(competitionId, caller.requirePlayerId(), request.playerIds())
        );
    }

    @PostMapping("/{competitionId}/group/remove")
    public ResponseEntity<RegistrationResponses.PlayingGroup> removeFromGroup(
            @PathVariable UUID competitionId,
            @Valid @RequestBody RegistrationRequests.RemoveFromGroupRequest request,
            CallerContext caller
    ) {
        return ResponseEntity.ok(
                registrationService.removeFromGroup(competitionId, caller.requirePlayerId(), request.playerId())
        );
    }

    @PostMapping("/{competitionId}/group/leave")
    public ResponseEntity<RegistrationResponses.Registration> leaveGroup(
            @PathVariable UUID competitionId,
            CallerContext caller
    ) {
        return ResponseEntity.ok(registrationService.leaveGroup(competitionId, caller.requirePlayerId()));
    }

    @PostMapping("/{competitionId}/start-playing")
    public ResponseEntity<RegistrationResponses.StartPlaying> startPlaying(
            @PathVariable UUID competitionId,
            CallerContext caller
    ) {
        return ResponseEntity.ok(registrationService.startPlaying(competitionId, caller.requirePlayerId()));
    }

    @PostMapping("/{competitionId}/finish-playing")
    public ResponseEntity<RegistrationResponses.Registration> finishPlaying(
            @PathVariable UUID competitionId,
            CallerContext caller
    ) {
        return ResponseEntity.ok(registrationService.finishPlaying(competitionId, caller.requirePlayerId()));
    }

    @PutMapping("/{competitionId}/status")
    public ResponseEntity<RegistrationResponses.Registration> updateStatus(
            @PathVariable UUID competitionId,
            @Valid @RequestBody RegistrationRequests.UpdateStatusRequest request,
            CallerContext caller
    ) {
        return ResponseEntity.ok(
                registrationService.updateStatus(competitionId, caller.requirePlayerId(), request.status())
        );
    }
}
