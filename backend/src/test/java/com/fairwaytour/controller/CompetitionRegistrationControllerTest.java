package com.fairwaytour.controller;

import com.fairwaytour.config.FairwayRuntimeProperties;
import com.fairwaytour.dto.RegistrationResponses;
import com.fairwaytour.model.RegistrationMode;
import com.fairwaytour.model.RegistrationStatus;
import com.fairwaytour.service.RegistrationService;
import com.fairwaytour.web.ConflictException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CompetitionRegistrationController.class)
@Import(FairwayRuntimeProperties.class)
class CompetitionRegistrationControllerTest {

    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000151");
    private static final UUID PLAYER_ID = UUID.fromString("00000000-0000-0000-0000-000000000351");
    private static final UUID TEE_TIME_ID = UUID.fromString("00000000-0000-0000-0000-000000000451");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RegistrationService registrationService;

    @Test
    void registerReturnsCreatedRegistrationForCallingPlayer() throws Exception {
        when(registrationService.register(COMPETITION_ID, PLAYER_ID, RegistrationMode.SOLO))
                .thenReturn(registration(RegistrationStatus.REGISTERED, TEE_TIME_ID));

        mockMvc.perform(post("/api/competitions/{id}/register", COMPETITION_ID)
                        .header("X-Player-Id", PLAYER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "mode": "solo"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.competitionId").value(COMPETITION_ID.toString()))
                .andExpect(jsonPath("$.playerId").value(PLAYER_ID.toString()))
                .andExpect(jsonPath("$.status").value("REGISTERED"))
                .andExpect(jsonPath("$.teeTimeId").value(TEE_TIME_ID.toString()));
    }

    @Test
    void registerWithoutPlayerIdentityIsForbidden() throws Exception {
        mockMvc.perform(post("/api/competitions/{id}/register", COMPETITION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "mode": "LOOKING_FOR_GROUP"
                                }
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("forbidden"));

        verifyNoInteractions(registrationService);
    }

    @Test
    void registerWithMalformedPlayerIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/competitions/{id}/register", COMPETITION_ID)
                        .header("X-Player-Id", "not-a-uuid")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "mode": "SOLO"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"));
    }

    @Test
    void registerWithoutModeFailsValidation() throws Exception {
        mockMvc.perform(post("/api/competitions/{id}/register", COMPETITION_ID)
                        .header("X-Player-Id", PLAYER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.fieldErrors.mode").exists());
    }

    @Test
    void duplicateRegistrationMapsToConflict() throws Exception {
        when(registrationService.register(COMPETITION_ID, PLAYER_ID, RegistrationMode.CREATE_GROUP))
                .thenThrow(ConflictException.alreadyRegistered("already registered"));

        mockMvc.perform(post("/api/competitions/{id}/register", COMPETITION_ID)
                        .header("X-Player-Id", PLAYER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "mode": "CREATE_GROUP"
                                }
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("already_registered"));
    }

    @Test
    void anonymousGroupLookupReturnsEmptyGroup() throws Exception {
        when(registrationService.getGroup(eq(COMPETITION_ID), isNull()))
                .thenReturn(RegistrationResponses.PlayingGroup.empty(COMPETITION_ID, 4));

        mockMvc.perform(get("/api/competitions/{id}/group", COMPETITION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.teeTimeId").doesNotExist())
                .andExpect(jsonPath("$.players.length()").value(0))
                .andExpect(jsonPath("$.maxPlayers").value(4));
    }

    @Test
    void addToGroupRequiresAtLeastOnePlayer() throws Exception {
        mockMvc.perform(post("/api/competitions/{id}/group/add", COMPETITION_ID)
                        .header("X-Player-Id", PLAYER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "playerIds": []
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.playerIds").exists());

        verifyNoInteractions(registrationService);
    }

    @Test
    void addToGroupPassesRequesterAndTargets() throws Exception {
        UUID other = UUID.randomUUID();
        when(registrationService.addToGroup(eq(COMPETITION_ID), eq(PLAYER_ID), any()))
                .thenReturn(new RegistrationResponses.PlayingGroup(
                        TEE_TIME_ID,
                        COMPETITION_ID,
                        1,
                        PLAYER_ID,
                        List.of(),
                        4
                ));

        mockMvc.perform(post("/api/competitions/{id}/group/add", COMPETITION_ID)
                        .header("X-Player-Id", PLAYER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "playerIds": ["%s"]
                                }
                                """.formatted(other)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupCreatedBy").value(PLAYER_ID.toString()));

        verify(registrationService).addToGroup(COMPETITION_ID, PLAYER_ID, List.of(other));
    }

    @Test
    void updateStatusDelegatesToService() throws Exception {
        when(registrationService.updateStatus(COMPETITION_ID, PLAYER_ID, RegistrationStatus.FINISHED))
                .thenReturn(registration(RegistrationStatus.FINISHED, TEE_TIME_ID));

        mockMvc.perform(put("/api/competitions/{id}/status", COMPETITION_ID)
                        .header("X-Player-Id", PLAYER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "status": "FINISHED"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FINISHED"));
    }

    private static RegistrationResponses.Registration registration(RegistrationStatus status, UUID teeTimeId) {
        return new RegistrationResponses.Registration(
                UUID.randomUUID(),
                COMPETITION_ID,
                PLAYER_ID,
                status,
                teeTimeId,
                UUID.randomUUID(),
                PLAYER_ID,
                OffsetDateTime.parse("2026-06-01T08:00:00Z"),
                null,
                null
        );
    }
}
