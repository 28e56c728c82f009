package com.fairwaytour.service;

import com.fairwaytour.config.FairwayRuntimeProperties;
import com.fairwaytour.dto.RegistrationResponses;
import com.fairwaytour.event.RegistrationChangedEvent;
import com.fairwaytour.mapper.FairwayResponseMapper;
import com.fairwaytour.model.AvailabilityStatus;
import com.fairwaytour.model.Competition;
import com.fairwaytour.model.CompetitionStartMode;
import com.fairwaytour.model.Participant;
import com.fairwaytour.model.Player;
import com.fairwaytour.model.Registration;
import com.fairwaytour.model.RegistrationMode;
import com.fairwaytour.model.RegistrationStatus;
import com.fairwaytour.model.ScoringMode;
import com.fairwaytour.model.TeeTime;
import com.fairwaytour.model.TourEnrollment;
import com.fairwaytour.model.TourEnrollmentStatus;
import com.fairwaytour.repository.CompetitionRepository;
import com.fairwaytour.repository.ParticipantRepository;
import com.fairwaytour.repository.PlayerRepository;
import com.fairwaytour.repository.RegistrationRepository;
import com.fairwaytour.repository.TeeTimeRepository;
import com.fairwaytour.repository.TourEnrollmentRepository;
import com.fairwaytour.web.AlreadyFinalizedException;
import com.fairwaytour.web.AuthorizationException;
import com.fairwaytour.web.ConflictException;
import com.fairwaytour.web.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistrationServiceTest {

    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final UUID TOUR_ID = UUID.fromString("00000000-0000-0000-0000-000000000201");
    private static final UUID PLAYER_P = UUID.fromString("00000000-0000-0000-0000-000000000301");
    private static final UUID PLAYER_Q = UUID.fromString("00000000-0000-0000-0000-000000000302");
    private static final UUID PLAYER_R = UUID.fromString("00000000-0000-0000-0000-000000000303");
    private static final UUID TEE_TIME_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");

    @Mock
    private CompetitionRepository competitionRepository;

    @Mock
    private PlayerRepository playerRepository;

    @Mock
    private TourEnrollmentRepository tourEnrollmentRepository;

    @Mock
    private RegistrationRepository registrationRepository;

    @Mock
    private TeeTimeRepository teeTimeRepository;

    @Mock
    private ParticipantRepository participantRepository;

    @Mock
    private CompetitionScopeResolver competitionScopeResolver;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private FairwayRuntimeProperties fairwayRuntimeProperties;
    private RegistrationService registrationService;

    @BeforeEach
    void setUp() {
        fairwayRuntimeProperties = new FairwayRuntimeProperties();
        registrationService = new RegistrationService(
                competitionRepository,
                playerRepository,
                tourEnrollmentRepository,
                registrationRepository,
                teeTimeRepository,
                participantRepository,
                competitionScopeResolver,
                new FairwayResponseMapper(),
                fairwayRuntimeProperties,
                applicationEventPublisher
        );
    }

    @Test
    void registerSoloAllocatesTeeTimeAndParticipantWithEnrollmentHandicap() {
        Competition competition = openCompetition(TOUR_ID);
        TourEnrollment enrollment = enrollment(PLAYER_P, new BigDecimal("12.3"));
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(playerRepository.findById(PLAYER_P)).thenReturn(Optional.of(player(PLAYER_P, "Pat", "14.0")));
        when(registrationRepository.existsByCompetitionIdAndPlayerId(COMPETITION_ID, PLAYER_P)).thenReturn(false);
        when(competitionScopeResolver.resolve(competition)).thenReturn(tourScope());
        when(tourEnrollmentRepository.findByTourIdAndPlayerIdAndStatus(TOUR_ID, PLAYER_P, TourEnrollmentStatus.ACTIVE))
                .thenReturn(Optional.of(enrollment));
        when(teeTimeRepository.save(any(TeeTime.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(participantRepository.save(any(Participant.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(registrationRepository.save(any(Registration.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RegistrationResponses.Registration registration =
                registrationService.register(COMPETITION_ID, PLAYER_P, RegistrationMode.SOLO);

        assertEquals(RegistrationStatus.REGISTERED, registration.status());
        assertNotNull(registration.teeTimeId());
        assertNotNull(registration.participantId());
        assertEquals(PLAYER_P, registration.groupCreatedBy());

        ArgumentCaptor<Participant> participantCaptor = ArgumentCaptor.forClass(Participant.class);
        verify(participantRepository).save(participantCaptor.capture());
        Participant participant = participantCaptor.getValue();
        assertEquals(new BigDecimal("12.3"), participant.getHandicapIndex());
        assertEquals(registration.teeTimeId(), participant.getTeeTimeId());
        assertEquals(1, participant.getTeeOrder());

        ArgumentCaptor<RegistrationChangedEvent> eventCaptor = ArgumentCaptor.forClass(RegistrationChangedEvent.class);
        verify(applicationEventPublisher).publishEvent(eventCaptor.capture());
        assertNull(eventCaptor.getValue().previousStatus());
        assertEquals(RegistrationStatus.REGISTERED, eventCaptor.getValue().newStatus());
    }

    @Test
    void registerLookingForGroupCreatesRowWithoutTeeTimeOrParticipant() {
        Competition competition = openCompetition(null);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(playerRepository.findById(PLAYER_Q)).thenReturn(Optional.of(player(PLAYER_Q, "Quinn", "8.0")));
        when(registrationRepository.existsByCompetitionIdAndPlayerId(COMPETITION_ID, PLAYER_Q)).thenReturn(false);
        when(competitionScopeResolver.resolve(competition)).thenReturn(new CompetitionScope.Standalone());
        when(registrationRepository.save(any(Registration.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RegistrationResponses.Registration registration =
                registrationService.register(COMPETITION_ID, PLAYER_Q, RegistrationMode.LOOKING_FOR_GROUP);

        assertEquals(RegistrationStatus.LOOKING_FOR_GROUP, registration.status());
        assertNull(registration.teeTimeId());
        assertNull(registration.participantId());
        verifyNoInteractions(teeTimeRepository, participantRepository);
    }

    @Test
    void registerTwiceIsRejectedAsAlreadyRegistered() {
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(playerRepository.findById(PLAYER_P)).thenReturn(Optional.of(player(PLAYER_P, "Pat", "14.0")));
        when(registrationRepository.existsByCompetitionIdAndPlayerId(COMPETITION_ID, PLAYER_P)).thenReturn(true);

        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> registrationService.register(COMPETITION_ID, PLAYER_P, RegistrationMode.SOLO)
        );

        assertEquals("already_registered", ex.getCode());
        verify(registrationRepository, never()).save(any());
    }

    @Test
    void registerRequiresOpenStartMode() {
        Competition competition = openCompetition(null);
        competition.setStartMode(CompetitionStartMode.SCHEDULED);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));

        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> registrationService.register(COMPETITION_ID, PLAYER_P, RegistrationMode.SOLO)
        );

        assertEquals("not_open_start", ex.getCode());
    }

    @Test
    void registerOutsideOpenWindowIsRejected() {
        Competition competition = openCompetition(null);
        competition.setOpenEnd(OffsetDateTime.now().minusHours(1));
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));

        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> registrationService.register(COMPETITION_ID, PLAYER_P, RegistrationMode.SOLO)
        );

        assertEquals("registration_window_closed", ex.getCode());
    }

    @Test
    void registerForTourCompetitionRequiresActiveEnrollment() {
        Competition competition = openCompetition(TOUR_ID);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(playerRepository.findById(PLAYER_P)).thenReturn(Optional.of(player(PLAYER_P, "Pat", "14.0")));
        when(registrationRepository.existsByCompetitionIdAndPlayerId(COMPETITION_ID, PLAYER_P)).thenReturn(false);
        when(competitionScopeResolver.resolve(competition)).thenReturn(tourScope());
        when(tourEnrollmentRepository.findByTourIdAndPlayerIdAndStatus(TOUR_ID, PLAYER_P, TourEnrollmentStatus.ACTIVE))
                .thenReturn(Optional.empty());

        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> registrationService.register(COMPETITION_ID, PLAYER_P, RegistrationMode.CREATE_GROUP)
        );

        assertEquals("not_enrolled", ex.getCode());
    }

    @Test
    void registerOnFinalizedCompetitionIsRejected() {
        Competition competition = openCompetition(null);
        competition.setResultsFinal(true);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));

        assertThrows(
                AlreadyFinalizedException.class,
                () -> registrationService.register(COMPETITION_ID, PLAYER_P, RegistrationMode.SOLO)
        );
    }

    @Test
    void creatorAddsLookingForGroupPlayerToTeeTime() {
        Competition competition = openCompetition(null);
        Registration creator = registration(PLAYER_P, RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P);
        Registration looking = registration(PLAYER_Q, RegistrationStatus.LOOKING_FOR_GROUP, null, null);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_P))
                .thenReturn(Optional.of(creator));
        when(registrationRepository.findByTeeTimeIdForUpdate(TEE_TIME_ID)).thenReturn(List.of(creator));
        when(playerRepository.findAllById(any()))
                .thenReturn(List.of(player(PLAYER_P, "Pat", "14.0"), player(PLAYER_Q, "Quinn", "8.0")));
        when(registrationRepository.findByCompetitionIdAndPlayerIdInForUpdate(eq(COMPETITION_ID), anyCollection()))
                .thenReturn(List.of(looking));
        when(competitionScopeResolver.resolve(competition)).thenReturn(new CompetitionScope.Standalone());
        when(participantRepository.findMaxTeeOrder(TEE_TIME_ID)).thenReturn(1);
        when(participantRepository.save(any(Participant.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(registrationRepository.save(any(Registration.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(teeTimeRepository.findById(TEE_TIME_ID)).thenReturn(Optional.of(teeTime()));
        when(registrationRepository.findByTeeTimeIdOrderByRegisteredAtAsc(TEE_TIME_ID))
                .thenReturn(List.of(creator, looking));
        when(participantRepository.findByTeeTimeIdOrderByTeeOrderAsc(TEE_TIME_ID)).thenReturn(List.of());

        RegistrationResponses.PlayingGroup group =
                registrationService.addToGroup(COMPETITION_ID, PLAYER_P, List.of(PLAYER_Q));

        assertEquals(RegistrationStatus.REGISTERED, looking.getStatus());
        assertEquals(TEE_TIME_ID, looking.getTeeTimeId());
        assertEquals(PLAYER_P, looking.getGroupCreatedBy());
        assertNotNull(looking.getParticipantId());

        ArgumentCaptor<Participant> participantCaptor = ArgumentCaptor.forClass(Participant.class);
        verify(participantRepository).save(participantCaptor.capture());
        assertEquals(2, participantCaptor.getValue().getTeeOrder());
        assertEquals(new BigDecimal("8.0"), participantCaptor.getValue().getHandicapIndex());

        assertEquals(TEE_TIME_ID, group.teeTimeId());
        assertEquals(PLAYER_P, group.groupCreatedBy());
        assertEquals(2, group.players().size());
        assertEquals(4, group.maxPlayers());
        assertTrue(group.players().stream().anyMatch(member -> member.playerId().equals(PLAYER_P) && member.isYou()));

        when(registrationRepository.findByCompetitionIdOrderByRegisteredAtAsc(COMPETITION_ID))
                .thenReturn(List.of(creator, looking));
        List<RegistrationResponses.AvailablePlayer> available = registrationService.listAvailablePlayers(COMPETITION_ID);

        RegistrationResponses.AvailablePlayer added = available.stream()
                .filter(player -> player.playerId().equals(PLAYER_Q))
                .findFirst()
                .orElseThrow();
        assertEquals(AvailabilityStatus.IN_GROUP, added.status());
        assertEquals(TEE_TIME_ID, added.teeTimeId());
        assertFalse(available.stream().anyMatch(player -> player.status() == AvailabilityStatus.LOOKING_FOR_GROUP));
    }

    @Test
    void addToGroupByNonCreatorIsForbidden() {
        Registration member = registration(PLAYER_Q, RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_Q))
                .thenReturn(Optional.of(member));

        assertThrows(
                AuthorizationException.class,
                () -> registrationService.addToGroup(COMPETITION_ID, PLAYER_Q, List.of(PLAYER_R))
        );
        verify(registrationRepository, never()).save(any());
    }

    @Test
    void addToGroupRejectsPlayerAlreadyInAnotherGroup() {
        Competition competition = openCompetition(null);
        Registration creator = registration(PLAYER_P, RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P);
        Registration grouped = registration(PLAYER_R, RegistrationStatus.REGISTERED, UUID.randomUUID(), PLAYER_R);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_P))
                .thenReturn(Optional.of(creator));
        when(registrationRepository.findByTeeTimeIdForUpdate(TEE_TIME_ID)).thenReturn(List.of(creator));
        when(playerRepository.findAllById(any())).thenReturn(List.of(player(PLAYER_R, "Reese", "20.1")));
        when(registrationRepository.findByCompetitionIdAndPlayerIdInForUpdate(eq(COMPETITION_ID), anyCollection()))
                .thenReturn(List.of(grouped));
        when(competitionScopeResolver.resolve(competition)).thenReturn(new CompetitionScope.Standalone());
        when(participantRepository.findMaxTeeOrder(TEE_TIME_ID)).thenReturn(1);

        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> registrationService.addToGroup(COMPETITION_ID, PLAYER_P, List.of(PLAYER_R))
        );

        assertEquals("already_grouped", ex.getCode());
        verify(registrationRepository, never()).save(any());
    }

    @Test
    void addToGroupBeyondCapacityIsRejected() {
        Registration creator = registration(PLAYER_P, RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P);
        List<Registration> fullGroup = List.of(
                creator,
                registration(UUID.randomUUID(), RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P),
                registration(UUID.randomUUID(), RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P),
                registration(UUID.randomUUID(), RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P)
        );
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_P))
                .thenReturn(Optional.of(creator));
        when(registrationRepository.findByTeeTimeIdForUpdate(TEE_TIME_ID)).thenReturn(fullGroup);

        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> registrationService.addToGroup(COMPETITION_ID, PLAYER_P, List.of(PLAYER_Q))
        );

        assertEquals("group_full", ex.getCode());
    }

    @Test
    void addToGroupRejectsDuplicatePlayerIds() {
        assertThrows(
                ValidationException.class,
                () -> registrationService.addToGroup(COMPETITION_ID, PLAYER_P, List.of(PLAYER_Q, PLAYER_Q))
        );
        verifyNoInteractions(competitionRepository, registrationRepository);
    }

    @Test
    void removingYourselfIsAValidationError() {
        assertThrows(
                ValidationException.class,
                () -> registrationService.removeFromGroup(COMPETITION_ID, PLAYER_P, PLAYER_P)
        );
    }

    @Test
    void startPlayingFromLookingForGroupAllocatesSoloTeeTime() {
        Registration looking = registration(PLAYER_Q, RegistrationStatus.LOOKING_FOR_GROUP, null, null);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_Q))
                .thenReturn(Optional.of(looking));
        when(playerRepository.findById(PLAYER_Q)).thenReturn(Optional.of(player(PLAYER_Q, "Quinn", "8.0")));
        when(teeTimeRepository.save(any(TeeTime.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(participantRepository.save(any(Participant.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(registrationRepository.save(any(Registration.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RegistrationResponses.StartPlaying result = registrationService.startPlaying(COMPETITION_ID, PLAYER_Q);

        assertEquals(RegistrationStatus.PLAYING, result.status());
        assertNotNull(result.teeTimeId());
        assertNotNull(result.participantId());
        assertEquals(PLAYER_Q, looking.getGroupCreatedBy());
        assertNotNull(looking.getStartedAt());
    }

    @Test
    void startPlayingIsIdempotentWhenAlreadyPlaying() {
        Registration playing = registration(PLAYER_P, RegistrationStatus.PLAYING, TEE_TIME_ID, PLAYER_P);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_P))
                .thenReturn(Optional.of(playing));

        RegistrationResponses.StartPlaying result = registrationService.startPlaying(COMPETITION_ID, PLAYER_P);

        assertEquals(TEE_TIME_ID, result.teeTimeId());
        assertEquals(RegistrationStatus.PLAYING, result.status());
        verify(registrationRepository, never()).save(any());
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    void startPlayingAfterFinishingIsIllegal() {
        Registration finished = registration(PLAYER_P, RegistrationStatus.FINISHED, TEE_TIME_ID, PLAYER_P);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_P))
                .thenReturn(Optional.of(finished));

        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> registrationService.startPlaying(COMPETITION_ID, PLAYER_P)
        );

        assertEquals("illegal_transition", ex.getCode());
    }

    @Test
    void updateStatusToRegisteredIsNotADirectTransition() {
        Registration looking = registration(PLAYER_Q, RegistrationStatus.LOOKING_FOR_GROUP, null, null);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_Q))
                .thenReturn(Optional.of(looking));

        ConflictException ex = assertThrows(
                ConflictException.class,
                () -> registrationService.updateStatus(COMPETITION_ID, PLAYER_Q, RegistrationStatus.REGISTERED)
        );

        assertEquals("illegal_transition", ex.getCode());
    }

    @Test
    void withdrawingCreatorDeletesRowAndHandsGroupToNextMember() {
        UUID participantId = UUID.randomUUID();
        Registration creator = registration(PLAYER_P, RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P);
        creator.setParticipantId(participantId);
        Registration other = registration(PLAYER_R, RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_P))
                .thenReturn(Optional.of(creator));
        when(registrationRepository.findByTeeTimeIdForUpdate(TEE_TIME_ID)).thenReturn(List.of(other));

        RegistrationResponses.Registration withdrawn = registrationService.withdraw(COMPETITION_ID, PLAYER_P);

        assertEquals(RegistrationStatus.WITHDRAWN, withdrawn.status());
        verify(registrationRepository).delete(creator);
        verify(participantRepository).deleteById(participantId);
        verify(teeTimeRepository, never()).deleteById(any());
        assertEquals(PLAYER_R, other.getGroupCreatedBy());
    }

    @Test
    void lastMemberLeavingReleasesTeeTimeAndDetachesParticipant() {
        UUID participantId = UUID.randomUUID();
        Participant participant = new Participant();
        participant.setParticipantId(participantId);
        participant.setCompetitionId(COMPETITION_ID);
        participant.setPlayerId(PLAYER_P);
        participant.setTeeTimeId(TEE_TIME_ID);
        Registration creator = registration(PLAYER_P, RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_P);
        creator.setParticipantId(participantId);
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(COMPETITION_ID, PLAYER_P))
                .thenReturn(Optional.of(creator));
        when(participantRepository.findById(participantId)).thenReturn(Optional.of(participant));
        when(registrationRepository.save(any(Registration.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(registrationRepository.findByTeeTimeIdForUpdate(TEE_TIME_ID)).thenReturn(List.of());

        RegistrationResponses.Registration left = registrationService.leaveGroup(COMPETITION_ID, PLAYER_P);

        assertEquals(RegistrationStatus.LOOKING_FOR_GROUP, left.status());
        assertNull(left.teeTimeId());
        assertEquals(participantId, left.participantId());
        assertNull(participant.getTeeTimeId());
        verify(teeTimeRepository).deleteById(TEE_TIME_ID);
    }

    @Test
    void groupLookupWithoutRegistrationReturnsEmptyGroup() {
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(openCompetition(null)));
        when(registrationRepository.findByCompetitionIdAndPlayerId(COMPETITION_ID, PLAYER_P)).thenReturn(Optional.empty());

        RegistrationResponses.PlayingGroup group = registrationService.getGroup(COMPETITION_ID, PLAYER_P);

        assertNull(group.teeTimeId());
        assertTrue(group.players().isEmpty());
        assertEquals(4, group.maxPlayers());
    }

    @Test
    void activeRoundsForAnonymousCallerIsEmpty() {
        assertTrue(registrationService.getActiveRounds(null).isEmpty());
        verifyNoInteractions(registrationRepository);
    }

    @Test
    void availablePlayersListLookingForGroupFirstThenByName() {
        Competition competition = openCompetition(TOUR_ID);
        UUID playerS = UUID.randomUUID();
        when(competitionRepository.findById(COMPETITION_ID)).thenReturn(Optional.of(competition));
        when(registrationRepository.findByCompetitionIdOrderByRegisteredAtAsc(COMPETITION_ID)).thenReturn(List.of(
                registration(PLAYER_Q, RegistrationStatus.LOOKING_FOR_GROUP, null, null),
                registration(PLAYER_R, RegistrationStatus.REGISTERED, TEE_TIME_ID, PLAYER_R)
        ));
        when(competitionScopeResolver.resolve(competition)).thenReturn(tourScope());
        when(tourEnrollmentRepository.findByTourIdAndStatus(TOUR_ID, TourEnrollmentStatus.ACTIVE)).thenReturn(List.of(
                enrollment(PLAYER_P, null),
                enrollment(PLAYER_Q, new BigDecimal("9.9")),
                enrollment(PLAYER_R, null),
                enrollment(playerS, null)
        ));
        when(playerRepository.findAllById(any())).thenReturn(List.of(
                player(PLAYER_P, "Avery", "3.0"),
                player(PLAYER_Q, "Zed", "8.0"),
                player(PLAYER_R, "Blake", "11.0"),
                player(playerS, "Casey", "15.0")
        ));

        List<RegistrationResponses.AvailablePlayer> available = registrationService.listAvailablePlayers(COMPETITION_ID);

        assertEquals(4, available.size());
        assertEquals("Zed", available.get(0).name());
        assertEquals(AvailabilityStatus.LOOKING_FOR_GROUP, available.get(0).status());
        assertEquals(new BigDecimal("9.9"), available.get(0).handicap());
        assertEquals("Avery", available.get(1).name());
        assertEquals(AvailabilityStatus.AVAILABLE, available.get(1).status());
        assertEquals("Blake", available.get(2).name());
        assertEquals(AvailabilityStatus.IN_GROUP, available.get(2).status());
        assertEquals(TEE_TIME_ID, available.get(2).teeTimeId());
        assertEquals("Casey", available.get(3).name());
        assertFalse(available.stream().anyMatch(player -> player.status() == AvailabilityStatus.PLAYING));
    }

    private static Competition openCompetition(UUID tourId) {
        Competition competition = new Competition();
        competition.setCompetitionId(COMPETITION_ID);
        competition.setTourId(tourId);
        competition.setName("Spring Medal");
        competition.setScoringMode(ScoringMode.GROSS);
        competition.setStartMode(CompetitionStartMode.OPEN);
        return competition;
    }

    private static CompetitionScope.TourLinked tourScope() {
        return new CompetitionScope.TourLinked(TOUR_ID, "Summer Tour", ScoringMode.GROSS, null);
    }

    private static Player player(UUID playerId, String name, String handicapIndex) {
        Player player = new Player();
        player.setPlayerId(playerId);
        player.setName(name);
        player.setHandicapIndex(new BigDecimal(handicapIndex));
        return player;
    }

    private static TourEnrollment enrollment(UUID playerId, BigDecimal playingHandicap) {
        TourEnrollment enrollment = new TourEnrollment();
        enrollment.setEnrollmentId(UUID.randomUUID());
        enrollment.setTourId(TOUR_ID);
        enrollment.setPlayerId(playerId);
        enrollment.setPlayingHandicap(playingHandicap);
        enrollment.setStatus(TourEnrollmentStatus.ACTIVE);
        return enrollment;
    }

    private static Registration registration(
            UUID playerId,
            RegistrationStatus status,
            UUID teeTimeId,
            UUID groupCreatedBy
    ) {
        Registration registration = new Registration();
        registration.setRegistrationId(UUID.randomUUID());
        registration.setCompetitionId(COMPETITION_ID);
        registration.setPlayerId(playerId);
        registration.setStatus(status);
        registration.setTeeTimeId(teeTimeId);
        registration.setGroupCreatedBy(groupCreatedBy);
        return registration;
    }

    private static TeeTime teeTime() {
        TeeTime teeTime = new TeeTime();
        teeTime.setTeeTimeId(TEE_TIME_ID);
        teeTime.setCompetitionId(COMPETITION_ID);
        teeTime.setStartHole(1);
        return teeTime;
    }
}
