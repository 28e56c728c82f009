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
import com.fairwaytour.web.NotFoundException;
import com.fairwaytour.web.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registration and group formation for competitions.
 *
 * Every mutating operation re-reads the registrations it touches with a pessimistic write lock,
 * checks the transition against {@link RegistrationTransitions} and writes in the same transaction.
 */
@Service
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private static final List<RegistrationStatus> ACTIVE_ROUND_STATUSES =
            List.of(RegistrationStatus.REGISTERED, RegistrationStatus.PLAYING);

    private final CompetitionRepository competitionRepository;
    private final PlayerRepository playerRepository;
    private final TourEnrollmentRepository tourEnrollmentRepository;
    private final RegistrationRepository registrationRepository;
    private final TeeTimeRepository teeTimeRepository;
    private final ParticipantRepository participantRepository;
    private final CompetitionScopeResolver competitionScopeResolver;
    private final FairwayResponseMapper fairwayResponseMapper;
    private final FairwayRuntimeProperties fairwayRuntimeProperties;
    private final ApplicationEventPublisher applicationEventPublisher;

    public RegistrationService(
            CompetitionRepository competitionRepository,
            PlayerRepository playerRepository,
            TourEnrollmentRepository tourEnrollmentRepository,
            RegistrationRepository registrationRepository,
            TeeTimeRepository teeTimeRepository,
            ParticipantRepository participantRepository,
            CompetitionScopeResolver competitionScopeResolver,
            FairwayResponseMapper fairwayResponseMapper,
            FairwayRuntimeProperties fairwayRuntimeProperties,
            ApplicationEventPublisher applicationEventPublisher
    ) {
        this.competitionRepository = competitionRepository;
        this.playerRepository = playerRepository;
        this.tourEnrollmentRepository = tourEnrollmentRepository;
        this.registrationRepository = registrationRepository;
        this.teeTimeRepository = teeTimeRepository;
        this.participantRepository = participantRepository;
        this.competitionScopeResolver = competitionScopeResolver;
        this.fairwayResponseMapper = fairwayResponseMapper;
        this.fairwayRuntimeProperties = fairwayRuntimeProperties;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Transactional
    public RegistrationResponses.Registration register(UUID competitionId, UUID playerId, RegistrationMode mode) {
        OffsetDateTime now = OffsetDateTime.now();
        Competition competition = requireCompetition(competitionId);
        requireNotFinal(competition);
        requireSelfRegistrationOpen(competition, now);
        Player player = playerRepository.findById(playerId)
                .orElseThrow(() -> NotFoundException.player(playerId));

        if (registrationRepository.existsByCompetitionIdAndPlayerId(competitionId, playerId)) {
            throw ConflictException.alreadyRegistered(
                    "Player " + playerId + " is already registered for competition " + competitionId
            );
        }
        TourEnrollment enrollment = requireEnrollment(competitionScopeResolver.resolve(competition), playerId);

        RegistrationStatus target = mode == RegistrationMode.LOOKING_FOR_GROUP
                ? RegistrationStatus.LOOKING_FOR_GROUP
                : RegistrationStatus.REGISTERED;
        RegistrationTransitions.require(null, target);

        Registration registration = newRegistration(competitionId, playerId, enrollment, now);
        registration.setStatus(target);
        if (target == RegistrationStatus.REGISTERED) {
            TeeTime teeTime = allocateTeeTime(competitionId, now);
            Participant participant = createParticipant(competitionId, teeTime.getTeeTimeId(), player, enrollment, 1, now);
            registration.setTeeTimeId(teeTime.getTeeTimeId());
            registration.setParticipantId(participant.getParticipantId());
            registration.setGroupCreatedBy(playerId);
        }
        Registration saved = registrationRepository.save(registration);
        publishChange(saved, null, now);

        log.info(
                "Registered player: competitionId={}, playerId={}, mode={}, teeTimeId={}",
                competitionId,
                playerId,
                mode,
                saved.getTeeTimeId()
        );
        return fairwayResponseMapper.toRegistrationResponse(saved);
    }

    @Transactional
    public RegistrationResponses.Registration withdraw(UUID competitionId, UUID playerId) {
        OffsetDateTime now = OffsetDateTime.now();
        Competition competition = requireCompetition(competitionId);
        requireNotFinal(competition);
        Registration registration = requireRegistrationForUpdate(competitionId, playerId);
        RegistrationStatus previous = registration.getStatus();
        RegistrationTransitions.require(previous, RegistrationStatus.WITHDRAWN);

        RegistrationResponses.Registration snapshot =
                fairwayResponseMapper.toRegistrationResponse(registration, RegistrationStatus.WITHDRAWN);
        UUID teeTimeId = registration.getTeeTimeId();
        UUID participantId = registration.getParticipantId();

        registrationRepository.delete(registration);
        if (participantId != null) {
            participantRepository.deleteById(participantId);
        }
        if (teeTimeId != null) {
            releaseSlot(teeTimeId, playerId, now);
        }
        applicationEventPublisher.publishEvent(new RegistrationChangedEvent(
                competitionId,
                playerId,
                previous,
                RegistrationStatus.WITHDRAWN,
                null,
                now
        ));

        log.info(
                "Withdrew player: competitionId={}, playerId={}, previousStatus={}",
                competitionId,
                playerId,
                previous
        );
        return snapshot;
    }

    @Transactional
    public RegistrationResponses.PlayingGroup addToGroup(UUID competitionId, UUID requesterId, List<UUID> playerIds) {
        OffsetDateTime now = OffsetDateTime.now();
        Set<UUID> targetIds = new LinkedHashSet<>(playerIds);
        if (targetIds.size() != playerIds.size()) {
            throw new ValidationException("playerIds must not contain duplicates");
        }
        if (targetIds.contains(requesterId)) {
            throw new ValidationException("playerIds must not contain the requesting player");
        }

        Competition competition = requireCompetition(competitionId);
        requireNotFinal(competition);
        Registration requester = requireRegistrationForUpdate(competitionId, requesterId);
        requireGroupCreator(requester, requesterId);
        UUID teeTimeId = requester.getTeeTimeId();

        List<Registration> members = registrationRepository.findByTeeTimeIdForUpdate(teeTimeId);
        int maxGroupSize = fairwayRuntimeProperties.getRegistration().getMaxGroupSize();
        if (members.size() + targetIds.size() > maxGroupSize) {
            throw ConflictException.groupFull(
                    "Group already has " + members.size() + " of " + maxGroupSize + " players"
            );
        }

        Map<UUID, Player> playersById = playerRepository.findAllById(targetIds).stream()
                .collect(Collectors.toMap(Player::getPlayerId, Function.identity()));
        for (UUID targetId : targetIds) {
            if (!playersById.containsKey(targetId)) {
                throw NotFoundException.player(targetId);
            }
        }
        Map<UUID, Registration> existingByPlayer = registrationRepository
                .findByCompetitionIdAndPlayerIdInForUpdate(competitionId, targetIds).stream()
                .collect(Collectors.toMap(Registration::getPlayerId, Function.identity()));
        CompetitionScope scope = competitionScopeResolver.resolve(competition);

        int nextTeeOrder = participantRepository.findMaxTeeOrder(teeTimeId) + 1;
        for (UUID targetId : targetIds) {
            Registration target = existingByPlayer.get(targetId);
            RegistrationStatus previous = target != null ? target.getStatus() : null;
            if (previous != null && previous != RegistrationStatus.LOOKING_FOR_GROUP) {
                throw ConflictException.alreadyGrouped(
                        "Player " + targetId + " is not available for grouping (status " + previous + ")"
                );
            }
            RegistrationTransitions.require(previous, RegistrationStatus.REGISTERED);

            TourEnrollment enrollment;
            if (target == null) {
                enrollment = requireEnrollment(scope, targetId);
                target = newRegistration(competitionId, targetId, enrollment, now);
            } else {
                enrollment = target.getEnrollmentId() != null
                        ? tourEnrollmentRepository.findById(target.getEnrollmentId()).orElse(null)
                        : null;
            }

            Participant participant = attachParticipant(
                    target,
                    competitionId,
                    teeTimeId,
                    playersById.get(targetId),
                    enrollment,
                    nextTeeOrder++,
                    now
            );
            target.setParticipantId(participant.getParticipantId());
            target.setTeeTimeId(teeTimeId);
            target.setStatus(RegistrationStatus.REGISTERED);
            target.setGroupCreatedBy(requesterId);
            target.setUpdatedAt(now);
            Registration saved = registrationRepository.save(target);
            publishChange(saved, previous, now);
        }

        log.info(
                "Added players to group: competitionId={}, teeTimeId={}, requesterId={}, added={}",
                competitionId,
                teeTimeId,
                requesterId,
                targetIds.size()
        );
        return buildGroup(competition, teeTimeId, requesterId);
    }

    @Transactional
    public RegistrationResponses.PlayingGroup removeFromGroup(UUID competitionId, UUID requesterId, UUID playerId) {
        if (requesterId.equals(playerId)) {
            throw new ValidationException("Use leave to remove yourself from a group");
        }
        OffsetDateTime now = OffsetDateTime.now();
        Competition competition = requireCompetition(competitionId);
        requireNotFinal(competition);

        Map<UUID, Registration> locked = registrationRepository
                .findByCompetitionIdAndPlayerIdInForUpdate(competitionId, List.of(requesterId, playerId)).stream()
                .collect(Collectors.toMap(Registration::getPlayerId, Function.identity()));
        Registration requester = locked.get(requesterId);
        if (requester == null) {
            throw NotFoundException.registration(competitionId, requesterId);
        }
        Registration target = locked.get(playerId);
        if (target == null) {
            throw NotFoundException.registration(competitionId, playerId);
        }
        requireGroupCreator(requester, requesterId);
        if (!Objects.equals(requester.getTeeTimeId(), target.getTeeTimeId())) {
            throw ConflictException.notInGroup("Player " + playerId + " is not in your group");
        }
        RegistrationTransitions.require(target.getStatus(), RegistrationStatus.LOOKING_FOR_GROUP);

        UUID teeTimeId = target.getTeeTimeId();
        detach(target, now);

        log.info(
                "Removed player from group: competitionId={}, teeTimeId={}, requesterId={}, playerId={}",
                competitionId,
                teeTimeId,
                requesterId,
                playerId
        );
        return buildGroup(competition, teeTimeId, requesterId);
    }

    @Transactional
    public RegistrationResponses.Registration leaveGroup(UUID competitionId, UUID playerId) {
        OffsetDateTime now = OffsetDateTime.now();
        Competition competition = requireCompetition(competitionId);
        requireNotFinal(competition);
        Registration registration = requireRegistrationForUpdate(competitionId, playerId);
        return fairwayResponseMapper.toRegistrationResponse(leave(registration, now));
    }

    @Transactional
    public RegistrationResponses.StartPlaying startPlaying(UUID competitionId, UUID playerId) {
        OffsetDateTime now = OffsetDateTime.now();
        Competition competition = requireCompetition(competitionId);
        requireNotFinal(competition);
        Registration registration = start(requireRegistrationForUpdate(competitionId, playerId), now);
        return new RegistrationResponses.StartPlaying(
                competitionId,
                playerId,
                registration.getTeeTimeId(),
                registration.getParticipantId(),
                registration.getStatus()
        );
    }

    @Transactional
    public RegistrationResponses.Registration finishPlaying(UUID competitionId, UUID playerId) {
        OffsetDateTime now = OffsetDateTime.now();
        Competition competition = requireCompetition(competitionId);
        requireNotFinal(competition);
        Registration registration = finish(requireRegistrationForUpdate(competitionId, playerId), now);
        return fairwayResponseMapper.toRegistrationResponse(registration);
    }

    @Transactional
    public RegistrationResponses.Registration updateStatus(
            UUID competitionId,
            UUID playerId,
            RegistrationStatus status
    ) {
        if (status == RegistrationStatus.WITHDRAWN) {
            return withdraw(competitionId, playerId);
        }
        OffsetDateTime now = OffsetDateTime.now();
        Competition competition = requireCompetition(competitionId);
        requireNotFinal(competition);
        Registration registration = requireRegistrationForUpdate(competitionId, playerId);
        Registration updated = switch (status) {
            case PLAYING -> start(registration, now);
            case FINISHED -> finish(registration, now);
            case LOOKING_FOR_GROUP -> leave(registration, now);
            default -> throw ConflictException.illegalTransition(
                    "Status " + status + " cannot be set directly; use the group operations"
            );
        };
        return fairwayResponseMapper.toRegistrationResponse(updated);
    }

    @Transactional(readOnly = true)
    public RegistrationResponses.Registration getRegistration(UUID competitionId, UUID playerId) {
        return registrationRepository.findByCompetitionIdAndPlayerId(competitionId, playerId)
                .map(fairwayResponseMapper::toRegistrationResponse)
                .orElseThrow(() -> NotFoundException.registration(competitionId, playerId));
    }

    /**
     * The viewer's group, or the empty group when the viewer is unknown or has no tee time.
     */
    @Transactional(readOnly = true)
    public RegistrationResponses.PlayingGroup getGroup(UUID competitionId, UUID viewerId) {
        Competition competition = requireCompetition(competitionId);
        int maxGroupSize = fairwayRuntimeProperties.getRegistration().getMaxGroupSize();
        if (viewerId == null) {
            return RegistrationResponses.PlayingGroup.empty(competitionId, maxGroupSize);
        }
        return registrationRepository.findByCompetitionIdAndPlayerId(competitionId, viewerId)
                .filter(registration -> registration.getTeeTimeId() != null)
                .map(registration -> buildGroup(competition, registration.getTeeTimeId(), viewerId))
                .orElseGet(() -> RegistrationResponses.PlayingGroup.empty(competitionId, maxGroupSize));
    }

    @Transactional(readOnly = true)
    public List<RegistrationResponses.PlayingGroup> listGroups(UUID competitionId, UUID viewerId) {
        Competition competition = requireCompetition(competitionId);
        List<Registration> registrations = registrationRepository.findByCompetitionIdOrderByRegisteredAtAsc(competitionId);
        Map<UUID, List<Registration>> membersByTeeTime = registrations.stream()
                .filter(registration -> registration.getTeeTimeId() != null)
                .collect(Collectors.groupingBy(Registration::getTeeTimeId));
        Map<UUID, Player> playersById = loadPlayers(registrations);
        Map<UUID, Participant> participantsById = participantRepository
                .findByCompetitionIdOrderByCreatedAtAsc(competitionId).stream()
                .collect(Collectors.toMap(Participant::getParticipantId, Function.identity()));

        return teeTimeRepository.findByCompetitionIdOrderByCreatedAtAsc(competitionId).stream()
                .map(teeTime -> toPlayingGroup(
                        competition,
                        teeTime,
                        membersByTeeTime.getOrDefault(teeTime.getTeeTimeId(), List.of()),
                        playersById,
                        participantsById,
                        viewerId
                ))
                .toList();
    }

    /**
     * Players a group creator can pick from. Tour competitions list every active enrollment,
     * standalone competitions list existing registrations.
     */
    @Transactional(readOnly = true)
    public List<RegistrationResponses.AvailablePlayer> listAvailablePlayers(UUID competitionId) {
        Competition competition = requireCompetition(competitionId);
        Map<UUID, Registration> registrationsByPlayer = registrationRepository
                .findByCompetitionIdOrderByRegisteredAtAsc(competitionId).stream()
                .collect(Collectors.toMap(Registration::getPlayerId, Function.identity()));

        Map<UUID, BigDecimal> playingHandicaps = new HashMap<>();
        Set<UUID> playerIds = new LinkedHashSet<>();
        if (competitionScopeResolver.resolve(competition) instanceof CompetitionScope.TourLinked tour) {
            for (TourEnrollment enrollment : tourEnrollmentRepository.findByTourIdAndStatus(
                    tour.tourId(),
                    TourEnrollmentStatus.ACTIVE
            )) {
                playerIds.add(enrollment.getPlayerId());
                if (enrollment.getPlayingHandicap() != null) {
                    playingHandicaps.put(enrollment.getPlayerId(), enrollment.getPlayingHandicap());
                }
            }
        } else {
            playerIds.addAll(registrationsByPlayer.keySet());
        }

        Map<UUID, Player> playersById = playerRepository.findAllById(playerIds).stream()
                .collect(Collectors.toMap(Player::getPlayerId, Function.identity()));
        List<RegistrationResponses.AvailablePlayer> available = new ArrayList<>();
        for (UUID playerId : playerIds) {
            Player player = playersById.get(playerId);
            Registration registration = registrationsByPlayer.get(playerId);
            available.add(new RegistrationResponses.AvailablePlayer(
                    playerId,
                    player != null ? player.getName() : null,
                    playingHandicaps.getOrDefault(playerId, player != null ? player.getHandicapIndex() : null),
                    AvailabilityStatus.fromRegistrationStatus(registration != null ? registration.getStatus() : null),
                    registration != null ? registration.getTeeTimeId() : null
            ));
        }
        available.sort(Comparator
                .comparing((RegistrationResponses.AvailablePlayer player) ->
                        player.status() != AvailabilityStatus.LOOKING_FOR_GROUP)
                .thenComparing(RegistrationResponses.AvailablePlayer::name, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)));
        return available;
    }

    /**
     * Rounds the player has a tee time for and has not finished, newest registration first.
     */
    @Transactional(readOnly = true)
    public List<RegistrationResponses.ActiveRound> getActiveRounds(UUID playerId) {
        if (playerId == null) {
            return List.of();
        }
        List<Registration> registrations =
                registrationRepository.findByPlayerIdAndStatusInOrderByRegisteredAtDesc(playerId, ACTIVE_ROUND_STATUSES);
        if (registrations.isEmpty()) {
            return List.of();
        }
        Map<UUID, Competition> competitionsById = competitionRepository.findAllById(
                        registrations.stream().map(Registration::getCompetitionId).collect(Collectors.toSet())
                ).stream()
                .collect(Collectors.toMap(Competition::getCompetitionId, Function.identity()));
        Map<UUID, Participant> participantsById = participantRepository.findAllById(
                        registrations.stream()
                                .map(Registration::getParticipantId)
                                .filter(Objects::nonNull)
                                .collect(Collectors.toSet())
                ).stream()
                .collect(Collectors.toMap(Participant::getParticipantId, Function.identity()));

        List<RegistrationResponses.ActiveRound> rounds = new ArrayList<>();
        for (Registration registration : registrations) {
            Competition competition = competitionsById.get(registration.getCompetitionId());
            if (competition == null || competition.isResultsFinal()) {
                continue;
            }
            Participant participant = registration.getParticipantId() != null
                    ? participantsById.get(registration.getParticipantId())
                    : null;
            List<Integer> scores = participant != null ? participant.getScores() : List.of();
            Integer manualTotal = participant != null ? participant.getManualScoreTotal() : null;
            ScorecardMetrics metrics = ScorecardMetrics.of(scores, manualTotal, null, scores.size());
            rounds.add(new RegistrationResponses.ActiveRound(
                    competition.getCompetitionId(),
                    competition.getName(),
                    competition.getCompetitionDate(),
                    competition.getTourId(),
                    registration.getParticipantId(),
                    registration.getTeeTimeId(),
                    registration.getStatus(),
                    metrics.holesPlayed(),
                    metrics.manual() || metrics.holesPlayed() > 0 ? metrics.grossScore() : null,
                    participant != null && participant.isLocked()
            ));
        }
        return rounds;
    }

    private Registration start(Registration registration, OffsetDateTime now) {
        RegistrationStatus previous = registration.getStatus();
        if (previous == RegistrationStatus.PLAYING) {
            return registration;
        }
        RegistrationTransitions.require(previous, RegistrationStatus.PLAYING);

        if (registration.getTeeTimeId() == null) {
            Player player = playerRepository.findById(registration.getPlayerId())
                    .orElseThrow(() -> NotFoundException.player(registration.getPlayerId()));
            TourEnrollment enrollment = registration.getEnrollmentId() != null
                    ? tourEnrollmentRepository.findById(registration.getEnrollmentId()).orElse(null)
                    : null;
            TeeTime teeTime = allocateTeeTime(registration.getCompetitionId(), now);
            Participant participant = attachParticipant(
                    registration,
                    registration.getCompetitionId(),
                    teeTime.getTeeTimeId(),
                    player,
                    enrollment,
                    1,
                    now
            );
            registration.setTeeTimeId(teeTime.getTeeTimeId());
            registration.setParticipantId(participant.getParticipantId());
            registration.setGroupCreatedBy(registration.getPlayerId());
        }
        registration.setStatus(RegistrationStatus.PLAYING);
        registration.setStartedAt(now);
        registration.setUpdatedAt(now);
        Registration saved = registrationRepository.save(registration);
        publishChange(saved, previous, now);

        log.info(
                "Player started round: competitionId={}, playerId={}, teeTimeId={}",
                saved.getCompetitionId(),
                saved.getPlayerId(),
                saved.getTeeTimeId()
        );
        return saved;
    }

    private Registration finish(Registration registration, OffsetDateTime now) {
        RegistrationStatus previous = registration.getStatus();
        RegistrationTransitions.require(previous, RegistrationStatus.FINISHED);
        registration.setStatus(RegistrationStatus.FINISHED);
        registration.setFinishedAt(now);
        registration.setUpdatedAt(now);
        Registration saved = registrationRepository.save(registration);
        publishChange(saved, previous, now);

        log.info(
                "Player finished round: competitionId={}, playerId={}",
                saved.getCompetitionId(),
                saved.getPlayerId()
        );
        return saved;
    }

    private Registration leave(Registration registration, OffsetDateTime now) {
        RegistrationTransitions.require(registration.getStatus(), RegistrationStatus.LOOKING_FOR_GROUP);
        UUID teeTimeId = registration.getTeeTimeId();
        Registration saved = detach(registration, now);
        if (teeTimeId != null) {
            releaseSlot(teeTimeId, registration.getPlayerId(), now);
        }
        log.info(
                "Player left group: competitionId={}, playerId={}, teeTimeId={}",
                saved.getCompetitionId(),
                saved.getPlayerId(),
                teeTimeId
        );
        return saved;
    }

    /**
     * Moves a registration back to LOOKING_FOR_GROUP. The participant row is kept, without a tee time,
     * so scores already entered survive a regroup.
     */
    private Registration detach(Registration registration, OffsetDateTime now) {
        RegistrationStatus previous = registration.getStatus();
        if (registration.getParticipantId() != null) {
            participantRepository.findById(registration.getParticipantId()).ifPresent(participant -> {
                participant.setTeeTimeId(null);
                participant.setUpdatedAt(now);
                participantRepository.save(participant);
            });
        }
        registration.setStatus(RegistrationStatus.LOOKING_FOR_GROUP);
        registration.setTeeTimeId(null);
        registration.setGroupCreatedBy(null);
        registration.setUpdatedAt(now);
        Registration saved = registrationRepository.save(registration);
        publishChange(saved, previous, now);
        return saved;
    }

    /**
     * Deletes a tee time whose last member has left, or hands creatorship to the earliest remaining
     * member when the creator was the one who left.
     */
    private void releaseSlot(UUID teeTimeId, UUID departedPlayerId, OffsetDateTime now) {
        List<Registration> remaining = registrationRepository.findByTeeTimeIdForUpdate(teeTimeId).stream()
                .filter(member -> !member.getPlayerId().equals(departedPlayerId))
                .toList();
        if (remaining.isEmpty()) {
            teeTimeRepository.deleteById(teeTimeId);
            log.info("Released empty tee time: teeTimeId={}", teeTimeId);
            return;
        }
        boolean creatorLeft = remaining.stream()
                .map(Registration::getGroupCreatedBy)
                .anyMatch(departedPlayerId::equals);
        if (!creatorLeft) {
            return;
        }
        UUID newCreator = remaining.get(0).getPlayerId();
        for (Registration member : remaining) {
            member.setGroupCreatedBy(newCreator);
            member.setUpdatedAt(now);
            registrationRepository.save(member);
        }
        log.info("Transferred group creatorship: teeTimeId={}, newCreator={}", teeTimeId, newCreator);
    }

    private RegistrationResponses.PlayingGroup buildGroup(Competition competition, UUID teeTimeId, UUID viewerId) {
        TeeTime teeTime = teeTimeRepository.findById(teeTimeId)
                .orElseThrow(() -> new NotFoundException("Tee time not found: " + teeTimeId));
        List<Registration> members = registrationRepository.findByTeeTimeIdOrderByRegisteredAtAsc(teeTimeId);
        Map<UUID, Participant> participantsById = participantRepository.findByTeeTimeIdOrderByTeeOrderAsc(teeTimeId)
                .stream()
                .collect(Collectors.toMap(Participant::getParticipantId, Function.identity()));
        return toPlayingGroup(competition, teeTime, members, loadPlayers(members), participantsById, viewerId);
    }

    private RegistrationResponses.PlayingGroup toPlayingGroup(
            Competition competition,
            TeeTime teeTime,
            List<Registration> members,
            Map<UUID, Player> playersById,
            Map<UUID, Participant> participantsById,
            UUID viewerId
    ) {
        UUID creator = members.stream()
                .map(Registration::getGroupCreatedBy)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        List<RegistrationResponses.GroupMember> players = members.stream()
                .map(member -> {
                    Player player = playersById.get(member.getPlayerId());
                    Participant participant = member.getParticipantId() != null
                            ? participantsById.get(member.getParticipantId())
                            : null;
                    return new RegistrationResponses.GroupMember(
                            member.getPlayerId(),
                            player != null ? player.getName() : null,
                            participant != null ? participant.getHandicapIndex() : null,
                            member.getParticipantId(),
                            member.getStatus(),
                            participant != null ? participant.getTeeOrder() : null,
                            member.getPlayerId().equals(viewerId),
                            member.getPlayerId().equals(creator)
                    );
                })
                .sorted(Comparator.comparing(
                        RegistrationResponses.GroupMember::teeOrder,
                        Comparator.nullsLast(Comparator.naturalOrder())
                ))
                .toList();
        return new RegistrationResponses.PlayingGroup(
                teeTime.getTeeTimeId(),
                competition.getCompetitionId(),
                teeTime.getStartHole(),
                creator,
                players,
                fairwayRuntimeProperties.getRegistration().getMaxGroupSize()
        );
    }

    private Map<UUID, Player> loadPlayers(List<Registration> registrations) {
        Set<UUID> playerIds = new HashSet<>();
        for (Registration registration : registrations) {
            playerIds.add(registration.getPlayerId());
        }
        return playerRepository.findAllById(playerIds).stream()
                .collect(Collectors.toMap(Player::getPlayerId, Function.identity()));
    }

    private Participant attachParticipant(
            Registration registration,
            UUID competitionId,
            UUID teeTimeId,
            Player player,
            TourEnrollment enrollment,
            int teeOrder,
            OffsetDateTime now
    ) {
        if (registration.getParticipantId() != null) {
            Participant existing = participantRepository.findById(registration.getParticipantId()).orElse(null);
            if (existing != null) {
                existing.setTeeTimeId(teeTimeId);
                existing.setTeeOrder(teeOrder);
                existing.setUpdatedAt(now);
                return participantRepository.save(existing);
            }
        }
        return createParticipant(competitionId, teeTimeId, player, enrollment, teeOrder, now);
    }

    private Participant createParticipant(
            UUID competitionId,
            UUID teeTimeId,
            Player player,
            TourEnrollment enrollment,
            int teeOrder,
            OffsetDateTime now
    ) {
        Participant participant = new Participant();
        participant.setParticipantId(UUID.randomUUID());
        participant.setCompetitionId(competitionId);
        participant.setTeeTimeId(teeTimeId);
        participant.setPlayerId(player.getPlayerId());
        participant.setTeeOrder(teeOrder);
        participant.setScores(new ArrayList<>());
        participant.setHandicapIndex(enrollment != null && enrollment.getPlayingHandicap() != null
                ? enrollment.getPlayingHandicap()
                : player.getHandicapIndex());
        participant.setCreatedAt(now);
        participant.setUpdatedAt(now);
        return participantRepository.save(participant);
    }

    private TeeTime allocateTeeTime(UUID competitionId, OffsetDateTime now) {
        TeeTime teeTime = new TeeTime();
        teeTime.setTeeTimeId(UUID.randomUUID());
        teeTime.setCompetitionId(competitionId);
        teeTime.setStartHole(1);
        teeTime.setCreatedAt(now);
        return teeTimeRepository.save(teeTime);
    }

    private Registration newRegistration(
            UUID competitionId,
            UUID playerId,
            TourEnrollment enrollment,
            OffsetDateTime now
    ) {
        Registration registration = new Registration();
        registration.setRegistrationId(UUID.randomUUID());
        registration.setCompetitionId(competitionId);
        registration.setPlayerId(playerId);
        registration.setEnrollmentId(enrollment != null ? enrollment.getEnrollmentId() : null);
        registration.setRegisteredAt(now);
        registration.setUpdatedAt(now);
        return registration;
    }

    private TourEnrollment requireEnrollment(CompetitionScope scope, UUID playerId) {
        if (!(scope instanceof CompetitionScope.TourLinked tour)) {
            return null;
        }
        return tourEnrollmentRepository
                .findByTourIdAndPlayerIdAndStatus(tour.tourId(), playerId, TourEnrollmentStatus.ACTIVE)
                .orElseThrow(() -> ConflictException.notEnrolled(
                        "Player " + playerId + " has no active enrollment in tour " + tour.tourId()
                ));
    }

    private void requireGroupCreator(Registration requester, UUID requesterId) {
        if (requester.getTeeTimeId() == null || requester.getStatus() != RegistrationStatus.REGISTERED) {
            throw ConflictException.notInGroup("Requester must hold a tee time in REGISTERED status");
        }
        if (!requesterId.equals(requester.getGroupCreatedBy())) {
            throw AuthorizationException.notGroupCreator("Only the group creator can change the group");
        }
    }

    private void requireSelfRegistrationOpen(Competition competition, OffsetDateTime now) {
        if (competition.getStartMode() != CompetitionStartMode.OPEN) {
            throw ConflictException.notOpenStart(
                    "Competition " + competition.getCompetitionId() + " does not accept self-registration"
            );
        }
        if (!fairwayRuntimeProperties.getRegistration().isEnforceOpenWindow()) {
            return;
        }
        boolean beforeWindow = competition.getOpenStart() != null && now.isBefore(competition.getOpenStart());
        boolean afterWindow = competition.getOpenEnd() != null && now.isAfter(competition.getOpenEnd());
        if (beforeWindow || afterWindow) {
            log.warn(
                    "Rejected registration outside open window: competitionId={}, openStart={}, openEnd={}",
                    competition.getCompetitionId(),
                    competition.getOpenStart(),
                    competition.getOpenEnd()
            );
            throw ConflictException.registrationWindowClosed(
                    "Registration window is closed for competition " + competition.getCompetitionId()
            );
        }
    }

    private Registration requireRegistrationForUpdate(UUID competitionId, UUID playerId) {
        return registrationRepository.findByCompetitionIdAndPlayerIdForUpdate(competitionId, playerId)
                .orElseThrow(() -> NotFoundException.registration(competitionId, playerId));
    }

    private Competition requireCompetition(UUID competitionId) {
        return competitionRepository.findById(competitionId)
                .orElseThrow(() -> NotFoundException.competition(competitionId));
    }

    private static void requireNotFinal(Competition competition) {
        if (competition.isResultsFinal()) {
            throw new AlreadyFinalizedException(competition.getCompetitionId());
        }
    }

    private void publishChange(Registration registration, RegistrationStatus previous, OffsetDateTime now) {
        applicationEventPublisher.publishEvent(new RegistrationChangedEvent(
                registration.getCompetitionId(),
                registration.getPlayerId(),
                previous,
                registration.getStatus(),
                registration.getTeeTimeId(),
                now
        ));
    }
}
