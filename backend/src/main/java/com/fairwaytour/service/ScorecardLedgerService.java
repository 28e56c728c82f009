package com.fairwaytour.service;

import com.fairwaytour.dto.ScorecardResponses;
import com.fairwaytour.event.ManualScoreUpdatedEvent;
import com.fairwaytour.event.ParticipantDisqualifiedEvent;
import com.fairwaytour.event.ParticipantLockChangedEvent;
import com.fairwaytour.event.ScoreUpdatedEvent;
import com.fairwaytour.mapper.FairwayResponseMapper;
import com.fairwaytour.model.Competition;
import com.fairwaytour.model.CourseTee;
import com.fairwaytour.model.Participant;
import com.fairwaytour.repository.CompetitionRepository;
import com.fairwaytour.repository.ParticipantRepository;
import com.fairwaytour.web.AlreadyFinalizedException;
import com.fairwaytour.web.LockedException;
import com.fairwaytour.web.NotFoundException;
import com.fairwaytour.web.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Hole-by-hole scores per participant. A locked scorecard rejects writes until an admin unlocks it,
 * and nothing is writable once the competition's results are final.
 */
@Service
public class ScorecardLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ScorecardLedgerService.class);

    private final ParticipantRepository participantRepository;
    private final CompetitionRepository competitionRepository;
    private final CourseLayoutResolver courseLayoutResolver;
    private final HandicapCalculator handicapCalculator;
    private final FairwayResponseMapper fairwayResponseMapper;
    private final ApplicationEventPublisher applicationEventPublisher;

    public ScorecardLedgerService(
            ParticipantRepository participantRepository,
            CompetitionRepository competitionRepository,
            CourseLayoutResolver courseLayoutResolver,
            HandicapCalculator handicapCalculator,
            FairwayResponseMapper fairwayResponseMapper,
            ApplicationEventPublisher applicationEventPublisher
    ) {
        this.participantRepository = participantRepository;
        this.competitionRepository = competitionRepository;
        this.courseLayoutResolver = courseLayoutResolver;
        this.handicapCalculator = handicapCalculator;
        this.fairwayResponseMapper = fairwayResponseMapper;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * @param hole 1-based hole number
     * @param shots strokes taken, 0 to clear the hole, -1 for picked up
     */
    @Transactional
    public ScorecardResponses.Scorecard updateScore(UUID participantId, int hole, int shots) {
        Participant participant = requireParticipantForUpdate(participantId);
        Competition competition = requireWritableCompetition(participant);
        if (participant.isLocked()) {
            throw new LockedException(participantId);
        }

        CourseLayout layout = courseLayoutResolver.resolve(competition);
        if (hole < 1 || hole > layout.holeCount()) {
            throw new ValidationException("hole must be between 1 and " + layout.holeCount());
        }
        if (shots < ScorecardMetrics.PICKED_UP) {
            throw new ValidationException("shots must be -1 (picked up) or at least 0");
        }

        List<Integer> scores = new ArrayList<>(participant.getScores());
        while (scores.size() < layout.holeCount()) {
            scores.add(0);
        }
        scores.set(hole - 1, shots);

        OffsetDateTime now = OffsetDateTime.now();
        participant.setScores(scores);
        participant.setUpdatedAt(now);
        Participant saved = participantRepository.save(participant);
        applicationEventPublisher.publishEvent(new ScoreUpdatedEvent(
                saved.getCompetitionId(),
                participantId,
                hole,
                shots,
                now
        ));

        log.debug("Recorded score: participantId={}, hole={}, shots={}", participantId, hole, shots);
        return toScorecard(saved, competition, layout);
    }

    /**
     * Replaces the hole-by-hole card with a round total, or clears it when {@code total} is null.
     * The hole scores are kept and count again once the total is cleared.
     */
    @Transactional
    public ScorecardResponses.Scorecard setManualScore(UUID participantId, Integer total) {
        if (total != null && total <= 0) {
            throw new ValidationException("total must be positive");
        }
        Participant participant = requireParticipantForUpdate(participantId);
        Competition competition = requireWritableCompetition(participant);
        CourseLayout layout = courseLayoutResolver.resolve(competition);
        if (Objects.equals(participant.getManualScoreTotal(), total)) {
            return toScorecard(participant, competition, layout);
        }

        OffsetDateTime now = OffsetDateTime.now();
        participant.setManualScoreTotal(total);
        participant.setUpdatedAt(now);
        Participant saved = participantRepository.save(participant);
        applicationEventPublisher.publishEvent(new ManualScoreUpdatedEvent(
                saved.getCompetitionId(),
                participantId,
                total,
                now
        ));

        log.info("Changed manual score: participantId={}, total={}", participantId, total);
        return toScorecard(saved, competition, layout);
    }

    @Transactional
    public ScorecardResponses.Scorecard lock(UUID participantId) {
        return setLocked(participantId, true);
    }

    @Transactional
    public ScorecardResponses.Scorecard unlock(UUID participantId) {
        return setLocked(participantId, false);
    }

    @Transactional
    public ScorecardResponses.Scorecard setDisqualified(UUID participantId, boolean disqualified, String reason) {
        Participant participant = requireParticipantForUpdate(participantId);
        Competition competition = requireWritableCompetition(participant);
        boolean changed = participant.isDisqualified() != disqualified;

        OffsetDateTime now = OffsetDateTime.now();
        participant.setDisqualified(disqualified);
        participant.setDqReason(disqualified ? reason : null);
        participant.setUpdatedAt(now);
        Participant saved = participantRepository.save(participant);

        if (changed) {
            applicationEventPublisher.publishEvent(new ParticipantDisqualifiedEvent(
                    saved.getCompetitionId(),
                    participantId,
                    disqualified,
                    now
            ));
            log.info(
                    "Changed disqualification: participantId={}, disqualified={}, reason={}",
                    participantId,
                    disqualified,
                    reason
            );
        }
        return toScorecard(saved, competition, courseLayoutResolver.resolve(competition));
    }

    @Transactional(readOnly = true)
    public ScorecardResponses.Scorecard getScorecard(UUID participantId) {
        Participant participant = participantRepository.findById(participantId)
                .orElseThrow(() -> NotFoundException.participant(participantId));
        Competition competition = competitionRepository.findById(participant.getCompetitionId())
                .orElseThrow(() -> NotFoundException.competition(participant.getCompetitionId()));
        return toScorecard(participant, competition, courseLayoutResolver.resolve(competition));
    }

    private ScorecardResponses.Scorecard setLocked(UUID participantId, boolean locked) {
        Participant participant = requireParticipantForUpdate(participantId);
        Competition competition = requireWritableCompetition(participant);
        CourseLayout layout = courseLayoutResolver.resolve(competition);
        if (participant.isLocked() == locked) {
            return toScorecard(participant, competition, layout);
        }

        OffsetDateTime now = OffsetDateTime.now();
        participant.setLocked(locked);
        participant.setLockedAt(locked ? now : null);
        participant.setUpdatedAt(now);
        Participant saved = participantRepository.save(participant);
        applicationEventPublisher.publishEvent(new ParticipantLockChangedEvent(
                saved.getCompetitionId(),
                participantId,
                locked,
                now
        ));

        log.info("Changed scorecard lock: participantId={}, locked={}", participantId, locked);
        return toScorecard(saved, competition, layout);
    }

    private ScorecardResponses.Scorecard toScorecard(
            Participant participant,
            Competition competition,
            CourseLayout layout
    ) {
        ScorecardMetrics metrics = ScorecardMetrics.of(
                participant.getScores(),
                participant.getManualScoreTotal(),
                layout.pars(),
                layout.holeCount()
        );
        CourseTee handicapTee = courseLayoutResolver.resolveHandicapTee(competition, layout, participant.getPlayerId());
        int handicapStrokes = handicapCalculator.handicapStrokes(participant.getHandicapIndex(), handicapTee);
        return fairwayResponseMapper.toScorecardResponse(participant, metrics, layout.parsKnown(), handicapStrokes);
    }

    private Participant requireParticipantForUpdate(UUID participantId) {
        return participantRepository.findByParticipantIdForUpdate(participantId)
                .orElseThrow(() -> NotFoundException.participant(participantId));
    }

    private Competition requireWritableCompetition(Participant participant) {
        Competition competition = competitionRepository.findById(participant.getCompetitionId())
                .orElseThrow(() -> NotFoundException.competition(participant.getCompetitionId()));
        if (competition.isResultsFinal()) {
            throw new AlreadyFinalizedException(competition.getCompetitionId());
        }
        return competition;
    }
}
