package com.fairwaytour.repository;

import com.fairwaytour.model.Participant;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, UUID> {
    List<Participant> findByCompetitionIdOrderByCreatedAtAsc(UUID competitionId);

    List<Participant> findByTeeTimeIdOrderByTeeOrderAsc(UUID teeTimeId);

    @Query("select coalesce(max(p.teeOrder), 0) from Participant p where p.teeTimeId = :teeTimeId")
    int findMaxTeeOrder(@Param("teeTimeId") UUID teeTimeId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Participant p where p.participantId = :participantId")
    Optional<Participant> findByParticipantIdForUpdate(@Param("participantId") UUID participantId);
}
