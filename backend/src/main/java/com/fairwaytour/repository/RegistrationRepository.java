package com.fairwaytour.repository;

import com.fairwaytour.model.Registration;
import com.fairwaytour.model.RegistrationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RegistrationRepository extends JpaRepository<Registration, UUID> {
    Optional<Registration> findByCompetitionIdAndPlayerId(UUID competitionId, UUID playerId);

    boolean existsByCompetitionIdAndPlayerId(UUID competitionId, UUID playerId);

    List<Registration> findByCompetitionIdOrderByRegisteredAtAsc(UUID competitionId);

    List<Registration> findByTeeTimeIdOrderByRegisteredAtAsc(UUID teeTimeId);

    List<Registration> findByPlayerIdAndStatusInOrderByRegisteredAtDesc(
            UUID playerId,
            Collection<RegistrationStatus> statuses
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select r from Registration r
            where r.competitionId = :competitionId and r.playerId = :playerId
            """)
    Optional<Registration> findByCompetitionIdAndPlayerIdForUpdate(
            @Param("competitionId") UUID competitionId,
            @Param("playerId") UUID playerId
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select r from Registration r
            where r.competitionId = :competitionId and r.playerId in :playerIds
            order by r.playerId
            """)
    List<Registration> findByCompetitionIdAndPlayerIdInForUpdate(
            @Param("competitionId") UUID competitionId,
            @Param("playerIds") Collection<UUID> playerIds
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Registration r where r.teeTimeId = :teeTimeId order by r.registeredAt")
    List<Registration> findByTeeTimeIdForUpdate(@Param("teeTimeId") UUID teeTimeId);
}
