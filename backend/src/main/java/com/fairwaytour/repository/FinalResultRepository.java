package com.fairwaytour.repository;

import com.fairwaytour.model.FinalResult;
import com.fairwaytour.model.ScoringType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface FinalResultRepository extends JpaRepository<FinalResult, UUID> {
    List<FinalResult> findByCompetitionIdAndScoringTypeOrderByPositionAscPlayerNameAsc(
            UUID competitionId,
            ScoringType scoringType
    );

    List<FinalResult> findByCompetitionIdInAndScoringType(Collection<UUID> competitionIds, ScoringType scoringType);

    @Modifying
    @Query("delete from FinalResult r where r.competitionId = :competitionId")
    int deleteByCompetitionId(@Param("competitionId") UUID competitionId);
}
