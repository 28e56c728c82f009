package com.fairwaytour.repository;

import com.fairwaytour.model.CompetitionCategoryTee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompetitionCategoryTeeRepository extends JpaRepository<CompetitionCategoryTee, UUID> {
    List<CompetitionCategoryTee> findByCompetitionId(UUID competitionId);

    Optional<CompetitionCategoryTee> findByCompetitionIdAndCategoryId(UUID competitionId, UUID categoryId);
}
