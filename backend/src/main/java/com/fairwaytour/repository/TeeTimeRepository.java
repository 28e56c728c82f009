package com.fairwaytour.repository;

import com.fairwaytour.model.TeeTime;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TeeTimeRepository extends JpaRepository<TeeTime, UUID> {
    List<TeeTime> findByCompetitionIdOrderByCreatedAtAsc(UUID competitionId);
}
