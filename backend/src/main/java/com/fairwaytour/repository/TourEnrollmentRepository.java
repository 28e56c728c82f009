package com.fairwaytour.repository;

import com.fairwaytour.model.TourEnrollment;
import com.fairwaytour.model.TourEnrollmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TourEnrollmentRepository extends JpaRepository<TourEnrollment, UUID> {
    Optional<TourEnrollment> findByTourIdAndPlayerIdAndStatus(UUID tourId, UUID playerId, TourEnrollmentStatus status);

    Optional<TourEnrollment> findByTourIdAndPlayerId(UUID tourId, UUID playerId);

    List<TourEnrollment> findByTourId(UUID tourId);

    List<TourEnrollment> findByTourIdAndStatus(UUID tourId, TourEnrollmentStatus status);

    long countByTourIdAndStatus(UUID tourId, TourEnrollmentStatus status);
}
