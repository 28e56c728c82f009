package com.fairwaytour.repository;

import com.fairwaytour.model.TourCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TourCategoryRepository extends JpaRepository<TourCategory, UUID> {
    List<TourCategory> findByTourIdOrderBySortOrderAscNameAsc(UUID tourId);
}
