package com.fairwaytour.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Tee a tour category plays from in one competition. Only the slope and course rating of this tee
 * feed the category's course handicaps; pars and hole count stay those of the competition tee.
 */
@Getter
@Setter
@Entity
@Table(name = "competition_category_tees")
public class CompetitionCategoryTee {

    @Id
    @Column(name = "competition_category_tee_id", nullable = false, updatable = false)
    private UUID competitionCategoryTeeId;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "tee_id", nullable = false)
    private UUID teeId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
