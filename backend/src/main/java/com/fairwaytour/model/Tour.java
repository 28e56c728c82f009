package com.fairwaytour.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "tours")
public class Tour {

    @Id
    @Column(name = "tour_id", nullable = false, updatable = false)
    private UUID tourId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "point_template_id")
    private UUID pointTemplateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_mode", nullable = false, length = 16)
    private ScoringMode scoringMode = ScoringMode.GROSS;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
