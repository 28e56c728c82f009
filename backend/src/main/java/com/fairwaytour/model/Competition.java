package com.fairwaytour.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "competitions")
public class Competition {

    @Id
    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "tour_id")
    private UUID tourId;

    @Column(name = "tee_id")
    private UUID teeId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "competition_date")
    private LocalDate competitionDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_mode", nullable = false, length = 16)
    private ScoringMode scoringMode = ScoringMode.GROSS;

    @Column(name = "points_multiplier", nullable = false, precision = 6, scale = 2)
    private BigDecimal pointsMultiplier = BigDecimal.ONE;

    @Enumerated(EnumType.STRING)
    @Column(name = "start_mode", nullable = false, length = 16)
    private CompetitionStartMode startMode = CompetitionStartMode.SCHEDULED;

    @Column(name = "open_start")
    private OffsetDateTime openStart;

    @Column(name = "open_end")
    private OffsetDateTime openEnd;

    @Column(name = "is_results_final", nullable = false)
    private boolean resultsFinal = false;

    @Column(name = "results_finalized_at")
    private OffsetDateTime resultsFinalizedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
