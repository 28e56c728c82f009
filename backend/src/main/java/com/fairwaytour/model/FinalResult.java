package com.fairwaytour.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Immutable
@Table(name = "final_results")
public class FinalResult {

    @Id
    @Column(name = "result_id", nullable = false, updatable = false)
    private UUID resultId;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "participant_id", nullable = false, updatable = false)
    private UUID participantId;

    @Column(name = "player_id", nullable = false, updatable = false)
    private UUID playerId;

    @Column(name = "player_name", nullable = false, updatable = false)
    private String playerName;

    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_type", nullable = false, updatable = false, length = 16)
    private ScoringType scoringType;

    @Column(name = "position", updatable = false)
    private Integer position;

    @Column(name = "points", nullable = false, updatable = false)
    private Integer points = 0;

    @Column(name = "gross_score", updatable = false)
    private Integer grossScore;

    @Column(name = "net_score", updatable = false)
    private Integer netScore;

    @Column(name = "relative_to_par", updatable = false)
    private Integer relativeToPar;

    @Column(name = "holes_played", nullable = false, updatable = false)
    private Integer holesPlayed = 0;

    @Column(name = "is_complete", nullable = false, updatable = false)
    private boolean complete;

    @Column(name = "is_dq", nullable = false, updatable = false)
    private boolean disqualified;

    @Column(name = "calculated_at", nullable = false, updatable = false)
    private OffsetDateTime calculatedAt;
}
