package com.fairwaytour.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A player's scorecard in one competition. Hole scores are stored in hole order:
 * 0 means not yet played, -1 means picked up. A manual total, when set by an admin, replaces the
 * hole-by-hole gross.
 */
@Getter
@Setter
@Entity
@Table(name = "participants")
public class Participant {

    @Id
    @Column(name = "participant_id", nullable = false, updatable = false)
    private UUID participantId;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "tee_time_id")
    private UUID teeTimeId;

    @Column(name = "player_id", nullable = false, updatable = false)
    private UUID playerId;

    @Column(name = "tee_order", nullable = false)
    private Integer teeOrder = 1;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scores", nullable = false, columnDefinition = "jsonb")
    private List<Integer> scores = new ArrayList<>();

    @Column(name = "manual_score_total")
    private Integer manualScoreTotal;

    @Column(name = "is_locked", nullable = false)
    private boolean locked = false;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "is_dq", nullable = false)
    private boolean disqualified = false;

    @Column(name = "dq_reason", columnDefinition = "TEXT")
    private String dqReason;

    @Column(name = "handicap_index", precision = 4, scale = 1)
    private BigDecimal handicapIndex;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
