package com.fairwaytour.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "course_tees")
public class CourseTee {

    @Id
    @Column(name = "tee_id", nullable = false, updatable = false)
    private UUID teeId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "slope_rating")
    private Integer slopeRating;

    @Column(name = "course_rating", precision = 4, scale = 1)
    private BigDecimal courseRating;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "pars", nullable = false, columnDefinition = "jsonb")
    private List<Integer> pars = new ArrayList<>();

    public int totalPar() {
        return pars.stream().mapToInt(Integer::intValue).sum();
    }
}
