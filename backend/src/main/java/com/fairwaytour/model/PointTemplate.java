package com.fairwaytour.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "point_templates")
public class PointTemplate {

    public static final String DEFAULT_POSITION_KEY = "default";

    @Id
    @Column(name = "point_template_id", nullable = false, updatable = false)
    private UUID pointTemplateId;

    @Column(name = "tour_id")
    private UUID tourId;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Finishing position (as a string key) to points, plus an optional "default" entry.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "points_structure", nullable = false, columnDefinition = "jsonb")
    private Map<String, Integer> pointsStructure = new LinkedHashMap<>();
}
