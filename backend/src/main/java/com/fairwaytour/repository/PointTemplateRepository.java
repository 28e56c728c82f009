package com.fairwaytour.repository;

import com.fairwaytour.model.PointTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PointTemplateRepository extends JpaRepository<PointTemplate, UUID> {
}
