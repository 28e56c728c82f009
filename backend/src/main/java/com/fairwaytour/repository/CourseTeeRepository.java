package com.fairwaytour.repository;

import com.fairwaytour.model.CourseTee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CourseTeeRepository extends JpaRepository<CourseTee, UUID> {
}
