package com.tutornexus.availability.common.repository;

import com.tutornexus.availability.common.entity.WeeklyTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WeeklyTemplateRepository extends JpaRepository<WeeklyTemplate, Long> {

    List<WeeklyTemplate> findByIsActiveTrueOrderByTemplateIdAsc();

    List<WeeklyTemplate> findByTeacherIdAndIsActiveTrueOrderByTemplateIdAsc(String teacherId);

    // Fixed templates become lessons, not slots
    List<WeeklyTemplate> findByIsActiveTrueAndIsFixedTrueOrderByTemplateIdAsc();
}
