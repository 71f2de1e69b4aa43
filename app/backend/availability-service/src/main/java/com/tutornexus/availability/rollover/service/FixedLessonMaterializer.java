package com.tutornexus.availability.rollover.service;

import com.tutornexus.availability.common.entity.Lesson;
import com.tutornexus.availability.common.entity.LessonStatus;
import com.tutornexus.availability.common.entity.WeeklyTemplate;
import com.tutornexus.availability.common.repository.LessonRepository;
import com.tutornexus.availability.common.repository.WeeklyTemplateRepository;
import com.tutornexus.availability.common.util.ScheduleTimes;
import com.tutornexus.availability.slots.algorithm.NaturalKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Turns fixed weekly templates into scheduled lessons for their reserved student.
 * A lesson already present at the same teacher, date and start time is left alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FixedLessonMaterializer {

    private final WeeklyTemplateRepository weeklyTemplateRepository;
    private final LessonRepository lessonRepository;

    /**
     * @param weekStart Sunday of the target week
     */
    public FixedLessonResult materialize(LocalDate weekStart) {
        List<WeeklyTemplate> templates = weeklyTemplateRepository.findByIsActiveTrueAndIsFixedTrueOrderByTemplateIdAsc();
        int created = 0;
        int skipped = 0;

        for (WeeklyTemplate template : templates) {
            try {
                Lesson lesson = toLesson(template, weekStart);
                if (lesson == null) {
                    skipped++;
                    continue;
                }
                if (lessonRepository.existsByTeacherIdAndDateAndStartTime(
                        lesson.getTeacherId(), lesson.getDate(), lesson.getStartTime())) {
                    log.debug("Fixed lesson already exists: {}", lesson.getLessonId());
                    skipped++;
                    continue;
                }
                lessonRepository.save(lesson);
                created++;
                log.info("Fixed lesson created: lessonId={}, studentId={}", lesson.getLessonId(), lesson.getStudentId());
            } catch (RuntimeException e) {
                log.error("Failed to create fixed lesson: templateId={}, weekStart={}",
                        template.getTemplateId(), weekStart, e);
                skipped++;
            }
        }

        log.info("Fixed lessons for week {} - created={}, skipped={}", weekStart, created, skipped);
        return new FixedLessonResult(created, skipped);
    }

    /**
     * Number of fixed lessons {@link #materialize(LocalDate)} would create. Read only.
     */
    public int countPending(LocalDate weekStart) {
        int pending = 0;
        for (WeeklyTemplate template : weeklyTemplateRepository.findByIsActiveTrueAndIsFixedTrueOrderByTemplateIdAsc()) {
            Lesson lesson = toLesson(template, weekStart);
            if (lesson != null && !lessonRepository.existsByTeacherIdAndDateAndStartTime(
                    lesson.getTeacherId(), lesson.getDate(), lesson.getStartTime())) {
                pending++;
            }
        }
        return pending;
    }

    private Lesson toLesson(WeeklyTemplate template, LocalDate weekStart) {
        if (template.getReservedForStudentId() == null || template.getReservedForStudentId().isBlank()) {
            log.warn("Fixed template without reserved student, skipped: templateId={}", template.getTemplateId());
            return null;
        }
        if (template.getTeacherId() == null || template.getDayOfWeek() == null
                || template.getDayOfWeek() < 0 || template.getDayOfWeek() > 6 || template.getStartTime() == null) {
            log.warn("Invalid fixed template, skipped: templateId={}", template.getTemplateId());
            return null;
        }

        LocalDate date = ScheduleTimes.weekStart(weekStart).plusDays(template.getDayOfWeek());
        return Lesson.builder()
                .lessonId(NaturalKey.of(template.getTeacherId(), date, template.getStartTime()))
                .teacherId(template.getTeacherId())
                .studentId(template.getReservedForStudentId())
                .studentName(template.getReservedForStudentName())
                .date(date)
                .startTime(template.getStartTime())
                .durationMinutes(resolveDuration(template))
                .status(LessonStatus.SCHEDULED)
                .lessonType(template.getType())
                .build();
    }

    static int resolveDuration(WeeklyTemplate template) {
        if (template.getDurationMinutes() != null && template.getDurationMinutes() > 0) {
            return template.getDurationMinutes();
        }
        if (template.getStartTime() != null && template.getEndTime() != null
                && template.getEndTime().isAfter(template.getStartTime())) {
            return (int) Duration.between(template.getStartTime(), template.getEndTime()).toMinutes();
        }
        return Lesson.DEFAULT_DURATION_MINUTES;
    }
}
