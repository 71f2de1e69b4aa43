package com.tutornexus.availability.rollover.service;

import com.tutornexus.availability.common.entity.Lesson;
import com.tutornexus.availability.common.entity.LessonStatus;
import com.tutornexus.availability.common.entity.WeeklyTemplate;
import com.tutornexus.availability.common.repository.LessonRepository;
import com.tutornexus.availability.common.repository.WeeklyTemplateRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
class FixedLessonMaterializerTest {

    private static final LocalDate WEEK_START = LocalDate.of(2025, 2, 9);

    @Mock
    private WeeklyTemplateRepository weeklyTemplateRepository;

    @Mock
    private LessonRepository lessonRepository;

    @InjectMocks
    private FixedLessonMaterializer fixedLessonMaterializer;

    @Captor
    private ArgumentCaptor<Lesson> lessonCaptor;

    private static WeeklyTemplate fixedTemplate(Long id, String studentId, Integer duration) {
        return WeeklyTemplate.builder()
                .templateId(id)
                .teacherId("T1")
                .dayOfWeek(2)
                .startTime(LocalTime.of(15, 0))
                .endTime(LocalTime.of(15, 45))
                .durationMinutes(duration)
                .isFixed(true)
                .reservedForStudentId(studentId)
                .reservedForStudentName("Noa")
                .build();
    }

    @Test
    @DisplayName("Fixed template becomes a scheduled lesson on its weekday")
    void materialize_createsLesson() {
        // given
        given(weeklyTemplateRepository.findByIsActiveTrueAndIsFixedTrueOrderByTemplateIdAsc())
                .willReturn(List.of(fixedTemplate(1L, "S1", null)));
        given(lessonRepository.existsByTeacherIdAndDateAndStartTime("T1", LocalDate.of(2025, 2, 11), LocalTime.of(15, 0)))
                .willReturn(false);

        // when
        FixedLessonResult result = fixedLessonMaterializer.materialize(WEEK_START);

        // then
        assertThat(result.getCreated()).isEqualTo(1);
        then(lessonRepository).should().save(lessonCaptor.capture());
        Lesson lesson = lessonCaptor.getValue();
        assertThat(lesson.getLessonId()).isEqualTo("T1|2025-02-11|15:00");
        assertThat(lesson.getStudentId()).isEqualTo("S1");
        assertThat(lesson.getStatus()).isEqualTo(LessonStatus.SCHEDULED);
        // no explicit duration: end - start
        assertThat(lesson.getDurationMinutes()).isEqualTo(45);
    }

    @Test
    @DisplayName("Existing lesson at the same time is not duplicated")
    void materialize_skipsExisting() {
        given(weeklyTemplateRepository.findByIsActiveTrueAndIsFixedTrueOrderByTemplateIdAsc())
                .willReturn(List.of(fixedTemplate(1L, "S1", 60)));
        given(lessonRepository.existsByTeacherIdAndDateAndStartTime(any(), any(), any())).willReturn(true);

        FixedLessonResult result = fixedLessonMaterializer.materialize(WEEK_START);

        assertThat(result.getCreated()).isZero();
        assertThat(result.getSkipped()).isEqualTo(1);
        then(lessonRepository).should(never()).save(any());
    }

    @Test
    @DisplayName("Template without reserved student and failing saves are skipped, the rest continues")
    void materialize_skipsFailures() {
        // given
        WeeklyTemplate noStudent = fixedTemplate(1L, null, 60);
        WeeklyTemplate failing = fixedTemplate(2L, "S2", 60);
        WeeklyTemplate ok = fixedTemplate(3L, "S3", 60);
        ok.setStartTime(LocalTime.of(17, 0));
        ok.setEndTime(LocalTime.of(18, 0));

        given(weeklyTemplateRepository.findByIsActiveTrueAndIsFixedTrueOrderByTemplateIdAsc())
                .willReturn(List.of(noStudent, failing, ok));
        given(lessonRepository.existsByTeacherIdAndDateAndStartTime(any(), any(), any())).willReturn(false);
        given(lessonRepository.save(any(Lesson.class)))
                .willThrow(new IllegalStateException("db down"))
                .willAnswer(invocation -> invocation.getArgument(0));

        // when
        FixedLessonResult result = fixedLessonMaterializer.materialize(WEEK_START);

        // then
        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.getSkipped()).isEqualTo(2);
        then(lessonRepository).should(times(2)).save(any(Lesson.class));
    }

    @Test
    @DisplayName("Duration falls back to 60 minutes without duration or valid end")
    void resolveDuration_fallback() {
        WeeklyTemplate template = fixedTemplate(1L, "S1", null);
        template.setEndTime(null);

        assertThat(FixedLessonMaterializer.resolveDuration(template)).isEqualTo(Lesson.DEFAULT_DURATION_MINUTES);
    }
}
