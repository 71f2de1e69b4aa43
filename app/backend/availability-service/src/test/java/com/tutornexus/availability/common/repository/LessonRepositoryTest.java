package com.tutornexus.availability.common.repository;

import com.tutornexus.availability.common.entity.Lesson;
import com.tutornexus.availability.common.entity.LessonStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("LessonRepository tests")
class LessonRepositoryTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 27);

    @Autowired
    private LessonRepository lessonRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Lesson lesson(String lessonId, int hour, LessonStatus status) {
        return Lesson.builder()
                .lessonId(lessonId)
                .teacherId("T1")
                .date(MONDAY)
                .startTime(LocalTime.of(hour, 0))
                .durationMinutes(60)
                .status(status)
                .build();
    }

    private void overwriteStatus(String lessonId, String rawStatus) {
        entityManager.getEntityManager()
                .createNativeQuery("UPDATE lessons SET status = :status WHERE lesson_id = :id")
                .setParameter("status", rawStatus)
                .setParameter("id", lessonId)
                .executeUpdate();
        entityManager.clear();
    }

    @Test
    @DisplayName("A lesson with an unrecognised stored status still loads and blocks time")
    void unknownStatusReadsAsScheduled() {
        // given
        lessonRepository.saveAndFlush(lesson("L1", 10, LessonStatus.SCHEDULED));
        lessonRepository.saveAndFlush(lesson("L2", 12, LessonStatus.SCHEDULED));
        overwriteStatus("L1", "rescheduled");

        // when
        List<Lesson> lessons = lessonRepository.findByTeacherIdAndDateBetweenOrderByDateAscStartTimeAsc(
                "T1", MONDAY, MONDAY);

        // then
        assertThat(lessons).extracting(Lesson::getLessonId).containsExactly("L1", "L2");
        assertThat(lessons.get(0).getStatus()).isEqualTo(LessonStatus.SCHEDULED);
        assertThat(lessons.get(0).getStatus().blocksTime()).isTrue();
    }

    @Test
    @DisplayName("English status codes read as the enum")
    void englishStatusCode() {
        lessonRepository.saveAndFlush(lesson("L1", 10, LessonStatus.SCHEDULED));
        overwriteStatus("L1", "pending_cancel");

        Lesson found = lessonRepository.findById("L1").orElseThrow();

        assertThat(found.getStatus()).isEqualTo(LessonStatus.PENDING_CANCEL);
        assertThat(found.getStatus().blocksTime()).isFalse();
    }

    @Test
    @DisplayName("Fixed-lesson lookup matches teacher, date and start time")
    void existsByTeacherDateAndStart() {
        lessonRepository.saveAndFlush(lesson("L1", 10, LessonStatus.SCHEDULED));

        assertThat(lessonRepository.existsByTeacherIdAndDateAndStartTime("T1", MONDAY, LocalTime.of(10, 0))).isTrue();
        assertThat(lessonRepository.existsByTeacherIdAndDateAndStartTime("T1", MONDAY, LocalTime.of(11, 0))).isFalse();
        assertThat(lessonRepository.existsByTeacherIdAndDateAndStartTime("T2", MONDAY, LocalTime.of(10, 0))).isFalse();
    }
}
