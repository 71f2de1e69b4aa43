package com.tutornexus.availability.common.repository;

import com.tutornexus.availability.common.entity.SlotInventory;
import com.tutornexus.availability.common.entity.SlotStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("SlotInventoryRepository tests")
class SlotInventoryRepositoryTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 27);

    @Autowired
    private SlotInventoryRepository slotInventoryRepository;

    @Autowired
    private TestEntityManager entityManager;

    private SlotInventory slot(String teacherId, LocalDate date, int hour, SlotStatus status, String... lessonIds) {
        return SlotInventory.builder()
                .naturalKey(teacherId + "|" + date + "|" + String.format("%02d:00", hour))
                .teacherId(teacherId)
                .date(date)
                .startTime(LocalTime.of(hour, 0))
                .endTime(LocalTime.of(hour + 1, 0))
                .status(status)
                .linkedLessonIds(new LinkedHashSet<>(List.of(lessonIds)))
                .build();
    }

    @Test
    @DisplayName("Status is stored as its Hebrew label and read back as the enum")
    void statusRoundTripsThroughConverter() {
        // given
        SlotInventory saved = slotInventoryRepository.saveAndFlush(slot("T1", MONDAY, 10, SlotStatus.BLOCKED));
        entityManager.clear();

        // when
        String stored = (String) entityManager.getEntityManager()
                .createNativeQuery("SELECT status FROM slot_inventory WHERE slot_id = :id")
                .setParameter("id", saved.getSlotId())
                .getSingleResult();
        SlotInventory found = slotInventoryRepository.findById(saved.getSlotId()).orElseThrow();

        // then
        assertThat(stored).isEqualTo(SlotStatus.BLOCKED.getStoredValue());
        assertThat(found.getStatus()).isEqualTo(SlotStatus.BLOCKED);
        assertThat(found.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Legacy English status values read as the enum")
    void legacyStatusValue() {
        SlotInventory saved = slotInventoryRepository.saveAndFlush(slot("T1", MONDAY, 10, SlotStatus.OPEN));
        entityManager.getEntityManager()
                .createNativeQuery("UPDATE slot_inventory SET status = 'booked' WHERE slot_id = :id")
                .setParameter("id", saved.getSlotId())
                .executeUpdate();
        entityManager.clear();

        assertThat(slotInventoryRepository.findById(saved.getSlotId()).orElseThrow().getStatus())
                .isEqualTo(SlotStatus.CLOSED);
    }

    @Test
    @DisplayName("Date range query is inclusive and ordered by date and start time")
    void findByDateBetween() {
        slotInventoryRepository.save(slot("T1", MONDAY.plusDays(7), 9, SlotStatus.OPEN));
        slotInventoryRepository.save(slot("T1", MONDAY, 12, SlotStatus.OPEN));
        slotInventoryRepository.save(slot("T1", MONDAY, 9, SlotStatus.OPEN));
        slotInventoryRepository.save(slot("T2", MONDAY, 9, SlotStatus.OPEN));
        slotInventoryRepository.save(slot("T1", MONDAY.plusDays(8), 9, SlotStatus.OPEN));
        slotInventoryRepository.flush();

        List<SlotInventory> all = slotInventoryRepository
                .findByDateBetweenOrderByDateAscStartTimeAscSlotIdAsc(MONDAY, MONDAY.plusDays(7));
        List<SlotInventory> teacher = slotInventoryRepository
                .findByTeacherIdAndDateBetweenOrderByDateAscStartTimeAscSlotIdAsc("T1", MONDAY, MONDAY.plusDays(7));

        assertThat(all).hasSize(4);
        assertThat(teacher).extracting(SlotInventory::getNaturalKey).containsExactly(
                "T1|2025-01-27|09:00", "T1|2025-01-27|12:00", "T1|2025-02-03|09:00");
    }

    @Test
    @DisplayName("Open slots of a day and slots linking a lesson")
    void findOpenAndLinked() {
        slotInventoryRepository.save(slot("T1", MONDAY, 9, SlotStatus.OPEN));
        slotInventoryRepository.save(slot("T1", MONDAY, 10, SlotStatus.CLOSED, "L1"));
        slotInventoryRepository.save(slot("T1", MONDAY, 11, SlotStatus.CLOSED, "L1", "L2"));
        slotInventoryRepository.flush();
        entityManager.clear();

        List<SlotInventory> open = slotInventoryRepository
                .findByTeacherIdAndDateAndStatusOrderByStartTimeAsc("T1", MONDAY, SlotStatus.OPEN);
        List<SlotInventory> linkingL1 = slotInventoryRepository.findLinkingLesson("L1");
        List<SlotInventory> linkingL2 = slotInventoryRepository.findLinkingLesson("L2");

        assertThat(open).extracting(SlotInventory::getStartTime).containsExactly(LocalTime.of(9, 0));
        assertThat(linkingL1).hasSize(2);
        assertThat(linkingL2).hasSize(1);
        assertThat(linkingL2.get(0).getLinkedLessonIds()).containsExactlyInAnyOrder("L1", "L2");
    }
}
