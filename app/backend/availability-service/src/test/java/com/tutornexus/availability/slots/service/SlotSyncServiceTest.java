package com.tutornexus.availability.slots.service;

import com.tutornexus.availability.common.config.SlotSyncProperties;
import com.tutornexus.availability.common.entity.SlotStatus;
import com.tutornexus.availability.common.entity.WeeklyTemplate;
import com.tutornexus.availability.slots.algorithm.DiffEngine;
import com.tutornexus.availability.slots.algorithm.InventoryOverlapDetector;
import com.tutornexus.availability.slots.algorithm.NaturalKey;
import com.tutornexus.availability.slots.algorithm.SlotSnapshot;
import com.tutornexus.availability.slots.algorithm.TemplateExpander;
import com.tutornexus.availability.slots.dto.SlotSyncRequest;
import com.tutornexus.availability.slots.dto.SlotSyncResult;
import com.tutornexus.availability.slots.dto.SyncError;
import com.tutornexus.availability.slots.dto.SyncErrorType;
import com.tutornexus.availability.slots.exception.SlotSyncException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

/**
 * SlotSyncService unit tests.
 * Real expander, diff and overlap detector against an in-memory gateway; only the opening guard is mocked.
 */
@ExtendWith(MockitoExtension.class)
class SlotSyncServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 27);

    @Mock
    private SlotOpeningGuard openingGuard;

    private InMemorySlotInventoryGateway gateway;
    private SlotSyncProperties properties;
    private SlotSyncService slotSyncService;

    @BeforeEach
    void setUp() {
        gateway = new InMemorySlotInventoryGateway();
        properties = new SlotSyncProperties();
        properties.setOpeningGuardEnabled(false);
        // Wednesday 2025-01-29 in Jerusalem
        Clock clock = Clock.fixed(Instant.parse("2025-01-29T08:00:00Z"), ZoneId.of("Asia/Jerusalem"));
        slotSyncService = new SlotSyncService(gateway, new TemplateExpander(), new DiffEngine(),
                new InventoryOverlapDetector(), openingGuard, properties, clock);
    }

    private static WeeklyTemplate template(Long id, int dayOfWeek, int startHour, int endHour) {
        return WeeklyTemplate.builder()
                .templateId(id)
                .teacherId("T1")
                .dayOfWeek(dayOfWeek)
                .startTime(LocalTime.of(startHour, 0))
                .endTime(LocalTime.of(endHour, 0))
                .type("individual")
                .build();
    }

    private static SlotSyncRequest request(int daysAhead) {
        return SlotSyncRequest.builder().startDate(MONDAY).daysAhead(daysAhead).build();
    }

    @Test
    @DisplayName("First run creates slots; second run with the same templates changes nothing")
    void run_idempotent() {
        // given
        gateway.addTemplate(template(1L, 1, 16, 17));
        gateway.addTemplate(template(2L, 3, 10, 11));

        // when
        SlotSyncResult first = slotSyncService.run(request(14));
        int writesAfterFirst = gateway.writeCount;
        SlotSyncResult second = slotSyncService.run(request(14));

        // then
        assertThat(first.getCreated()).isEqualTo(4);
        assertThat(first.getWindowStart()).isEqualTo(LocalDate.of(2025, 1, 26));
        assertThat(first.getWindowEnd()).isEqualTo(LocalDate.of(2025, 2, 9));
        assertThat(second.getCreated()).isZero();
        assertThat(second.getUpdated()).isZero();
        assertThat(second.getDeactivated()).isZero();
        assertThat(second.getErrors()).isEmpty();
        assertThat(gateway.writeCount).isEqualTo(writesAfterFirst);
        assertThat(gateway.slotByKey("T1|2025-01-27|16:00").getStatus()).isEqualTo(SlotStatus.OPEN);
    }

    @Test
    @DisplayName("Removed template - its slots become BLOCKED once, never deleted")
    void run_deactivatesOrphanedSlots() {
        // given
        gateway.addTemplate(template(1L, 1, 16, 17));
        slotSyncService.run(request(6));
        gateway.removeTemplate(1L);

        // when
        SlotSyncResult result = slotSyncService.run(request(6));
        SlotSyncResult again = slotSyncService.run(request(6));

        // then
        assertThat(result.getDeactivated()).isEqualTo(1);
        assertThat(gateway.allSlots()).hasSize(1);
        assertThat(gateway.slotByKey("T1|2025-01-27|16:00").getStatus()).isEqualTo(SlotStatus.BLOCKED);
        assertThat(again.getDeactivated()).isZero();
    }

    @Test
    @DisplayName("Changed end time updates an open slot but leaves a locked one alone")
    void run_updatesOnlyUnprotectedSlots() {
        // given
        gateway.addTemplate(template(1L, 1, 16, 18));
        gateway.addSlot(SlotSnapshot.builder()
                .naturalKey(NaturalKey.of("T1", MONDAY, LocalTime.of(16, 0)))
                .teacherId("T1").date(MONDAY)
                .startTime(LocalTime.of(16, 0)).endTime(LocalTime.of(17, 0))
                .status(SlotStatus.OPEN).createdFromTemplateId(1L)
                .build());
        gateway.addSlot(SlotSnapshot.builder()
                .naturalKey(NaturalKey.of("T1", MONDAY.plusDays(7), LocalTime.of(16, 0)))
                .teacherId("T1").date(MONDAY.plusDays(7))
                .startTime(LocalTime.of(16, 0)).endTime(LocalTime.of(17, 0))
                .status(SlotStatus.OPEN).createdFromTemplateId(1L).locked(true)
                .build());

        // when
        SlotSyncResult result = slotSyncService.run(request(14));

        // then
        assertThat(result.getUpdated()).isEqualTo(1);
        assertThat(result.getCreated()).isZero();
        assertThat(gateway.slotByKey("T1|2025-01-27|16:00").getEndTime()).isEqualTo(LocalTime.of(18, 0));
        assertThat(gateway.slotByKey("T1|2025-02-03|16:00").getEndTime()).isEqualTo(LocalTime.of(17, 0));
    }

    @Test
    @DisplayName("A failed create is recorded and the run continues")
    void run_continueOnError() {
        // given
        gateway.addTemplate(template(1L, 1, 16, 17));
        gateway.failingCreateKeys.add("T1|2025-01-27|16:00");

        // when
        SlotSyncResult result = slotSyncService.run(request(14));

        // then
        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.getErrors()).hasSize(1);
        SyncError error = result.getErrors().get(0);
        assertThat(error.getNaturalKey()).isEqualTo("T1|2025-01-27|16:00");
        assertThat(error.getType()).isEqualTo(SyncErrorType.APPLY_FAILED);
        assertThat(error.getMessage()).contains("write rejected");
    }

    @Test
    @DisplayName("A create that loses the race for its natural key is a no-op, not an error")
    void run_concurrentCreateIsNoOp() {
        // given
        gateway.addTemplate(template(1L, 1, 16, 17));
        gateway.racedCreateKeys.add("T1|2025-01-27|16:00");

        // when
        SlotSyncResult result = slotSyncService.run(request(6));

        // then
        assertThat(result.getCreated()).isZero();
        assertThat(result.getErrors()).isEmpty();
        assertThat(gateway.allSlots())
                .filteredOn(slot -> slot.getNaturalKey().equals("T1|2025-01-27|16:00"))
                .hasSize(1);
        assertThat(gateway.writeCount).isZero();
    }

    @Test
    @DisplayName("Inventory load failure aborts the run")
    void run_loadFailure() {
        gateway.addTemplate(template(1L, 1, 16, 17));
        gateway.failOnListInventory = true;

        assertThatThrownBy(() -> slotSyncService.run(request(14)))
                .isInstanceOf(SlotSyncException.class)
                .hasRootCauseMessage("inventory store unavailable");
        assertThat(gateway.allSlots()).isEmpty();
    }

    @Test
    @DisplayName("Confirmed lesson conflict - slot is not opened and a CONFLICT error names the lesson")
    void run_guardConfirmedConflict() {
        // given
        properties.setOpeningGuardEnabled(true);
        gateway.addTemplate(template(1L, 1, 10, 11));
        given(openingGuard.check(eq("T1"), eq(MONDAY), any(LocalTime.class), any(LocalTime.class), anySet()))
                .willReturn(SlotOpeningCheck.confirmedConflict(List.of("L1")));
        given(openingGuard.check(eq("T1"), eq(MONDAY.plusDays(7)), any(LocalTime.class), any(LocalTime.class), anySet()))
                .willReturn(SlotOpeningCheck.clear());

        // when
        SlotSyncResult result = slotSyncService.run(request(14));

        // then
        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0).getType()).isEqualTo(SyncErrorType.CONFLICT);
        assertThat(result.getErrors().get(0).getConflictingRecordIds()).containsExactly("L1");
        assertThat(gateway.findByNaturalKey("T1|2025-01-27|10:00")).isEmpty();
    }

    @Test
    @DisplayName("Unavailable check - slot still opens")
    void run_guardCheckUnavailable() {
        // given
        properties.setOpeningGuardEnabled(true);
        gateway.addTemplate(template(1L, 1, 10, 11));
        given(openingGuard.check(eq("T1"), any(LocalDate.class), any(LocalTime.class), any(LocalTime.class), anySet()))
                .willReturn(SlotOpeningCheck.checkUnavailable("timeout"));

        // when
        SlotSyncResult result = slotSyncService.run(request(6));

        // then
        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Guard disabled - no check is made")
    void run_guardDisabled() {
        gateway.addTemplate(template(1L, 1, 10, 11));

        slotSyncService.run(request(6));

        then(openingGuard).should(never()).check(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Defaults - today from the clock and the configured horizon")
    void run_defaults() {
        gateway.addTemplate(template(1L, 1, 10, 11));

        SlotSyncResult result = slotSyncService.run(null);

        assertThat(result.getWindowStart()).isEqualTo(LocalDate.of(2025, 1, 26));
        assertThat(result.getWindowEnd()).isEqualTo(LocalDate.of(2025, 2, 9));
        assertThat(result.getCreated()).isEqualTo(2);
    }

    @Test
    @DisplayName("Overlapping slots already in the inventory are counted, not changed")
    void run_reportsOverlaps() {
        gateway.addSlot(SlotSnapshot.builder()
                .naturalKey("T1|2025-01-27|10:00").teacherId("T1").date(MONDAY)
                .startTime(LocalTime.of(10, 0)).endTime(LocalTime.of(11, 0)).status(SlotStatus.OPEN)
                .build());
        gateway.addSlot(SlotSnapshot.builder()
                .naturalKey("T1|2025-01-27|10:30").teacherId("T1").date(MONDAY)
                .startTime(LocalTime.of(10, 30)).endTime(LocalTime.of(11, 30)).status(SlotStatus.OPEN)
                .build());

        SlotSyncResult result = slotSyncService.run(request(6));

        assertThat(result.getOverlapsDetected()).isEqualTo(1);
        assertThat(gateway.writeCount).isZero();
    }
}
