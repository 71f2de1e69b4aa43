package com.tutornexus.availability.rollover.service;

import com.tutornexus.availability.common.util.ScheduleTimes;
import com.tutornexus.availability.rollover.dto.OpenWeeks;
import com.tutornexus.availability.rollover.dto.RolloverResult;
import com.tutornexus.availability.slots.dto.SlotSyncRequest;
import com.tutornexus.availability.slots.dto.SlotSyncResult;
import com.tutornexus.availability.slots.service.SlotSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Keeps exactly two weeks bookable.
 *
 * A rollover closes the current week (its slots stay as they are, only the window moves)
 * and opens the week after next: slots from templates plus fixed lessons.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RolloverScheduler {

    static final int OPENED_WEEK_DAYS_AHEAD = 6;

    private final SlotSyncService slotSyncService;
    private final FixedLessonMaterializer fixedLessonMaterializer;

    public OpenWeeks currentOpenWeeks(LocalDate referenceDate) {
        if (referenceDate == null) {
            throw new IllegalArgumentException("referenceDate is required");
        }
        LocalDate currentWeek = ScheduleTimes.weekStart(referenceDate);
        return new OpenWeeks(currentWeek, currentWeek.plusWeeks(1));
    }

    public RolloverResult performRollover(LocalDate referenceDate) {
        OpenWeeks openWeeks = currentOpenWeeks(referenceDate);
        LocalDate closedWeek = openWeeks.getCurrentWeek();
        LocalDate openedWeek = openWeeks.getFollowingWeek();

        log.info("Rollover started - closing week {}, opening week {}", closedWeek, openedWeek);

        SlotSyncResult slotResult = slotSyncService.run(SlotSyncRequest.builder()
                .startDate(openedWeek)
                .daysAhead(OPENED_WEEK_DAYS_AHEAD)
                .build());
        FixedLessonResult fixedLessons = fixedLessonMaterializer.materialize(openedWeek);

        log.info("Rollover finished - closed={}, opened={}, slotsCreated={}, fixedLessonsCreated={}, errors={}",
                closedWeek, openedWeek, slotResult.getCreated(), fixedLessons.getCreated(),
                slotResult.getErrors().size());

        return RolloverResult.builder()
                .closedWeek(closedWeek)
                .openedWeek(openedWeek)
                .dryRun(false)
                .slotResult(slotResult)
                .fixedLessonsCreated(fixedLessons.getCreated())
                .fixedLessonsSkipped(fixedLessons.getSkipped())
                .build();
    }

    /**
     * What {@link #performRollover(LocalDate)} would do, without writing anything
     */
    public RolloverResult planRollover(LocalDate referenceDate) {
        OpenWeeks openWeeks = currentOpenWeeks(referenceDate);
        int pendingFixedLessons = fixedLessonMaterializer.countPending(openWeeks.getFollowingWeek());

        log.info("Rollover dry run - would close {}, open {}, fixedLessons={}",
                openWeeks.getCurrentWeek(), openWeeks.getFollowingWeek(), pendingFixedLessons);

        return RolloverResult.builder()
                .closedWeek(openWeeks.getCurrentWeek())
                .openedWeek(openWeeks.getFollowingWeek())
                .dryRun(true)
                .fixedLessonsCreated(pendingFixedLessons)
                .build();
    }
}
