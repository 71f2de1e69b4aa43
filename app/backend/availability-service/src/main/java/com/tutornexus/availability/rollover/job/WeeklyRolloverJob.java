package com.tutornexus.availability.rollover.job;

import com.tutornexus.availability.common.config.RolloverProperties;
import com.tutornexus.availability.rollover.service.RolloverScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

@Slf4j
@Component
@RequiredArgsConstructor
public class WeeklyRolloverJob {

    private final RolloverScheduler rolloverScheduler;
    private final RolloverProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${rollover.cron:0 0 6 * * FRI}", zone = "${scheduling.zone:Asia/Jerusalem}")
    public void run() {
        if (!properties.isEnabled()) {
            log.debug("Weekly rollover disabled, skipping");
            return;
        }
        try {
            rolloverScheduler.performRollover(LocalDate.now(clock));
        } catch (RuntimeException e) {
            // next trigger retries; the sync itself is idempotent
            log.error("Weekly rollover failed", e);
        }
    }
}
