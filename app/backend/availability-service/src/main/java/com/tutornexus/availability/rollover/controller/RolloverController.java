package com.tutornexus.availability.rollover.controller;

import com.tutornexus.availability.rollover.dto.OpenWeeks;
import com.tutornexus.availability.rollover.dto.RolloverResult;
import com.tutornexus.availability.rollover.service.RolloverScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/rollover")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Rollover", description = "Two-week booking window")
public class RolloverController {

    private final RolloverScheduler rolloverScheduler;
    private final Clock clock;

    @GetMapping("/open-weeks")
    @Operation(summary = "Currently bookable weeks")
    public ResponseEntity<OpenWeeks> getOpenWeeks(
            @Parameter(description = "Reference date (defaults to today)", example = "2025-01-29")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(rolloverScheduler.currentOpenWeeks(date != null ? date : LocalDate.now(clock)));
    }

    @PostMapping
    @Operation(summary = "Run the weekly rollover", description = "dryRun=true reports what would change without writing")
    public ResponseEntity<RolloverResult> rollover(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "false") boolean dryRun
    ) {
        LocalDate referenceDate = date != null ? date : LocalDate.now(clock);
        log.info("POST /api/rollover - date={}, dryRun={}", referenceDate, dryRun);
        RolloverResult result = dryRun
                ? rolloverScheduler.planRollover(referenceDate)
                : rolloverScheduler.performRollover(referenceDate);
        return ResponseEntity.ok(result);
    }
}
