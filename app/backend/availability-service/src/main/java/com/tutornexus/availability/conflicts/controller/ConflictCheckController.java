package com.tutornexus.availability.conflicts.controller;

import com.tutornexus.availability.conflicts.dto.ConflictCheckRequest;
import com.tutornexus.availability.conflicts.dto.ConflictCheckResponse;
import com.tutornexus.availability.conflicts.service.ConflictCheckResult;
import com.tutornexus.availability.conflicts.service.ConflictDetector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conflicts")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Conflicts", description = "Booking overlap checks")
public class ConflictCheckController {

    private final ConflictDetector conflictDetector;

    @PostMapping("/check")
    @Operation(summary = "Check a proposed lesson or slot",
            description = "Returns lessons and open slots of the same teacher and day that overlap the proposed range. "
                    + "Touching ranges are not conflicts.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Check completed"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "503", description = "Candidates could not be loaded")
    })
    public ResponseEntity<ConflictCheckResponse> checkConflicts(@Valid @RequestBody ConflictCheckRequest request) {
        log.info("POST /api/conflicts/check - entity={}, teacherId={}, date={}, {}~{}",
                request.getEntity(), request.getTeacherId(), request.getDate(), request.getStart(), request.getEnd());

        ConflictCheckResult result = conflictDetector.check(request.toQuery());
        if (result.hasConflicts()) {
            log.info("Conflicts found: {}", ConflictDetector.buildConflictSummary(result.getConflicts()));
        }
        return ResponseEntity.ok(ConflictCheckResponse.from(result));
    }
}
