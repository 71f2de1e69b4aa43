package com.tutornexus.availability.slots.controller;

import com.tutornexus.availability.slots.dto.SlotSyncRequest;
import com.tutornexus.availability.slots.dto.SlotSyncResult;
import com.tutornexus.availability.slots.service.SlotSyncService;
import io.swagger.v3.oas.annotations.Operation;
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
@RequestMapping("/api/slots")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Slots", description = "Slot inventory sync")
public class SlotSyncController {

    private final SlotSyncService slotSyncService;

    @PostMapping("/sync")
    @Operation(summary = "Sync slot inventory from weekly templates",
            description = "Creates missing slots, updates drifted ones and blocks slots whose template is gone. "
                    + "Locked, booked and blocked slots are never touched.")
    public ResponseEntity<SlotSyncResult> sync(@Valid @RequestBody(required = false) SlotSyncRequest request) {
        log.info("POST /api/slots/sync - {}", request);
        return ResponseEntity.ok(slotSyncService.run(request));
    }
}
