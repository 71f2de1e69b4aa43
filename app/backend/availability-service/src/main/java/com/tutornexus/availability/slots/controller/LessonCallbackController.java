package com.tutornexus.availability.slots.controller;

import com.tutornexus.availability.slots.service.SlotReopeningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Internal lesson callbacks. Called by the booking flow; not exposed through the gateway.
 */
@RestController
@RequestMapping("/api/internal/lessons")
@RequiredArgsConstructor
@Tag(name = "Internal - Lessons", description = "Lesson lifecycle callbacks (service to service)")
public class LessonCallbackController {

    private final SlotReopeningService slotReopeningService;

    @PostMapping("/{lessonId}/cancelled")
    @Operation(summary = "Lesson cancelled", description = "Releases the lesson from its slots and reopens slots left empty")
    public ResponseEntity<List<Long>> lessonCancelled(
            @Parameter(description = "Lesson ID") @PathVariable String lessonId
    ) {
        return ResponseEntity.ok(slotReopeningService.reopenForCancelledLesson(lessonId));
    }
}
