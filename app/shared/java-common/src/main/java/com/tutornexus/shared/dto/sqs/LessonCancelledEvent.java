package com.tutornexus.shared.dto.sqs;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Published when a lesson is cancelled, so any slot holding it can be released.
 *
 * Queue: lesson-cancelled-queue
 * Publisher: lesson booking flow
 * Consumer: Availability-Service (LessonCancelledEventListener)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LessonCancelledEvent {

    /**
     * ID of the cancelled lesson
     */
    private String lessonId;

    /**
     * Teacher of the lesson (informational, the lookup is by lessonId only)
     */
    private String teacherId;

    /**
     * ISO-8601 timestamp of the cancellation
     */
    private String cancelledAt;
}
