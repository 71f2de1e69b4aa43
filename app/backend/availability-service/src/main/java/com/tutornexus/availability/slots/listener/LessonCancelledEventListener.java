package com.tutornexus.availability.slots.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tutornexus.availability.common.messaging.SqsEventPoller;
import com.tutornexus.availability.slots.service.SlotReopeningService;
import com.tutornexus.shared.dto.sqs.LessonCancelledEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.util.List;

/**
 * lesson-cancelled-queue → release the slots held by the lesson
 */
@Slf4j
@Component
public class LessonCancelledEventListener extends SqsEventPoller<LessonCancelledEvent> {

    private final SlotReopeningService slotReopeningService;

    @Value("${aws.sqs.endpoint:}")
    private String sqsEndpoint;

    @Value("${aws.region:il-central-1}")
    private String region;

    @Value("${aws.sqs.account-id:}")
    private String accountId;

    @Value("${sqs.lesson-cancelled-queue}")
    private String queueName;

    public LessonCancelledEventListener(SqsAsyncClient sqsAsyncClient, ObjectMapper objectMapper,
                                        SlotReopeningService slotReopeningService) {
        super(sqsAsyncClient, objectMapper, LessonCancelledEvent.class);
        this.slotReopeningService = slotReopeningService;
    }

    @Override
    protected void handle(LessonCancelledEvent event) {
        if (event.getLessonId() == null || event.getLessonId().isBlank()) {
            log.warn("Ignoring lesson-cancelled event without lessonId: teacherId={}", event.getTeacherId());
            return;
        }
        log.info("Processing lesson-cancelled event: lessonId={}, teacherId={}, cancelledAt={}",
                event.getLessonId(), event.getTeacherId(), event.getCancelledAt());
        List<Long> reopened = slotReopeningService.reopenForCancelledLesson(event.getLessonId());
        log.info("Lesson-cancelled event processed: lessonId={}, reopenedSlots={}", event.getLessonId(), reopened);
    }

    @Override
    protected String getQueueName() {
        return queueName;
    }

    @Override
    protected String getSqsEndpoint() {
        return sqsEndpoint;
    }

    @Override
    protected String getRegion() {
        return region;
    }

    @Override
    protected String getAccountId() {
        return accountId;
    }
}
