package com.tutornexus.availability.slots.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tutornexus.availability.common.messaging.SqsEventPoller;
import com.tutornexus.availability.common.util.ScheduleTimes;
import com.tutornexus.availability.slots.dto.SlotSyncRequest;
import com.tutornexus.availability.slots.dto.SlotSyncResult;
import com.tutornexus.availability.slots.service.SlotSyncService;
import com.tutornexus.shared.dto.sqs.SlotSyncRequestedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * slot-sync-requested-queue → slot sync run
 */
@Slf4j
@Component
public class SlotSyncRequestedListener extends SqsEventPoller<SlotSyncRequestedEvent> {

    private final SlotSyncService slotSyncService;

    @Value("${aws.sqs.endpoint:}")
    private String sqsEndpoint;

    @Value("${aws.region:il-central-1}")
    private String region;

    @Value("${aws.sqs.account-id:}")
    private String accountId;

    @Value("${sqs.slot-sync-requested-queue}")
    private String queueName;

    public SlotSyncRequestedListener(SqsAsyncClient sqsAsyncClient, ObjectMapper objectMapper,
                                     SlotSyncService slotSyncService) {
        super(sqsAsyncClient, objectMapper, SlotSyncRequestedEvent.class);
        this.slotSyncService = slotSyncService;
    }

    @Override
    protected void handle(SlotSyncRequestedEvent event) {
        log.info("Processing slot-sync request: startDate={}, daysAhead={}, teacherId={}",
                event.getStartDate(), event.getDaysAhead(), event.getTeacherId());

        LocalDate startDate = null;
        if (event.getStartDate() != null && !event.getStartDate().isBlank()) {
            try {
                startDate = LocalDate.parse(event.getStartDate(), ScheduleTimes.DATE_FORMATTER);
            } catch (DateTimeParseException e) {
                // will never parse, so drop the message instead of redelivering it
                log.warn("Ignoring slot-sync request with invalid startDate: {}", event.getStartDate());
                return;
            }
        }

        Integer daysAhead = event.getDaysAhead();
        if (daysAhead != null && (daysAhead < 0 || daysAhead > SlotSyncRequest.MAX_DAYS_AHEAD)) {
            log.warn("Ignoring slot-sync request with daysAhead out of range 0..{}: {}",
                    SlotSyncRequest.MAX_DAYS_AHEAD, daysAhead);
            return;
        }

        SlotSyncRequest request = SlotSyncRequest.builder()
                .startDate(startDate)
                .daysAhead(daysAhead)
                .teacherId(event.getTeacherId())
                .build();

        SlotSyncResult result = slotSyncService.run(request);
        if (result.hasErrors()) {
            log.warn("Slot sync finished with {} item errors", result.getErrors().size());
        }
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
