package com.tutornexus.availability.common.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls one SQS queue every 5 seconds and hands each parsed message to {@link #handle(Object)}.
 *
 * Messages are deleted after successful handling and after a parse failure (a malformed body
 * will never parse). Any other failure leaves the message for redelivery after the visibility timeout.
 */
@Slf4j
public abstract class SqsEventPoller<T> {

    private final SqsAsyncClient sqsAsyncClient;
    private final ObjectMapper objectMapper;
    private final Class<T> eventType;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    protected SqsEventPoller(SqsAsyncClient sqsAsyncClient, ObjectMapper objectMapper, Class<T> eventType) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.objectMapper = objectMapper;
        this.eventType = eventType;
    }

    protected abstract String getQueueName();

    protected abstract String getSqsEndpoint();

    protected abstract String getRegion();

    /**
     * Account that owns the queue. Blank means the URL is looked up with GetQueueUrl.
     */
    protected abstract String getAccountId();

    protected abstract void handle(T event);

    @PostConstruct
    public void startListening() {
        String queueUrl = getQueueUrl();
        log.info("Starting {} listener: queueUrl={}", eventType.getSimpleName(), queueUrl);

        scheduler = Executors.newSingleThreadScheduledExecutor();
        running = true;

        scheduler.scheduleWithFixedDelay(() -> {
            if (running) {
                pollMessages(queueUrl);
            }
        }, 0, 5, TimeUnit.SECONDS);
    }

    @PreDestroy
    public void stopListening() {
        log.info("Stopping {} listener", eventType.getSimpleName());
        running = false;

        if (scheduler != null && !scheduler.isShutdown()) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void pollMessages(String queueUrl) {
        ReceiveMessageRequest receiveRequest = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(10)
                .waitTimeSeconds(10) // long polling
                .build();

        sqsAsyncClient.receiveMessage(receiveRequest)
                .thenAccept(response -> {
                    List<Message> messages = response.messages();
                    if (!messages.isEmpty()) {
                        log.info("Received {} messages from {}", messages.size(), getQueueName());
                        messages.forEach(message -> processMessage(queueUrl, message));
                    }
                })
                .exceptionally(throwable -> {
                    log.error("Failed to receive messages from {}", getQueueName(), throwable);
                    return null;
                });
    }

    void processMessage(String queueUrl, Message message) {
        try {
            T event = objectMapper.readValue(message.body(), eventType);
            handle(event);
            deleteMessage(queueUrl, message.receiptHandle());
        } catch (JsonProcessingException e) {
            log.error("Failed to parse message: {}", message.body(), e);
            deleteMessage(queueUrl, message.receiptHandle());
        } catch (Exception e) {
            // left on the queue, retried after the visibility timeout
            log.error("Failed to process message: {}", message.body(), e);
        }
    }

    private void deleteMessage(String queueUrl, String receiptHandle) {
        DeleteMessageRequest deleteRequest = DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(receiptHandle)
                .build();

        sqsAsyncClient.deleteMessage(deleteRequest)
                .thenAccept(response -> log.debug("Message deleted from {}", getQueueName()))
                .exceptionally(throwable -> {
                    log.error("Failed to delete message from {}", getQueueName(), throwable);
                    return null;
                });
    }

    String getQueueUrl() {
        String accountId = getAccountId();
        if (accountId == null || accountId.isBlank()) {
            return sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(getQueueName()).build())
                    .join()
                    .queueUrl();
        }
        // LocalStack: http://localhost:4566/000000000000/queue-name
        String endpoint = getSqsEndpoint();
        if (endpoint != null && !endpoint.isEmpty()) {
            return String.format("%s/%s/%s", endpoint, accountId, getQueueName());
        }
        return String.format("https://sqs.%s.amazonaws.com/%s/%s", getRegion(), accountId, getQueueName());
    }
}
