package com.communitychat.server.notification;

import com.communitychat.server.model.AdminNotification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes admin notifications to an SQS queue so out-of-process consumers (email, dashboards) can
 * pick them up.
 *
 * <p>Only created when {@code chat.notifications.sqs.enabled=true}. If the queue URL cannot be resolved
 * at startup the publisher stays disabled and notifications remain in the database only.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "chat.notifications.sqs.enabled", havingValue = "true")
public class SqsNotificationPublisher implements NotificationPublisher {

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final String queueName;

    private volatile String queueUrl;

    private final AtomicLong notificationsPublished = new AtomicLong(0);
    private final AtomicLong publishFailures = new AtomicLong(0);

    public SqsNotificationPublisher(SqsClient sqsClient, ObjectMapper objectMapper,
                                    @Value("${chat.notifications.sqs.queue-name:community-chat-admin-notifications}")
                                    String queueName) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.queueName = queueName;
    }

    @PostConstruct
    public void init() {
        try {
            queueUrl = sqsClient.getQueueUrl(builder -> builder.queueName(queueName)).queueUrl();
            log.info("Admin notification queue initialized: {}", queueUrl);
        } catch (SdkException e) {
            log.error("Failed to resolve admin notification queue {}: {}. SQS publishing disabled.",
                    queueName, e.getMessage());
        }
    }

    @Override
    public void publish(AdminNotification notification) {
        if (queueUrl == null) {
            return;
        }
        try {
            String body = objectMapper.writeValueAsString(notification);
            SendMessageRequest request = SendMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .messageBody(body)
                    .messageAttributes(Map.of("notificationType", MessageAttributeValue.builder()
                            .dataType("String")
                            .stringValue(notification.getType())
                            .build()))
                    .build();
            sqsClient.sendMessage(request);
            notificationsPublished.incrementAndGet();
        } catch (JsonProcessingException | SdkException e) {
            publishFailures.incrementAndGet();
            log.error("Failed to publish admin notification {} to SQS: {}", notification.getId(), e.getMessage());
        }
    }

    public long getNotificationsPublished() {
        return notificationsPublished.get();
    }

    public long getPublishFailures() {
        return publishFailures.get();
    }
}
