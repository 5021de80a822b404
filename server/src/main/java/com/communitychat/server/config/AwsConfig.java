package com.communitychat.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * AWS clients. Only loaded when admin notifications are mirrored to SQS; credentials come from the
 * default provider chain.
 */
@Configuration
@ConditionalOnProperty(name = "chat.notifications.sqs.enabled", havingValue = "true")
public class AwsConfig {

    @Bean(destroyMethod = "close")
    public SqsClient sqsClient(@Value("${aws.region:us-west-2}") String region) {
        return SqsClient.builder()
                .region(Region.of(region))
                .build();
    }
}
