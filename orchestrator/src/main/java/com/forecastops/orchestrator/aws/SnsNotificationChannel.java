package com.forecastops.orchestrator.aws;

import com.forecastops.orchestrator.notification.Notification;
import com.forecastops.orchestrator.notification.NotificationChannel;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.TaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

/**
 * Publishes reviewer notifications to a single SNS topic.
 */
@Component
public class SnsNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SnsNotificationChannel.class);

    private final SnsClient sns;
    private final String    topicArn;

    public SnsNotificationChannel(SnsClient sns,
                                  @Value("${retrain.notification.topic-arn}") String topicArn) {
        this.sns      = sns;
        this.topicArn = topicArn;
    }

    @Override
    public void publish(Notification notification) {
        try {
            PublishResponse resp = sns.publish(PublishRequest.builder()
                    .topicArn(topicArn)
                    .subject(notification.subject())
                    .message(notification.body())
                    .build());
            log.info("Published {} notification to {} (messageId={})",
                    notification.template(), topicArn, resp.messageId());
        } catch (SdkException e) {
            throw new TaskException(ErrorKind.NOTIFICATION,
                    "Publishing to " + topicArn + " failed: " + e.getMessage(), e);
        }
    }
}
