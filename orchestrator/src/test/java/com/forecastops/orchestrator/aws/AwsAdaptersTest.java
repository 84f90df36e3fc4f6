package com.forecastops.orchestrator.aws;

import com.forecastops.orchestrator.notification.Notification;
import com.forecastops.orchestrator.notification.NotificationTemplate;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.TaskException;
import com.forecastops.orchestrator.trigger.TriggerException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Error mapping of the AWS adapters. SDK clients are Mockito mocks.
 */
@ExtendWith(MockitoExtension.class)
class AwsAdaptersTest {

    @Mock S3Client  s3;
    @Mock SsmClient ssm;
    @Mock SnsClient sns;

    // ------------------------------------------------------------------
    // S3ObjectStore
    // ------------------------------------------------------------------

    @Test
    void s3_missingKey_dataLoad() {
        when(s3.getObject(any(GetObjectRequest.class)))
                .thenThrow((NoSuchKeyException) NoSuchKeyException.builder().message("gone").build());

        assertKind(() -> new S3ObjectStore(s3).open("b", "data/pred/2024-05-01/p.csv"), ErrorKind.DATA_LOAD);
    }

    @Test
    void s3_serverError_transient() {
        when(s3.getObject(any(GetObjectRequest.class)))
                .thenThrow((S3Exception) S3Exception.builder().statusCode(503).message("slow down").build());

        assertKind(() -> new S3ObjectStore(s3).open("b", "k"), ErrorKind.TRANSIENT);
    }

    @Test
    void s3_accessDenied_dataLoad() {
        when(s3.getObject(any(GetObjectRequest.class)))
                .thenThrow((S3Exception) S3Exception.builder().statusCode(403).message("denied").build());

        assertKind(() -> new S3ObjectStore(s3).open("b", "k"), ErrorKind.DATA_LOAD);
    }

    @Test
    void s3_unreachable_transient() {
        when(s3.getObject(any(GetObjectRequest.class))).thenThrow(SdkClientException.create("timeout"));

        assertKind(() -> new S3ObjectStore(s3).open("b", "k"), ErrorKind.TRANSIENT);
    }

    // ------------------------------------------------------------------
    // SsmThresholdSource
    // ------------------------------------------------------------------

    @Test
    void ssm_numericParameter_parsed() {
        when(ssm.getParameter(any(GetParameterRequest.class))).thenReturn(GetParameterResponse.builder()
                .parameter(Parameter.builder().name("rmse").value(" 50.5 ").build())
                .build());

        assertThat(new SsmThresholdSource(ssm).threshold("rmse")).isEqualTo(50.5);
    }

    @Test
    void ssm_nonNumericParameter_configurationError() {
        when(ssm.getParameter(any(GetParameterRequest.class))).thenReturn(GetParameterResponse.builder()
                .parameter(Parameter.builder().name("rmse").value("fifty").build())
                .build());

        assertThatThrownBy(() -> new SsmThresholdSource(ssm).threshold("rmse"))
                .isInstanceOf(TriggerException.class)
                .extracting(e -> ((TriggerException) e).getKind())
                .isEqualTo(TriggerException.Kind.CONFIGURATION);
    }

    @Test
    void ssm_unreachable_configurationError() {
        when(ssm.getParameter(any(GetParameterRequest.class))).thenThrow(SdkClientException.create("no route"));

        assertThatThrownBy(() -> new SsmThresholdSource(ssm).threshold("rmse"))
                .isInstanceOf(TriggerException.class)
                .hasMessageContaining("CONFIGURATION");
    }

    // ------------------------------------------------------------------
    // SnsNotificationChannel
    // ------------------------------------------------------------------

    @Test
    void sns_publishesSubjectAndBodyToTopic() {
        when(sns.publish(any(PublishRequest.class))).thenReturn(PublishResponse.builder().messageId("m-1").build());

        new SnsNotificationChannel(sns, "arn:aws:sns:us-east-1:123:reviewers")
                .publish(new Notification(NotificationTemplate.MODEL_ADEQUATE, "Daily", "All good"));

        ArgumentCaptor<PublishRequest> captor = ArgumentCaptor.forClass(PublishRequest.class);
        verify(sns).publish(captor.capture());
        assertThat(captor.getValue().topicArn()).isEqualTo("arn:aws:sns:us-east-1:123:reviewers");
        assertThat(captor.getValue().subject()).isEqualTo("Daily");
        assertThat(captor.getValue().message()).isEqualTo("All good");
    }

    @Test
    void sns_failure_notificationError() {
        when(sns.publish(any(PublishRequest.class))).thenThrow(SdkClientException.create("down"));

        assertKind(() -> new SnsNotificationChannel(sns, "arn:topic")
                        .publish(new Notification(NotificationTemplate.MODEL_ADEQUATE, "s", "b")),
                ErrorKind.NOTIFICATION);
    }

    private static void assertKind(Runnable call, ErrorKind kind) {
        assertThatThrownBy(call::run)
                .isInstanceOf(TaskException.class)
                .extracting(e -> ((TaskException) e).getKind())
                .isEqualTo(kind);
    }
}
