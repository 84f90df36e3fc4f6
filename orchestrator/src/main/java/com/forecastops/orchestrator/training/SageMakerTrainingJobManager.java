package com.forecastops.orchestrator.training;

import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.JobStatus;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.TaskException;
import com.forecastops.orchestrator.task.TrainingJobManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sagemaker.SageMakerClient;
import software.amazon.awssdk.services.sagemaker.model.AutoMLDataSource;
import software.amazon.awssdk.services.sagemaker.model.AutoMLJobChannel;
import software.amazon.awssdk.services.sagemaker.model.AutoMLJobCompletionCriteria;
import software.amazon.awssdk.services.sagemaker.model.AutoMLJobObjective;
import software.amazon.awssdk.services.sagemaker.model.AutoMLOutputDataConfig;
import software.amazon.awssdk.services.sagemaker.model.AutoMLProblemTypeConfig;
import software.amazon.awssdk.services.sagemaker.model.AutoMLS3DataSource;
import software.amazon.awssdk.services.sagemaker.model.CreateAutoMlJobV2Request;
import software.amazon.awssdk.services.sagemaker.model.DescribeAutoMlJobV2Request;
import software.amazon.awssdk.services.sagemaker.model.DescribeAutoMlJobV2Response;
import software.amazon.awssdk.services.sagemaker.model.StopAutoMlJobRequest;
import software.amazon.awssdk.services.sagemaker.model.TimeSeriesConfig;
import software.amazon.awssdk.services.sagemaker.model.TimeSeriesForecastingJobConfig;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Submits time-series AutoML jobs to SageMaker and maps their status onto
 * {@link JobStatus}.
 */
@Component
public class SageMakerTrainingJobManager implements TrainingJobManager {

    private static final Logger log = LoggerFactory.getLogger(SageMakerTrainingJobManager.class);

    private static final DateTimeFormatter JOB_SUFFIX =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private static final Set<String> THROTTLING_CODES = Set.of("ThrottlingException", "Throttling");

    // Forecast shape and column names of the daily solar series.
    static final String       FORECAST_FREQUENCY  = "15min";
    static final int          FORECAST_HORIZON    = 96;
    static final List<String> FORECAST_QUANTILES  = List.of("p50");
    static final String       ID_ATTRIBUTE        = "id";
    static final String       TIMESTAMP_ATTRIBUTE = "timestamp";
    static final String       TARGET_ATTRIBUTE    = "actual_power";

    private final SageMakerClient sageMaker;
    private final String outputPrefix;
    private final int    maxCandidates;
    private final String roleArn;

    public SageMakerTrainingJobManager(SageMakerClient sageMaker,
                                       @Value("${retrain.training.output-prefix:autopilot/train_output}") String outputPrefix,
                                       @Value("${retrain.training.max-candidates:1}") int maxCandidates,
                                       @Value("${retrain.training.role-arn:}") String roleArn) {
        this.sageMaker     = sageMaker;
        this.outputPrefix  = outputPrefix;
        this.maxCandidates = maxCandidates;
        this.roleArn       = roleArn;
    }

    @Override
    public String start(ExecutionContext ctx) {
        String jobName = jobName(Instant.now(), UUID.randomUUID().toString().substring(0, 4));
        String bucket  = ctx.datasetLocation().bucket();

        CreateAutoMlJobV2Request request = CreateAutoMlJobV2Request.builder()
                .autoMLJobName(jobName)
                .autoMLJobInputDataConfig(AutoMLJobChannel.builder()
                        .channelType("training")
                        .contentType("text/csv;header=present")
                        .compressionType("None")
                        .dataSource(AutoMLDataSource.builder()
                                .s3DataSource(AutoMLS3DataSource.builder()
                                        .s3DataType("S3Prefix")
                                        .s3Uri(ctx.datasetLocation().histUri())
                                        .build())
                                .build())
                        .build())
                .outputDataConfig(AutoMLOutputDataConfig.builder()
                        .s3OutputPath("s3://" + bucket + "/" + outputPrefix)
                        .build())
                .autoMLProblemTypeConfig(AutoMLProblemTypeConfig.builder()
                        .timeSeriesForecastingJobConfig(TimeSeriesForecastingJobConfig.builder()
                                .forecastFrequency(FORECAST_FREQUENCY)
                                .forecastHorizon(FORECAST_HORIZON)
                                .forecastQuantiles(FORECAST_QUANTILES)
                                .completionCriteria(AutoMLJobCompletionCriteria.builder()
                                        .maxCandidates(maxCandidates)
                                        .build())
                                .timeSeriesConfig(TimeSeriesConfig.builder()
                                        .targetAttributeName(TARGET_ATTRIBUTE)
                                        .timestampAttributeName(TIMESTAMP_ATTRIBUTE)
                                        .itemIdentifierAttributeName(ID_ATTRIBUTE)
                                        .build())
                                .build())
                        .build())
                .autoMLJobObjective(AutoMLJobObjective.builder()
                        .metricName(ctx.metric().name())
                        .build())
                .roleArn(roleArn)
                .build();
        try {
            sageMaker.createAutoMLJobV2(request);
        } catch (SdkException e) {
            throw new TaskException(ErrorKind.SUBMISSION,
                    "Training job " + jobName + " was not accepted: " + e.getMessage(), e);
        }
        return jobName;
    }

    @Override
    public JobStatus poll(String jobId) {
        DescribeAutoMlJobV2Response description;
        try {
            description = sageMaker.describeAutoMLJobV2(DescribeAutoMlJobV2Request.builder()
                    .autoMLJobName(jobId)
                    .build());
        } catch (SdkException e) {
            throw new TaskException(ErrorKind.QUERY, "Could not read status of " + jobId + ": " + e.getMessage(), e);
        }
        String external = description.autoMLJobStatusAsString();
        JobStatus status = mapStatus(external);
        if (status == JobStatus.FAILED && description.failureReason() != null) {
            log.warn("Training job {} failed: {}", jobId, description.failureReason());
        }
        log.info("Training job {} is {} ({})", jobId, status.wireName(), external);
        return status;
    }

    @Override
    public void stop(String jobId) {
        try {
            sageMaker.stopAutoMLJob(StopAutoMlJobRequest.builder().autoMLJobName(jobId).build());
        } catch (SdkException e) {
            throw new TaskException(isTransient(e) ? ErrorKind.TRANSIENT : ErrorKind.QUERY,
                    "Could not stop " + jobId + ": " + e.getMessage(), e);
        }
    }

    /** {@code ts-<yyyyMMdd-HHmmss UTC>-<suffix>}; the suffix keeps same-second submissions apart. */
    static String jobName(Instant now, String suffix) {
        return "ts-" + JOB_SUFFIX.format(now) + "-" + suffix;
    }

    /**
     * SageMaker job status → workflow status. Stopping is treated as
     * Stopped: the job will not produce a candidate either way. Anything
     * unrecognised counts as still running so the workflow keeps polling.
     */
    static JobStatus mapStatus(String external) {
        if (external == null) {
            return JobStatus.IN_PROGRESS;
        }
        return switch (external) {
            case "Pending", "Submitted" -> JobStatus.SUBMITTED;
            case "InProgress"           -> JobStatus.IN_PROGRESS;
            case "Completed"            -> JobStatus.COMPLETED;
            case "Failed"               -> JobStatus.FAILED;
            case "Stopping", "Stopped"  -> JobStatus.STOPPED;
            default -> {
                log.warn("Unknown training job status '{}', treating as InProgress", external);
                yield JobStatus.IN_PROGRESS;
            }
        };
    }

    /** Network failures, throttling and 5xx are worth another attempt. */
    static boolean isTransient(SdkException e) {
        if (e instanceof SdkClientException) {
            return true;
        }
        if (e instanceof AwsServiceException ase) {
            if (ase.statusCode() == 429 || ase.statusCode() >= 500) {
                return true;
            }
            return ase.awsErrorDetails() != null && THROTTLING_CODES.contains(ase.awsErrorDetails().errorCode());
        }
        return false;
    }
}
