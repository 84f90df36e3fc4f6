package com.forecastops.orchestrator.training;

import com.forecastops.orchestrator.task.CandidateSelector;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.TaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sagemaker.SageMakerClient;
import software.amazon.awssdk.services.sagemaker.model.AutoMLCandidate;
import software.amazon.awssdk.services.sagemaker.model.ContainerDefinition;
import software.amazon.awssdk.services.sagemaker.model.CreateModelRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeAutoMlJobV2Request;
import software.amazon.awssdk.services.sagemaker.model.DescribeAutoMlJobV2Response;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the best candidate of a completed AutoML job and registers it as a
 * SageMaker model named after the candidate.
 */
@Component
public class SageMakerCandidateSelector implements CandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(SageMakerCandidateSelector.class);

    private final SageMakerClient sageMaker;
    private final String roleArn;

    public SageMakerCandidateSelector(SageMakerClient sageMaker,
                                      @Value("${retrain.training.role-arn:}") String roleArn) {
        this.sageMaker = sageMaker;
        this.roleArn   = roleArn;
    }

    @Override
    public Candidate select(String jobId) {
        DescribeAutoMlJobV2Response description;
        try {
            description = sageMaker.describeAutoMLJobV2(DescribeAutoMlJobV2Request.builder()
                    .autoMLJobName(jobId)
                    .build());
        } catch (SdkException e) {
            ErrorKind kind = SageMakerTrainingJobManager.isTransient(e) ? ErrorKind.TRANSIENT : ErrorKind.QUERY;
            throw new TaskException(kind, "Could not describe " + jobId + ": " + e.getMessage(), e);
        }

        AutoMLCandidate best = description.bestCandidate();
        if (best == null || best.candidateName() == null
                || best.finalAutoMLJobObjectiveMetric() == null
                || best.finalAutoMLJobObjectiveMetric().value() == null) {
            throw new TaskException(ErrorKind.NO_CANDIDATE, "Job " + jobId + " completed without a usable candidate");
        }
        if (!best.hasInferenceContainers() || best.inferenceContainers().isEmpty()) {
            throw new TaskException(ErrorKind.NO_CANDIDATE,
                    "Candidate " + best.candidateName() + " of " + jobId + " has no inference containers");
        }

        register(best);
        return new Candidate(best.candidateName(), best.finalAutoMLJobObjectiveMetric().value());
    }

    private void register(AutoMLCandidate best) {
        List<ContainerDefinition> containers = best.inferenceContainers().stream()
                .map(c -> ContainerDefinition.builder()
                        .image(c.image())
                        .modelDataUrl(c.modelDataUrl())
                        .environment(c.environment())
                        .build())
                .collect(Collectors.toList());
        CreateModelRequest request = CreateModelRequest.builder()
                .modelName(best.candidateName())
                .executionRoleArn(roleArn)
                .containers(containers)
                .build();
        try {
            sageMaker.createModel(request);
        } catch (SdkException e) {
            if (alreadyExists(e)) {
                // Registered by an earlier attempt of this same task.
                log.info("Model {} already registered", best.candidateName());
                return;
            }
            ErrorKind kind = SageMakerTrainingJobManager.isTransient(e) ? ErrorKind.TRANSIENT : ErrorKind.REGISTRATION;
            throw new TaskException(kind, "Could not register " + best.candidateName() + ": " + e.getMessage(), e);
        }
    }

    /** SageMaker reports a duplicate model name as a validation error. */
    private static boolean alreadyExists(SdkException e) {
        return e.getMessage() != null && e.getMessage().contains("already existing model");
    }
}
