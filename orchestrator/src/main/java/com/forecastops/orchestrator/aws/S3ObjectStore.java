package com.forecastops.orchestrator.aws;

import com.forecastops.orchestrator.evaluation.ObjectStore;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.TaskException;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.InputStream;

@Component
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3;

    public S3ObjectStore(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public InputStream open(String bucket, String key) {
        String uri = "s3://" + bucket + "/" + key;
        try {
            return s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (NoSuchKeyException | NoSuchBucketException e) {
            throw new TaskException(ErrorKind.DATA_LOAD, uri + " does not exist", e);
        } catch (S3Exception e) {
            // 5xx from S3 is worth another attempt; 4xx (access denied etc.) is not.
            ErrorKind kind = e.statusCode() >= 500 ? ErrorKind.TRANSIENT : ErrorKind.DATA_LOAD;
            throw new TaskException(kind, "Could not read " + uri + ": " + e.getMessage(), e);
        } catch (SdkClientException e) {
            throw new TaskException(ErrorKind.TRANSIENT, "Could not reach S3 for " + uri + ": " + e.getMessage(), e);
        }
    }
}
