package com.forecastops.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where the historical (actual) and predicted series for one day live.
 * Both objects are in the same bucket.
 */
public record DatasetLocation(
        @JsonProperty("bucket")   String bucket,
        @JsonProperty("hist_key") String histKey,
        @JsonProperty("pred_key") String predKey
) {
    /** URI of the historical object, used as the retraining source data. */
    public String histUri() {
        return "s3://" + bucket + "/" + histKey;
    }
}
