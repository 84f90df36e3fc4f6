package com.forecastops.orchestrator.trigger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * The subset of an S3 event notification the trigger needs:
 * <pre>
 *   {"Records":[{"s3":{"bucket":{"name":"..."},"object":{"key":"..."}}}]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectCreatedNotification(@JsonProperty("Records") List<EventRecord> records) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventRecord(@JsonProperty("s3") S3 s3) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record S3(@JsonProperty("bucket") Bucket bucket, @JsonProperty("object") S3Object object) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Bucket(@JsonProperty("name") String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record S3Object(@JsonProperty("key") String key) {}

    /**
     * The first record as a trigger event. Object keys arrive URL-encoded
     * (spaces as '+'), so they are decoded here.
     *
     * @throws TriggerException INPUT if the envelope has no usable record
     */
    public TriggerEvent firstEvent() {
        if (records == null || records.isEmpty()) {
            throw new TriggerException(TriggerException.Kind.INPUT, "Event notification has no records");
        }
        S3 s3 = records.get(0).s3();
        if (s3 == null || s3.bucket() == null || s3.object() == null) {
            throw new TriggerException(TriggerException.Kind.INPUT, "Event record has no s3 bucket/object");
        }
        String key = s3.object().key() == null
                ? null
                : URLDecoder.decode(s3.object().key(), StandardCharsets.UTF_8);
        return new TriggerEvent(s3.bucket().name(), key);
    }
}
