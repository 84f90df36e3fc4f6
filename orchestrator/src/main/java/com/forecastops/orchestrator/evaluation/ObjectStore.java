package com.forecastops.orchestrator.evaluation;

import java.io.InputStream;

/**
 * Read access to the bucket holding the daily actual and predicted series.
 */
public interface ObjectStore {

    /**
     * Open an object for reading. The caller closes the stream.
     *
     * @throws com.forecastops.orchestrator.task.TaskException DATA_LOAD if the
     *         object does not exist or access is denied, TRANSIENT on I/O errors
     */
    InputStream open(String bucket, String key);
}
