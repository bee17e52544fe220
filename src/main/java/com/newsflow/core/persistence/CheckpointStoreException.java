package com.newsflow.core.persistence;

import com.newsflow.core.graph.GraphException;

/**
 * A checkpoint could not be written or read. Fatal to the run: the superstep that
 * failed to persist is not committed.
 */
public class CheckpointStoreException extends GraphException {

    public CheckpointStoreException(String message) {
        super(message);
    }

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
