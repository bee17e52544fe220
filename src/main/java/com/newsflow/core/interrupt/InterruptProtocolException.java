package com.newsflow.core.interrupt;

import com.newsflow.core.graph.GraphException;

/**
 * Misuse of the suspend/resume protocol: resuming a run with nothing awaiting,
 * or a decision without the required fields. The run is left untouched.
 */
public class InterruptProtocolException extends GraphException {

    public InterruptProtocolException(String message) {
        super(message);
    }
}
