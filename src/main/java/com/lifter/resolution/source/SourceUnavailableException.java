package com.lifter.resolution.source;

/**
 * Runtime exception thrown when an external data source times out, refuses the
 * connection or answers with an unusable response. Verifiers turn it into an
 * INCONCLUSIVE outcome; it never aborts a row.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
