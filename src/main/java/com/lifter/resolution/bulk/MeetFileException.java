package com.lifter.resolution.bulk;

/**
 * Thrown when a meet results file cannot be read at all: I/O failure, missing header or
 * missing lifter column. Problems confined to one row never raise this.
 */
public class MeetFileException extends RuntimeException {

    public MeetFileException(String message) {
        super(message);
    }

    public MeetFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
