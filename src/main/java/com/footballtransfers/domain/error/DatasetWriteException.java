package com.footballtransfers.domain.error;

/**
 * A season's dataset file could not be committed. No partial file is left behind.
 */
public class DatasetWriteException extends Exception {

    public DatasetWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
