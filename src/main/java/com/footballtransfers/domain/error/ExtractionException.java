package com.footballtransfers.domain.error;

/**
 * The page's structure was not recognized, so its layout has probably changed.
 * The page is quarantined instead of producing empty output.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message) {
        super(message);
    }
}
