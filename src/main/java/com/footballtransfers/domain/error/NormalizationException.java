package com.footballtransfers.domain.error;

/**
 * A single row failed a data-quality check. The row is dropped and counted.
 */
public class NormalizationException extends Exception {

    private final String label;
    private final String value;

    public NormalizationException(String label, String value, String message) {
        super(message + " [" + label + "='" + value + "']");
        this.label = label;
        this.value = value;
    }

    /** Column label of the offending cell. */
    public String getLabel() {
        return label;
    }

    public String getValue() {
        return value;
    }
}
