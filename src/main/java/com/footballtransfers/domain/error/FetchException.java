package com.footballtransfers.domain.error;

import java.io.IOException;

/**
 * A page could not be retrieved.
 */
public class FetchException extends IOException {

    public enum Kind {
        /** Timeout, 5xx or truncated body; worth retrying. */
        TRANSIENT,
        /** 4xx other than 429; retrying cannot help. */
        TERMINAL,
        /** 429 or equivalent; the host asked us to back off. */
        RATE_LIMITED,
        /** The run was cancelled before the request was issued. */
        CANCELLED
    }

    private final Kind kind;
    private final int statusCode;
    private final String url;

    public FetchException(Kind kind, int statusCode, String url, String message) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
        this.url = url;
    }

    public FetchException(Kind kind, int statusCode, String url, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.url = url;
    }

    public Kind getKind() {
        return kind;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT || kind == Kind.RATE_LIMITED;
    }
}
