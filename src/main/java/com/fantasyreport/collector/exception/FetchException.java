package com.fantasyreport.collector.exception;

import lombok.Getter;

/**
 * Raised by the resilient fetcher once a URL is given up on, either because the
 * response was terminal (non-retryable 4xx) or because the retry budget ran out.
 */
@Getter
public class FetchException extends RuntimeException {

    private final Integer status;
    private final boolean retryable;

    public FetchException(String message, Throwable cause) {
        this(message, null, false, cause);
    }

    public FetchException(String message, Integer status, boolean retryable, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.retryable = retryable;
    }
}
