package com.fantasyreport.collector.exception;

public class IngestAbortedException extends RuntimeException {

    public IngestAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
