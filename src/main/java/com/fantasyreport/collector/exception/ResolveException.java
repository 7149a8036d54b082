package com.fantasyreport.collector.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class ResolveException extends RuntimeException {

    private final List<String> attemptedUrls;

    public ResolveException(String message, List<String> attemptedUrls, Throwable cause) {
        super(message + " attempted=" + attemptedUrls, cause);
        this.attemptedUrls = List.copyOf(attemptedUrls);
    }
}
