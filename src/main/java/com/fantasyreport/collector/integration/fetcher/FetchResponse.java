package com.fantasyreport.collector.integration.fetcher;

public record FetchResponse(
        String url,
        int status,
        String contentType,
        String body,
        int attempts
) {}
