package com.fantasyreport.collector.exception;

import lombok.Getter;

/**
 * The body was markup, but neither RSS 2.0, Atom nor RDF. Callers fall back to link scraping.
 */
@Getter
public class UnrecognizedFeedFormatException extends RuntimeException {

    private final String rootElement;

    public UnrecognizedFeedFormatException(String rootElement, Throwable cause) {
        super("Unrecognized feed format root=" + rootElement, cause);
        this.rootElement = rootElement;
    }
}
