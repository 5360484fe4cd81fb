package com.ctdl.scout.service.search;

/**
 * Thrown when a search request cannot be completed, either because an {@code https://} call failed
 * or because a plain {@code http://} call used up its retry allowance.
 */
public class SearchRequestException extends RuntimeException {

    public SearchRequestException(String message) {
        super(message);
    }

    public SearchRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
