package com.cognix.universalSearch.gateway.exception;

/**
 * Exception thrown when a search request passes bean validation but still cannot be served,
 * e.g. an unknown entity type tag.
 */
public class InvalidSearchRequestException extends RuntimeException {

    public InvalidSearchRequestException(String message) {
        super(message);
    }
}
