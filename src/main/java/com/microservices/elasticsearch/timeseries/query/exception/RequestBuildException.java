package com.microservices.elasticsearch.timeseries.query.exception;

/**
 * Raised when the batched multi-search request cannot be finalized
 */
public class RequestBuildException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public RequestBuildException(String message) {
        super(message);
    }

    public RequestBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
