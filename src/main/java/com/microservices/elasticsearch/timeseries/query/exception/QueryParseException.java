package com.microservices.elasticsearch.timeseries.query.exception;

/**
 * Raised when a panel query model cannot be turned into a typed query
 */
public class QueryParseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public QueryParseException(String message) {
        super(message);
    }

    public QueryParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
