package com.microservices.elasticsearch.timeseries.query.exception;

public class QueryExecutionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
