package com.opinion.builder.service;

/**
 * A query parameter failed validation. Raised before the store is read.
 */
public class InvalidFilterException extends RuntimeException {

    private final String parameter;

    public InvalidFilterException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
