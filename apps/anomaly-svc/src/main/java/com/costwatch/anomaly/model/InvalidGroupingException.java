package com.costwatch.anomaly.model;

/**
 * Raised when a requested grouping is not part of the supported dimension whitelist.
 */
public class InvalidGroupingException extends IllegalArgumentException {

    public InvalidGroupingException(String message) {
        super(message);
    }
}
