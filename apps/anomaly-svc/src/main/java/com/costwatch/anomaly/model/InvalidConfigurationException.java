package com.costwatch.anomaly.model;

/**
 * Raised for detection parameters no run could be meaningful with (window too short,
 * non-positive thresholds, inverted scan range). Always a caller error.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
