package com.riskscan.connect.exception;

/**
 * Thrown when client credentials are missing or still hold placeholder values.
 * Nothing is sent to the provider once this is raised.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
