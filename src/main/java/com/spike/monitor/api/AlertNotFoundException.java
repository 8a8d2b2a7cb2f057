package com.spike.monitor.api;

/**
 * Thrown when an alert id is not in the history.
 */
public class AlertNotFoundException extends RuntimeException {

    public AlertNotFoundException(String alertId) {
        super("No alert with id " + alertId);
    }
}
