package com.spike.monitor.config;

/**
 * Thrown at startup when thresholds, windows or weights are outside their valid range.
 * Values are never clamped.
 */
public class InvalidMonitorConfigException extends RuntimeException {

    public InvalidMonitorConfigException(String message) {
        super(message);
    }
}
