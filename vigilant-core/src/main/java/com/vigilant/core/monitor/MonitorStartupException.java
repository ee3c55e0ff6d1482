package com.vigilant.core.monitor;

/**
 * Thrown by {@link SecurityMonitor#start()} when a collaborator fails to
 * initialize. The monitor is left in {@link MonitorStatus#ERROR}.
 */
public class MonitorStartupException extends RuntimeException {

    public MonitorStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
