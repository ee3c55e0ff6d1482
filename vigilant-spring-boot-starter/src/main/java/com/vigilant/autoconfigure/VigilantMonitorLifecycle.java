package com.vigilant.autoconfigure;

import com.vigilant.core.monitor.MonitorStartupException;
import com.vigilant.core.monitor.SecurityMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the security monitor with the application context and stops it on
 * shutdown. A failed start leaves the monitor in ERROR and the application
 * running; operators retry through {@code POST /api/vigilant/monitor/start}.
 */
public class VigilantMonitorLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(VigilantMonitorLifecycle.class);

    private final SecurityMonitor monitor;
    private final boolean autoStart;

    public VigilantMonitorLifecycle(SecurityMonitor monitor, boolean autoStart) {
        this.monitor = monitor;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        try {
            monitor.start();
        } catch (MonitorStartupException e) {
            log.error("[Vigilant] Monitor did not start with the application (status {}): {}",
                    monitor.getStatus(), e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        monitor.stop();
    }

    @Override
    public boolean isRunning() {
        return monitor.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
