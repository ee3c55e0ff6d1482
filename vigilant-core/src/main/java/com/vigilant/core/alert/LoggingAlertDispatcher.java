package com.vigilant.core.alert;

import com.vigilant.core.model.AlertChannel;
import com.vigilant.core.model.SecurityAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fallback dispatcher that writes alerts to the log. Applications replace it
 * with a bean that talks to real channels.
 */
public class LoggingAlertDispatcher implements AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertDispatcher.class);

    @Override
    public boolean send(SecurityAlert alert, List<AlertChannel> channels) {
        if (channels.isEmpty()) {
            return false;
        }
        log.warn("[Vigilant] ALERT [{}] {} -> {} (threat={}, incident={})",
                alert.getLevel().wireName(), alert.getTitle(),
                channels.stream().map(AlertChannel::wireName).collect(Collectors.joining(",")),
                alert.getThreatId(), alert.getIncidentId());
        return true;
    }
}
