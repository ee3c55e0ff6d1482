package com.vigilant.core.alert;

import com.vigilant.core.model.AlertChannel;
import com.vigilant.core.model.Severity;

import java.util.List;

import static com.vigilant.core.model.AlertChannel.DASHBOARD;
import static com.vigilant.core.model.AlertChannel.EMAIL;
import static com.vigilant.core.model.AlertChannel.PUSH;
import static com.vigilant.core.model.AlertChannel.SLACK;
import static com.vigilant.core.model.AlertChannel.SMS;
import static com.vigilant.core.model.AlertChannel.WEBHOOK;

/** Channels used for an alert of each severity. */
public final class AlertRouting {

    private AlertRouting() {
    }

    public static List<AlertChannel> channelsFor(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return List.of(EMAIL, SMS, PUSH, DASHBOARD, WEBHOOK, SLACK);
            case HIGH:
                return List.of(EMAIL, PUSH, DASHBOARD, WEBHOOK);
            case MEDIUM:
                return List.of(DASHBOARD, WEBHOOK);
            default:
                return List.of(DASHBOARD);
        }
    }
}
