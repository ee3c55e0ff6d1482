package com.vigilant.core.alert;

import com.vigilant.core.model.AlertChannel;
import com.vigilant.core.model.SecurityAlert;

import java.util.List;

/**
 * Delivers alerts to operators. Delivery is best effort: failures are reported
 * through the return value and never retried by the caller.
 */
public interface AlertDispatcher {

    /**
     * @return true if the alert reached at least one channel
     */
    boolean send(SecurityAlert alert, List<AlertChannel> channels);
}
