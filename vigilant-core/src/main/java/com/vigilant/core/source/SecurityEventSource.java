package com.vigilant.core.source;

import com.vigilant.core.model.SecurityEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Append-only store of security audit events. Event ids are assigned by the
 * source and increase with insertion order.
 */
public interface SecurityEventSource {

    /**
     * Events with an id strictly greater than {@code sinceId}, in ascending id
     * order, at most {@code limit} of them.
     */
    List<SecurityEvent> readEvents(long sinceId, int limit) throws Exception;

    /**
     * Events with a timestamp at or after {@code since}, in ascending id order.
     * When more than {@code limit} match, the newest {@code limit} are returned.
     */
    List<SecurityEvent> readSince(Instant since, int limit) throws Exception;

    /**
     * Events from the last {@code window}, measured against the source's clock,
     * with the same newest-first cap as {@link #readSince}.
     */
    List<SecurityEvent> readRecent(Duration window, int limit) throws Exception;

    /**
     * Highest id currently stored, or 0 when empty.
     */
    long latestEventId() throws Exception;
}
