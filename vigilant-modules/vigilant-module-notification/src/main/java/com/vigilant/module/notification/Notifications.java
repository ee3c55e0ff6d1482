package com.vigilant.module.notification;

import com.vigilant.core.model.AlertChannel;

import java.util.List;
import java.util.stream.Collectors;

final class Notifications {

    private Notifications() {
    }

    static List<String> names(List<AlertChannel> channels) {
        return channels.stream().map(AlertChannel::wireName).collect(Collectors.toList());
    }
}
