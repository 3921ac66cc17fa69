package com.example.focusroom.service;

import java.util.List;

/**
 * Outcome of one emit: how many connections got the event and which ones failed.
 */
public record DeliveryReport(String event, int delivered, List<String> failed) {

    public DeliveryReport {
        failed = (failed == null) ? List.of() : List.copyOf(failed);
    }

    public static DeliveryReport none(String event) {
        return new DeliveryReport(event, 0, List.of());
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
