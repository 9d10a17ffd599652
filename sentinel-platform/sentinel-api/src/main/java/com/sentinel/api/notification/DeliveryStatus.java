package com.sentinel.api.notification;

public enum DeliveryStatus {
    DELIVERED,
    /** Recipient has no reachable device right now; not an error. */
    UNREACHABLE,
    FAILED
}
