package com.simnotes.notify;

/**
 * Write-only channel for operator-facing status messages. Delivery is best-effort.
 */
@FunctionalInterface
public interface NotificationSink {
    void notify(NotificationLevel level, String message);

    default void info(String message) {
        notify(NotificationLevel.INFO, message);
    }

    default void error(String message) {
        notify(NotificationLevel.ERROR, message);
    }
}
