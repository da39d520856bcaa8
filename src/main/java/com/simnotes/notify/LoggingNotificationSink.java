package com.simnotes.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger("com.simnotes.notice");

    @Override
    public void notify(NotificationLevel level, String message) {
        switch (level) {
            case ERROR -> log.error("notice: {}", message);
            case WARN -> log.warn("notice: {}", message);
            default -> log.info("notice: {}", message);
        }
    }
}
