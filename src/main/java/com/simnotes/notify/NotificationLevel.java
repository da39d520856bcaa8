package com.simnotes.notify;

public enum NotificationLevel {
    INFO,
    WARN,
    ERROR
}
