package com.simnotes.notify;

import java.io.PrintStream;

public class ConsoleNotificationSink implements NotificationSink {
    private final PrintStream out;

    public ConsoleNotificationSink() {
        this(System.out);
    }

    public ConsoleNotificationSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void notify(NotificationLevel level, String message) {
        if (level == NotificationLevel.INFO) {
            out.println(message);
        } else {
            out.println("[" + level + "] " + message);
        }
        out.flush();
    }
}
