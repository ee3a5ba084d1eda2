package com.strumbot.util;

import java.time.Duration;

/**
 * Formats session lengths as H:MM:SS. Hours are not capped at 24.
 */
public final class StreamDurationFormatter {

    private StreamDurationFormatter() {
    }

    public static String format(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return "0:00:00";
        }
        long totalSeconds = duration.getSeconds();
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        return String.format("%d:%02d:%02d", hours, minutes, seconds);
    }
}
