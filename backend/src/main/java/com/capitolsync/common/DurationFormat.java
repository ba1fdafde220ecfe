package com.capitolsync.common;

import java.time.Duration;

/**
 * Human-readable durations for progress and summary output ("1h 2m 3s", "4m 5s", "6s").
 */
public final class DurationFormat {

    private DurationFormat() {
    }

    public static String format(Duration duration) {
        long totalSeconds = Math.max(0, duration.getSeconds());
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m " + seconds + "s";
        }
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }

    public static String formatMillis(long millis) {
        return format(Duration.ofMillis(millis));
    }
}
