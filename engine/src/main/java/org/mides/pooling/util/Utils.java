package org.mides.pooling.util;

public class Utils {

    private Utils() {
    }

    /* Formats seconds from midnight as [-]HH:mm:ss; hours are not wrapped at 24. */
    public static String formatClockTime(long seconds) {
        long absolute = Math.abs(seconds);
        return String.format("%s%02d:%02d:%02d",
            seconds < 0 ? "-" : "",
            absolute / 3600,
            (absolute % 3600) / 60,
            absolute % 60);
    }

    public static long parseClockTime(String value) {
        var text = value.trim();
        boolean negative = text.startsWith("-");
        if (negative)
            text = text.substring(1);

        var parts = text.split(":");
        if (parts.length != 3)
            throw new IllegalArgumentException("Expected [-]HH:mm:ss but got " + value);

        long hours = Long.parseLong(parts[0]);
        long minutes = Long.parseLong(parts[1]);
        long seconds = Long.parseLong(parts[2]);
        if (minutes >= 60 || seconds >= 60)
            throw new IllegalArgumentException("Minutes and seconds must be below 60 in " + value);

        long total = hours * 3600 + minutes * 60 + seconds;
        return negative ? -total : total;
    }
}
