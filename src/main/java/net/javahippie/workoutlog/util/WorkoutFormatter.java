package net.javahippie.workoutlog.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Utility class for formatting workout values in exports and reports.
 */
public class WorkoutFormatter {

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB"};

    /**
     * Formats a duration as minutes and zero-padded seconds.
     *
     * @param seconds duration in seconds
     * @return e.g. "1:30" for 90 seconds
     */
    public static String formatDuration(int seconds) {
        int minutes = seconds / 60;
        int remainder = seconds % 60;
        return String.format(Locale.ROOT, "%d:%02d", minutes, remainder);
    }

    /**
     * Formats a number without a trailing ".0" or exponent.
     *
     * @param value the value, may be null
     * @return plain decimal text, or an empty string for null
     */
    public static String formatNumber(Number value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Integer || value instanceof Long) {
            return value.toString();
        }
        BigDecimal decimal = BigDecimal.valueOf(value.doubleValue()).stripTrailingZeros();
        return decimal.scale() < 0 ? decimal.setScale(0).toPlainString() : decimal.toPlainString();
    }

    /**
     * Formats a byte count with a binary unit.
     *
     * @param bytes size in bytes
     * @return e.g. "1.5 KB"
     */
    public static String formatFileSize(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unit = (int) Math.min(SIZE_UNITS.length - 1, Math.floor(Math.log(bytes) / Math.log(1024)));
        double scaled = bytes / Math.pow(1024, unit);
        return formatNumber(BigDecimal.valueOf(scaled).setScale(2, RoundingMode.HALF_UP).doubleValue())
                + " " + SIZE_UNITS[unit];
    }
}
