package net.javahippie.workoutlog.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkoutFormatter.
 */
class WorkoutFormatterTest {

    @Test
    @DisplayName("Should format durations as m:ss")
    void testFormatDuration() {
        assertEquals("1:30", WorkoutFormatter.formatDuration(90));
        assertEquals("0:05", WorkoutFormatter.formatDuration(5));
        assertEquals("61:01", WorkoutFormatter.formatDuration(3661));
    }

    @Test
    @DisplayName("Should drop trailing .0 from numbers")
    void testFormatNumber() {
        assertEquals("100", WorkoutFormatter.formatNumber(100.0));
        assertEquals("82.5", WorkoutFormatter.formatNumber(82.5));
        assertEquals("12", WorkoutFormatter.formatNumber(12));
        assertEquals("", WorkoutFormatter.formatNumber(null));
    }

    @Test
    @DisplayName("Should format file sizes with binary units")
    void testFormatFileSize() {
        assertEquals("0 B", WorkoutFormatter.formatFileSize(0));
        assertEquals("512 B", WorkoutFormatter.formatFileSize(512));
        assertEquals("1.5 KB", WorkoutFormatter.formatFileSize(1536));
    }
}
