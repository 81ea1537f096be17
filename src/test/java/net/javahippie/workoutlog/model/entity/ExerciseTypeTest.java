package net.javahippie.workoutlog.model.entity;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExerciseType key resolution.
 */
class ExerciseTypeTest {

    private Locale originalLocale;

    @BeforeEach
    void setUp() {
        originalLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(originalLocale);
    }

    @Test
    @DisplayName("Should resolve keys regardless of case and surrounding whitespace")
    void testFromKey() {
        assertEquals(ExerciseType.WEIGHT_REPS, ExerciseType.fromKey("weight_reps"));
        assertEquals(ExerciseType.DISTANCE_TIME, ExerciseType.fromKey(" Distance_Time "));
        assertThrows(IllegalArgumentException.class, () -> ExerciseType.fromKey("juggling"));
        assertThrows(IllegalArgumentException.class, () -> ExerciseType.fromKey(null));
    }

    @Test
    @DisplayName("Upper-case keys should resolve under a Turkish default locale")
    void testFromKey_TurkishLocale() {
        // Given
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        // When / Then
        assertEquals(ExerciseType.TIME_SPEED, ExerciseType.fromKey("TIME_SPEED"));
        assertEquals(ExerciseType.REPS_DISTANCE, ExerciseType.fromKey("REPS_DISTANCE"));
        assertTrue(ExerciseType.isKnown("WEIGHT_TIME"));
        assertFalse(ExerciseType.isKnown(null));
    }
}
