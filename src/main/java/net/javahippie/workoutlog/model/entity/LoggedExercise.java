package net.javahippie.workoutlog.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * An exercise performed on a calendar date.
 * Maps to the {@code exercises} table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoggedExercise {

    private String id;

    private String definitionId;

    private LocalDate date;

    private long createdAt;
}
