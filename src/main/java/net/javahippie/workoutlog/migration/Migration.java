package net.javahippie.workoutlog.migration;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * A single forward schema change.
 * Applied at most once, inside a transaction that also advances the stored version.
 */
public interface Migration {

    /**
     * Schema version this migration brings the store to.
     */
    int version();

    /**
     * Short description for logs.
     */
    String name();

    /**
     * Apply the change.
     *
     * @param jdbcTemplate template bound to the migration transaction
     */
    void apply(JdbcTemplate jdbcTemplate);
}
