package net.javahippie.workoutlog.migration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Table definitions and the registry of migrations.
 * Increment {@link #CURRENT_VERSION} and register a migration for every schema change;
 * {@link #CREATE_STATEMENTS} always describes the current version.
 */
@Slf4j
public final class SchemaMigrations {

    public static final int CURRENT_VERSION = 3;

    /**
     * Version assigned to stores whose tables predate version tracking.
     */
    public static final int BASELINE_VERSION = 1;

    public static final String VERSION_TABLE = "schema_version";

    public static final List<String> EXPECTED_TABLES = List.of(
            VERSION_TABLE,
            "exercise_definitions",
            "exercises",
            "sets"
    );

    public static final List<String> CREATE_STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS exercise_definitions (
              id TEXT PRIMARY KEY,
              name TEXT NOT NULL UNIQUE,
              category TEXT NOT NULL,
              type TEXT NOT NULL,
              unit TEXT NOT NULL,
              description TEXT,
              createdAt INTEGER NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS exercises (
              id TEXT PRIMARY KEY,
              definitionId TEXT NOT NULL,
              date TEXT NOT NULL,
              createdAt INTEGER NOT NULL,
              FOREIGN KEY(definitionId) REFERENCES exercise_definitions(id) ON DELETE CASCADE
            )""",
            """
            CREATE TABLE IF NOT EXISTS sets (
              id TEXT PRIMARY KEY,
              exerciseId TEXT NOT NULL,
              weight REAL,
              reps INTEGER,
              distance REAL,
              time INTEGER,
              note TEXT,
              timestamp INTEGER NOT NULL,
              FOREIGN KEY(exerciseId) REFERENCES exercises(id) ON DELETE CASCADE
            )""",
            "CREATE INDEX IF NOT EXISTS idx_exercises_date ON exercises(date)",
            "CREATE INDEX IF NOT EXISTS idx_exercises_definitionId ON exercises(definitionId)",
            "CREATE INDEX IF NOT EXISTS idx_sets_exerciseId ON sets(exerciseId)",
            "CREATE INDEX IF NOT EXISTS idx_exercise_definitions_name ON exercise_definitions(name)"
    );

    public static final String CREATE_VERSION_TABLE = """
            CREATE TABLE IF NOT EXISTS schema_version (
              id INTEGER PRIMARY KEY CHECK (id = 1),
              version INTEGER NOT NULL,
              updatedAt INTEGER NOT NULL
            )""";

    private SchemaMigrations() {
    }

    /**
     * All registered migrations.
     */
    public static List<Migration> all() {
        return List.of(new AddSetNoteColumn(), new IndexExercisesByDefinition());
    }

    /**
     * Free-text note per set.
     */
    static final class AddSetNoteColumn implements Migration {

        @Override
        public int version() {
            return 2;
        }

        @Override
        public String name() {
            return "Add note column to sets";
        }

        @Override
        public void apply(JdbcTemplate jdbcTemplate) {
            Integer existing = jdbcTemplate.queryForObject(
                    "SELECT count(*) FROM pragma_table_info('sets') WHERE name = 'note'",
                    Integer.class);
            if (existing != null && existing > 0) {
                log.debug("Column sets.note already present");
                return;
            }
            jdbcTemplate.execute("ALTER TABLE sets ADD COLUMN note TEXT");
        }
    }

    static final class IndexExercisesByDefinition implements Migration {

        @Override
        public int version() {
            return 3;
        }

        @Override
        public String name() {
            return "Index exercises by definition";
        }

        @Override
        public void apply(JdbcTemplate jdbcTemplate) {
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_exercises_definitionId ON exercises(definitionId)");
        }
    }
}
