package net.javahippie.workoutlog.config;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.migration.SchemaMigrationService;
import net.javahippie.workoutlog.migration.SchemaMigrations;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Wiring of the SQLite store.
 *
 * The data source opens a fresh connection per use, so nothing keeps the file open
 * between operations and a restore can replace it.
 */
@Configuration
@Slf4j
public class StoreConfiguration {

    @Bean
    public DataSource dataSource(@Value("${workoutlog.store.path}") String storePath) {
        Path path = Paths.get(storePath).toAbsolutePath();
        try {
            Files.createDirectories(path.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create store directory for " + path, e);
        }

        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + path);
        log.info("Using workout store at {}", path);
        return dataSource;
    }

    @Bean
    public SchemaMigrationService schemaMigrationService(JdbcTemplate jdbcTemplate,
                                                         TransactionTemplate transactionTemplate) {
        return new SchemaMigrationService(jdbcTemplate, transactionTemplate,
                SchemaMigrations.all(), SchemaMigrations.CURRENT_VERSION);
    }

    @Bean
    public CommandLineRunner storeInitializerRunner(StoreInitializer storeInitializer) {
        return args -> storeInitializer.initialize();
    }
}
