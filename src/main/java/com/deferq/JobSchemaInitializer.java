package com.deferq;

import com.deferq.config.DeferQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Applies the bundled migration scripts on startup, each in its own
 * transaction, and records them in {@code deferq_schema_migrations}. A
 * Postgres advisory lock keeps concurrently starting workers from migrating
 * at the same time.
 */
@Component
@ConditionalOnProperty(prefix = "deferq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final long MIGRATION_ADVISORY_LOCK_KEY = 6_912_004_513_377_850_117L;

    private final DataSource dataSource;
    private final String tablePrefix;
    private final boolean failOnMigrationError;
    private final String migrationLocation;

    public JobSchemaInitializer(DataSource dataSource, DeferQProperties properties) {
        this(dataSource, properties, MigrationScripts.DEFAULT_LOCATION);
    }

    JobSchemaInitializer(DataSource dataSource, DeferQProperties properties, String migrationLocation) {
        this.dataSource = dataSource;
        this.tablePrefix = normalizePrefix(properties.getDatabase().getTablePrefix());
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
        this.migrationLocation = migrationLocation;
    }

    @Override
    public void afterPropertiesSet() {
        String ledgerTable = identifier("deferq_schema_migrations");
        String jobsTable = identifier("deferq_jobs");

        try (Connection connection = dataSource.getConnection()) {
            lock(connection);
            try {
                int applied = migrate(connection, ledgerTable, jobsTable);
                if (applied == 0) {
                    log.info("DeferQ schema is up to date ({})", ledgerTable);
                } else {
                    log.info("Applied {} DeferQ migration(s) to {}", applied, jobsTable);
                }
            } finally {
                unlock(connection);
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Failed to initialize the DeferQ database schema", e);
            }
            log.error("Failed to initialize the DeferQ database schema "
                    + "(continuing because deferq.database.fail-on-migration-error=false)", e);
        }
    }

    private int migrate(Connection connection, String ledgerTable, String jobsTable) throws Exception {
        createLedger(connection, ledgerTable);
        List<MigrationScripts.Script> scripts = MigrationScripts.load(migrationLocation);
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No DeferQ migrations found at " + migrationLocation);
        }

        Map<String, String> appliedChecksums = appliedChecksums(connection, ledgerTable);
        Map<String, MigrationScripts.Script> scriptsByVersion = new HashMap<>();
        scripts.forEach(script -> scriptsByVersion.put(script.version(), script));
        for (Map.Entry<String, String> applied : appliedChecksums.entrySet()) {
            MigrationScripts.Script script = scriptsByVersion.get(applied.getKey());
            if (script == null) {
                throw new IllegalStateException("Migration V" + applied.getKey()
                        + " was applied in the database but is missing from the classpath.");
            }
            if (!script.checksum().equals(applied.getValue())) {
                throw new IllegalStateException("Checksum mismatch for migration V" + script.version()
                        + ". The migration file changed after being applied.");
            }
        }

        int count = 0;
        for (MigrationScripts.Script script : scripts) {
            if (!appliedChecksums.containsKey(script.version())) {
                apply(connection, ledgerTable, jobsTable, script);
                count++;
            }
        }
        return count;
    }

    private void createLedger(Connection connection, String ledgerTable) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version VARCHAR(64) PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum VARCHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                        execution_time_ms BIGINT NOT NULL
                    )
                    """.formatted(ledgerTable));
        }
    }

    private Map<String, String> appliedChecksums(Connection connection, String ledgerTable) throws SQLException {
        Map<String, String> checksums = new HashMap<>();
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT version, checksum FROM " + ledgerTable)) {
            while (rs.next()) {
                checksums.put(rs.getString("version"), rs.getString("checksum"));
            }
        }
        return checksums;
    }

    private void apply(Connection connection, String ledgerTable, String jobsTable, MigrationScripts.Script script)
            throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        long started = System.nanoTime();
        connection.setAutoCommit(false);
        try {
            String sql = MigrationScripts.render(script.sql(), jobsTable, tablePrefix);
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(sql.getBytes(StandardCharsets.UTF_8), script.fileName()),
                    StandardCharsets.UTF_8));

            long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            try (PreparedStatement insert = connection.prepareStatement("INSERT INTO " + ledgerTable
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                insert.setString(1, script.version());
                insert.setString(2, script.description());
                insert.setString(3, script.checksum());
                insert.setLong(4, elapsedMs);
                insert.executeUpdate();
            }
            connection.commit();
            log.info("Applied DeferQ migration V{} ({}) in {} ms", script.version(), script.description(), elapsedMs);
        } catch (RuntimeException | SQLException e) {
            connection.rollback();
            throw new IllegalStateException(
                    "Failed to apply DeferQ migration V" + script.version() + " (" + script.description() + ")", e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private void lock(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, MIGRATION_ADVISORY_LOCK_KEY);
            statement.execute();
        }
    }

    private void unlock(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, MIGRATION_ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release the DeferQ schema migration lock", e);
        }
    }

    private String identifier(String baseName) {
        String identifier = tablePrefix + baseName;
        if (!SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Unsupported SQL identifier for DeferQ migration: " + identifier);
        }
        return identifier;
    }

    static String normalizePrefix(String configuredPrefix) {
        if (configuredPrefix == null || configuredPrefix.isBlank()) {
            return "";
        }
        String trimmed = configuredPrefix.trim();
        if (!SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported DeferQ table-prefix: " + trimmed);
        }
        return trimmed;
    }
}
