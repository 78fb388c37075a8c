package com.stator;

import com.stator.config.StatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned SQL scripts under {@code stator/migration} to the
 * configured data source.
 * <p>
 * Each script runs once, in version order, inside its own transaction and is
 * recorded with a SHA-256 checksum. A script edited after it was applied fails
 * startup. On PostgreSQL concurrent starters serialize on an advisory lock.
 */
@Component
@ConditionalOnProperty(prefix = "stator.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class StatorSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(StatorSchemaInitializer.class);

    static final String MIGRATION_LOCATION = "classpath*:stator/migration/V*__*.sql";

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V([0-9]+(?:_[0-9]+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final long ADVISORY_LOCK_KEY = 5_312_907_441_086_223_719L;
    private static final String RECORDS_TABLE = "stator_records";

    private final DataSource dataSource;
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public StatorSchemaInitializer(
            DataSource dataSource,
            ObjectProvider<StatorProperties> propertiesProvider,
            Environment environment) {
        this.dataSource = dataSource;
        StatorProperties properties = propertiesProvider.getIfAvailable();
        if (properties != null) {
            this.tablePrefix = normalizePrefix(properties.getDatabase().getTablePrefix());
            this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
        } else {
            this.tablePrefix = normalizePrefix(environment.getProperty("stator.database.table-prefix", ""));
            this.failOnMigrationError = environment.getProperty(
                    "stator.database.fail-on-migration-error", Boolean.class, true);
        }
    }

    @Override
    public void afterPropertiesSet() {
        String historyTable = identifier("stator_schema_migrations");
        log.info("Running stator schema migrations, history kept in {}", historyTable);
        try {
            migrate(historyTable);
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Stator schema migration failed", e);
            }
            log.error("Stator schema migration failed; starting anyway because "
                    + "stator.database.fail-on-migration-error=false", e);
        }
    }

    private void migrate(String historyTable) throws SQLException, IOException {
        List<Script> scripts = loadScripts();
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No stator migrations found at " + MIGRATION_LOCATION);
        }
        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lock(connection);
            try {
                createHistoryTable(connection, historyTable);
                Map<String, String> applied = appliedChecksums(connection, historyTable);
                verify(scripts, applied);

                int count = 0;
                for (Script script : scripts) {
                    if (!applied.containsKey(script.version())) {
                        apply(connection, historyTable, script);
                        count++;
                    }
                }
                if (count == 0) {
                    log.info("Stator schema is current ({} migration(s) applied earlier)", applied.size());
                } else {
                    log.info("Applied {} stator migration(s)", count);
                }
            } finally {
                unlock(connection, locked);
            }
        }
    }

    List<Script> loadScripts() throws IOException {
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(MIGRATION_LOCATION);
        List<Script> scripts = new ArrayList<>();
        Map<String, String> fileByVersion = new HashMap<>();
        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = SCRIPT_NAME.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException(
                        "Migration file '" + fileName + "' does not match V{version}__{description}.sql");
            }
            String version = matcher.group(1);
            String previous = fileByVersion.putIfAbsent(version, fileName);
            if (previous != null) {
                throw new IllegalStateException(
                        "Migration version V" + version + " is used by both " + previous + " and " + fileName);
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            scripts.add(new Script(version, matcher.group(2).replace('_', ' '), fileName, sql, sha256(sql)));
        }
        scripts.sort((left, right) -> compareVersions(left.version(), right.version()));
        return scripts;
    }

    private void createHistoryTable(Connection connection, String historyTable) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version VARCHAR(64) PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum VARCHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                        execution_time_ms BIGINT NOT NULL
                    )
                    """.formatted(historyTable));
        }
    }

    private Map<String, String> appliedChecksums(Connection connection, String historyTable) throws SQLException {
        Map<String, String> applied = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + historyTable);
                ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                applied.put(rows.getString("version"), rows.getString("checksum"));
            }
        }
        return applied;
    }

    private void verify(List<Script> scripts, Map<String, String> applied) {
        Map<String, Script> byVersion = new HashMap<>();
        scripts.forEach(script -> byVersion.put(script.version(), script));
        for (Map.Entry<String, String> entry : applied.entrySet()) {
            Script script = byVersion.get(entry.getKey());
            if (script == null) {
                throw new IllegalStateException(
                        "Migration V" + entry.getKey() + " is recorded as applied but missing from the classpath");
            }
            if (!script.checksum().equals(entry.getValue())) {
                throw new IllegalStateException(
                        "Migration V" + script.version() + " was modified after it was applied");
            }
        }
    }

    private void apply(Connection connection, String historyTable, Script script) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        long started = System.nanoTime();
        connection.setAutoCommit(false);
        try {
            byte[] sql = render(script.sql()).getBytes(StandardCharsets.UTF_8);
            ScriptUtils.executeSqlScript(connection,
                    new EncodedResource(new ByteArrayResource(sql, script.fileName()), StandardCharsets.UTF_8));

            long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
            try (PreparedStatement insert = connection.prepareStatement("INSERT INTO " + historyTable
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                insert.setString(1, script.version());
                insert.setString(2, script.description());
                insert.setString(3, script.checksum());
                insert.setLong(4, elapsedMs);
                insert.executeUpdate();
            }
            connection.commit();
            log.info("Applied stator migration V{} ({}) in {} ms", script.version(), script.description(), elapsedMs);
        } catch (RuntimeException | SQLException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw new IllegalStateException(
                    "Migration V" + script.version() + " (" + script.description() + ") failed", e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    /**
     * Rewrites the default table and index names with the configured prefix.
     */
    String render(String sql) {
        if (tablePrefix.isEmpty()) {
            return sql;
        }
        return sql
                .replace("idx_" + RECORDS_TABLE + "_", tablePrefix + "idx_" + RECORDS_TABLE + "_")
                .replace("uq_" + RECORDS_TABLE + "_", tablePrefix + "uq_" + RECORDS_TABLE + "_")
                .replace(" " + RECORDS_TABLE, " " + tablePrefix + RECORDS_TABLE);
    }

    private boolean lock(Connection connection) throws SQLException {
        if (!isPostgres(connection)) {
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private void unlock(Connection connection, boolean locked) {
        if (!locked) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Could not release the stator migration lock", e);
        }
    }

    private static boolean isPostgres(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private String identifier(String name) {
        String identifier = tablePrefix + name;
        if (!SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Unsupported SQL identifier: " + identifier);
        }
        return identifier;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        String trimmed = prefix.trim();
        if (!SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported stator table prefix: " + trimmed);
        }
        return trimmed;
    }

    static int compareVersions(String left, String right) {
        int[] l = Arrays.stream(left.split("_")).mapToInt(Integer::parseInt).toArray();
        int[] r = Arrays.stream(right.split("_")).mapToInt(Integer::parseInt).toArray();
        for (int i = 0; i < Math.max(l.length, r.length); i++) {
            int a = i < l.length ? l[i] : 0;
            int b = i < r.length ? r[i] : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    record Script(String version, String description, String fileName, String sql, String checksum) {
    }
}
