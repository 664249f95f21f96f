package com.autobulk;

import com.autobulk.config.AutobulkProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned scripts under {@code autobulk/migration} once per database and records
 * them in {@code autobulk_schema_migrations}. On PostgreSQL concurrent starters serialize on an
 * advisory lock. A script edited after it was applied fails the startup.
 */
@Component
@ConditionalOnProperty(prefix = "autobulk.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);

    private static final String SCRIPT_LOCATION = "classpath*:autobulk/migration/V*__*.sql";
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V(\\d+(?:_\\d+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SCHEMA_OBJECT_NAME = Pattern.compile("\\b(?:(?:idx|fk)_)?autobulk_[a-z0-9_]+\\b");
    private static final long ADVISORY_LOCK_KEY = 6_119_402_337_504_228_803L;

    private final DataSource dataSource;
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public JobSchemaInitializer(
            DataSource dataSource,
            ObjectProvider<AutobulkProperties> propertiesProvider,
            Environment environment) {
        this.dataSource = dataSource;
        AutobulkProperties properties = propertiesProvider.getIfAvailable();
        AutobulkProperties.Database database = properties != null
                ? properties.getDatabase()
                : Binder.get(environment).bind("autobulk.database", AutobulkProperties.Database.class)
                        .orElseGet(AutobulkProperties.Database::new);
        this.tablePrefix = normalizePrefix(database.getTablePrefix());
        this.failOnMigrationError = database.isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        try {
            migrate();
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Autobulk schema migration failed", e);
            }
            log.error("Autobulk schema migration failed; continuing because "
                    + "autobulk.database.fail-on-migration-error=false", e);
        }
    }

    private void migrate() throws IOException, SQLException {
        List<SchemaScript> scripts = discoverScripts();
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No autobulk migration scripts found at " + SCRIPT_LOCATION);
        }
        String historyTable = tablePrefix + "autobulk_schema_migrations";
        log.info("Migrating autobulk schema (history table {}, {} script(s) on the classpath)", historyTable,
                scripts.size());

        try (Connection connection = dataSource.getConnection()) {
            boolean locked = isPostgres(connection) && advisoryLock(connection, "pg_advisory_lock");
            try {
                createHistoryTable(connection, historyTable);
                Map<String, String> applied = appliedChecksums(connection, historyTable);
                verifyHistory(scripts, applied);

                int appliedNow = 0;
                for (SchemaScript script : scripts) {
                    if (!applied.containsKey(script.version())) {
                        apply(connection, historyTable, script);
                        appliedNow++;
                    }
                }
                log.info("Autobulk schema is up to date ({} applied now, {} already present)", appliedNow,
                        applied.size());
            } finally {
                if (locked) {
                    releaseAdvisoryLock(connection);
                }
            }
        }
    }

    private List<SchemaScript> discoverScripts() throws IOException {
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(SCRIPT_LOCATION);
        Map<String, SchemaScript> byVersion = new LinkedHashMap<>();
        for (Resource resource : resources) {
            if (resource.getFilename() == null) {
                continue;
            }
            SchemaScript script = SchemaScript.read(resource);
            SchemaScript clash = byVersion.putIfAbsent(script.version(), script);
            if (clash != null) {
                throw new IllegalStateException("Migration version V" + script.version() + " is defined by both "
                        + clash.fileName() + " and " + script.fileName());
            }
        }
        List<SchemaScript> ordered = new ArrayList<>(byVersion.values());
        ordered.sort(Comparator.comparing(SchemaScript::versionParts, Arrays::compare));
        return ordered;
    }

    private void createHistoryTable(Connection connection, String historyTable) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version VARCHAR(64) PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum VARCHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
                    )
                    """.formatted(historyTable));
        }
    }

    private Map<String, String> appliedChecksums(Connection connection, String historyTable) throws SQLException {
        Map<String, String> checksums = new LinkedHashMap<>();
        try (Statement statement = connection.createStatement();
                ResultSet rows = statement.executeQuery("SELECT version, checksum FROM " + historyTable)) {
            while (rows.next()) {
                checksums.put(rows.getString("version"), rows.getString("checksum"));
            }
        }
        return checksums;
    }

    private static void verifyHistory(List<SchemaScript> scripts, Map<String, String> applied) {
        Map<String, SchemaScript> byVersion = new LinkedHashMap<>();
        scripts.forEach(script -> byVersion.put(script.version(), script));
        applied.forEach((version, checksum) -> {
            SchemaScript script = byVersion.get(version);
            if (script == null) {
                throw new IllegalStateException("Migration V" + version + " was applied but is missing from the classpath");
            }
            if (!script.checksum().equals(checksum)) {
                throw new IllegalStateException("Migration " + script.fileName() + " changed after it was applied");
            }
        });
    }

    private void apply(Connection connection, String historyTable, SchemaScript script) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            byte[] sql = renderMigrationSql(script.sql()).getBytes(StandardCharsets.UTF_8);
            ScriptUtils.executeSqlScript(connection,
                    new EncodedResource(new ByteArrayResource(sql, script.fileName()), StandardCharsets.UTF_8));
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO " + historyTable + " (version, description, checksum) VALUES (?, ?, ?)")) {
                insert.setString(1, script.version());
                insert.setString(2, script.description());
                insert.setString(3, script.checksum());
                insert.executeUpdate();
            }
            connection.commit();
            log.info("Applied autobulk migration {}", script.fileName());
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw new IllegalStateException("Migration " + script.fileName() + " could not be applied", e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    /**
     * Prefixes every autobulk table, index and constraint name in a migration script, e.g.
     * {@code autobulk_jobs} becomes {@code tenant1_autobulk_jobs} and {@code idx_autobulk_jobs_due}
     * becomes {@code tenant1_idx_autobulk_jobs_due}.
     */
    String renderMigrationSql(String sql) {
        if (tablePrefix.isEmpty()) {
            return sql;
        }
        Matcher matcher = SCHEMA_OBJECT_NAME.matcher(sql);
        StringBuilder rendered = new StringBuilder(sql.length() + 64);
        while (matcher.find()) {
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(tablePrefix + matcher.group()));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    private static boolean advisoryLock(Connection connection, String function) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT " + function + "(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private static void releaseAdvisoryLock(Connection connection) {
        try {
            advisoryLock(connection, "pg_advisory_unlock");
        } catch (SQLException e) {
            log.warn("Could not release the autobulk migration lock", e);
        }
    }

    private static boolean isPostgres(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private static String normalizePrefix(String configuredPrefix) {
        String trimmed = configuredPrefix == null ? "" : configuredPrefix.trim();
        if (!trimmed.isEmpty() && !IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported autobulk table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private record SchemaScript(String version, int[] versionParts, String description, String fileName, String sql,
            String checksum) {

        static SchemaScript read(Resource resource) throws IOException {
            String fileName = resource.getFilename();
            Matcher name = SCRIPT_NAME.matcher(fileName);
            if (!name.matches()) {
                throw new IllegalStateException("Migration file '" + fileName
                        + "' does not follow V{version}__{description}.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            int[] parts = Arrays.stream(name.group(1).split("_")).mapToInt(Integer::parseInt).toArray();
            return new SchemaScript(name.group(1), parts, name.group(2).replace('_', ' '), fileName, sql,
                    DigestUtils.md5DigestAsHex(sql.getBytes(StandardCharsets.UTF_8)));
        }
    }
}
