package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.model.DdlStatement;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Exports the user-defined triggers of a schema through {@code pg_get_triggerdef}. Internal
 * triggers (those backing foreign keys) are excluded.
 */
@Slf4j
@RequiredArgsConstructor
public class TriggersExporter {

    private static final String TRIGGERS_SQL = "SELECT c.relname AS table_name, t.tgname,"
            + " pg_get_triggerdef(t.oid) AS definition"
            + " FROM pg_trigger t JOIN pg_class c ON t.tgrelid = c.oid"
            + " JOIN pg_namespace n ON c.relnamespace = n.oid"
            + " WHERE n.nspname = ? AND NOT t.tgisinternal"
            + " AND (CAST(? AS text) IS NULL OR t.tgname = ?)"
            + " ORDER BY c.relname, t.tgname";

    private final Database database;
    private final Clock clock;

    /**
     * Collects trigger definitions.
     *
     * @param schema schema name
     * @param triggerName a single trigger name, or {@code null} for all
     * @return one statement per trigger
     * @throws SQLException if the catalog cannot be read
     */
    public List<DdlStatement> collect(String schema, String triggerName) throws SQLException {
        List<DdlStatement> triggers = database.query(TRIGGERS_SQL,
                rs -> new DdlStatement(DdlStatement.Kind.TRIGGER, rs.getString("tgname"),
                        rs.getString("table_name"),
                        FunctionsExporter.terminate(rs.getString("definition"))),
                schema, triggerName, triggerName);
        log.info("Schema [{}]: {} triggers collected", schema, triggers.size());
        return triggers;
    }

    /**
     * Writes {@code triggers-<schema>.sql}.
     *
     * @param schema schema name
     * @param outputDir migration directory
     * @return written file
     * @throws SQLException if the catalog cannot be read
     * @throws IOException if the file cannot be written
     */
    public Path export(String schema, Path outputDir) throws SQLException, IOException {
        List<DdlStatement> triggers = collect(schema, null);
        StringBuilder sql = new StringBuilder();
        sql.append("-- Triggers: ").append(schema).append('\n');
        sql.append("-- Generated: ").append(ValueEncoder.formatTemporal(clock.instant()))
                .append("\n\n");
        for (DdlStatement trigger : triggers) {
            sql.append("-- Trigger: ").append(trigger.getName()).append(" on ")
                    .append(trigger.getTable()).append('\n');
            sql.append(trigger.getSql()).append("\n\n");
        }
        Path file = ArtifactLayout.triggersFile(outputDir, schema);
        FileUtils.writeStringToFile(file.toFile(), sql.toString(), StandardCharsets.UTF_8);
        log.info("Triggers exported: {}", file);
        return file;
    }
}
