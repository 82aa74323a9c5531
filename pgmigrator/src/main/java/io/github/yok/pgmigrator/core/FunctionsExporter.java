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
import org.apache.commons.lang3.StringUtils;

/**
 * Exports the plain functions of a schema through {@code pg_get_functiondef}.
 *
 * <p>
 * Procedures, aggregates and functions owned by extensions are excluded. The server returns
 * {@code CREATE OR REPLACE FUNCTION ...} without a terminating semicolon; one is appended.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class FunctionsExporter {

    private static final String FUNCTIONS_SQL = "SELECT p.proname,"
            + " pg_get_functiondef(p.oid) AS definition"
            + " FROM pg_proc p JOIN pg_namespace n ON p.pronamespace = n.oid"
            + " LEFT JOIN pg_depend d ON d.objid = p.oid AND d.deptype = 'e'"
            + " WHERE n.nspname = ? AND p.prokind = 'f' AND d.objid IS NULL"
            + " AND (CAST(? AS text) IS NULL OR p.proname = ?)"
            + " ORDER BY p.proname, p.oid";

    private final Database database;
    private final Clock clock;

    /**
     * Collects function definitions.
     *
     * @param schema schema name
     * @param functionName a single function name, or {@code null} for all
     * @return one statement per function overload
     * @throws SQLException if the catalog cannot be read
     */
    public List<DdlStatement> collect(String schema, String functionName) throws SQLException {
        List<DdlStatement> functions = database.query(FUNCTIONS_SQL,
                rs -> new DdlStatement(DdlStatement.Kind.FUNCTION, rs.getString("proname"), null,
                        terminate(rs.getString("definition"))),
                schema, functionName, functionName);
        log.info("Schema [{}]: {} functions collected", schema, functions.size());
        return functions;
    }

    /**
     * Writes {@code functions-<schema>.sql}.
     *
     * @param schema schema name
     * @param outputDir migration directory
     * @return written file
     * @throws SQLException if the catalog cannot be read
     * @throws IOException if the file cannot be written
     */
    public Path export(String schema, Path outputDir) throws SQLException, IOException {
        List<DdlStatement> functions = collect(schema, null);
        StringBuilder sql = new StringBuilder();
        sql.append("-- Functions: ").append(schema).append('\n');
        sql.append("-- Generated: ").append(ValueEncoder.formatTemporal(clock.instant()))
                .append("\n\n");
        for (DdlStatement function : functions) {
            sql.append("-- Function: ").append(function.getName()).append('\n');
            sql.append(function.getSql()).append("\n\n");
        }
        Path file = ArtifactLayout.functionsFile(outputDir, schema);
        FileUtils.writeStringToFile(file.toFile(), sql.toString(), StandardCharsets.UTF_8);
        log.info("Functions exported: {}", file);
        return file;
    }

    static String terminate(String definition) {
        String trimmed = StringUtils.stripEnd(definition, null);
        return trimmed.endsWith(";") ? trimmed : trimmed + ";";
    }
}
