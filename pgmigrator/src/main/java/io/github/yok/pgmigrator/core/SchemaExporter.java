package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.model.DdlStatement;
import io.github.yok.pgmigrator.model.TableId;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads the schema objects of one PostgreSQL schema and renders them as DDL.
 *
 * <p>
 * Objects are emitted in dependency-safe order: extensions, enum types, sequences, tables, primary
 * key and unique constraints, indexes, foreign keys, check constraints, views. Creation statements
 * use {@code IF NOT EXISTS} or {@code OR REPLACE} where PostgreSQL supports it. Enum types and
 * constraint additions, which have neither, run inside a {@code DO} block that ignores "already
 * exists" errors.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaExporter {

    private static final Pattern CREATE_INDEX =
            Pattern.compile("^CREATE (UNIQUE )?INDEX (?!IF NOT EXISTS )");

    private static final String EXTENSIONS_SQL = "SELECT e.extname, n.nspname AS extnamespace"
            + " FROM pg_extension e LEFT JOIN pg_namespace n ON e.extnamespace = n.oid"
            + " WHERE e.extname NOT IN ('plpgsql') ORDER BY e.extname";

    private static final String ENUMS_SQL = "SELECT t.typname,"
            + " array_agg(e.enumlabel ORDER BY e.enumsortorder) AS labels"
            + " FROM pg_type t JOIN pg_enum e ON t.oid = e.enumtypid"
            + " JOIN pg_namespace n ON t.typnamespace = n.oid"
            + " WHERE n.nspname = ? GROUP BY t.typname ORDER BY t.typname";

    private static final String SEQUENCES_SQL = "SELECT sequence_name, data_type, start_value,"
            + " minimum_value, maximum_value, increment FROM information_schema.sequences"
            + " WHERE sequence_schema = ? ORDER BY sequence_name";

    private static final String TABLES_SQL = "SELECT table_name FROM information_schema.tables"
            + " WHERE table_schema = ? AND table_type = 'BASE TABLE' ORDER BY table_name";

    private static final String COLUMNS_SQL = "SELECT column_name, data_type, is_nullable,"
            + " udt_name, column_default, character_maximum_length, numeric_precision,"
            + " numeric_scale FROM information_schema.columns"
            + " WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position";

    private static final String CONSTRAINTS_SQL = "SELECT cl.relname AS table_name,"
            + " c.conname, pg_get_constraintdef(c.oid) AS definition"
            + " FROM pg_constraint c JOIN pg_class cl ON cl.oid = c.conrelid"
            + " JOIN pg_namespace n ON n.oid = c.connamespace"
            + " WHERE n.nspname = ? AND c.contype = ? ORDER BY cl.relname, c.conname";

    private static final String INDEXES_SQL = "SELECT i.tablename, i.indexname, i.indexdef"
            + " FROM pg_indexes i WHERE i.schemaname = ? AND NOT EXISTS ("
            + " SELECT 1 FROM pg_constraint c JOIN pg_namespace n ON n.oid = c.connamespace"
            + " WHERE n.nspname = i.schemaname AND c.conname = i.indexname"
            + " AND c.contype IN ('p', 'u')) ORDER BY i.tablename, i.indexname";

    private static final String VIEWS_SQL = "SELECT table_name, view_definition"
            + " FROM information_schema.views WHERE table_schema = ? ORDER BY table_name";

    private final Database database;
    private final Clock clock;

    /**
     * Collects every schema object as a DDL statement.
     *
     * @param schema schema name
     * @return statements in replay order
     * @throws SQLException if the catalog cannot be read
     */
    public List<DdlStatement> collect(String schema) throws SQLException {
        List<DdlStatement> statements = new ArrayList<>();
        String qs = TableId.quote(schema);

        log.info("Exporting extensions...");
        statements.addAll(database.query(EXTENSIONS_SQL,
                rs -> new DdlStatement(DdlStatement.Kind.EXTENSION, rs.getString("extname"), null,
                        "CREATE EXTENSION IF NOT EXISTS " + TableId.quote(rs.getString("extname"))
                                + " SCHEMA " + TableId.quote(StringUtils.defaultIfEmpty(
                                        rs.getString("extnamespace"), "public"))
                                + ";")));

        log.info("Exporting custom types...");
        statements.addAll(database.query(ENUMS_SQL, rs -> enumType(qs, rs), schema));

        log.info("Exporting sequences...");
        statements.addAll(database.query(SEQUENCES_SQL,
                rs -> new DdlStatement(DdlStatement.Kind.SEQUENCE, rs.getString("sequence_name"),
                        null,
                        "CREATE SEQUENCE IF NOT EXISTS " + qs + "."
                                + TableId.quote(rs.getString("sequence_name")) + " AS "
                                + rs.getString("data_type") + " INCREMENT "
                                + rs.getString("increment") + " MINVALUE "
                                + rs.getString("minimum_value") + " MAXVALUE "
                                + rs.getString("maximum_value") + " START "
                                + rs.getString("start_value") + ";"),
                schema));

        log.info("Exporting tables...");
        for (String table : database.query(TABLES_SQL, rs -> rs.getString(1), schema)) {
            statements.add(new DdlStatement(DdlStatement.Kind.TABLE, table, table,
                    tableDefinition(schema, table)));
        }

        log.info("Exporting constraints...");
        statements.addAll(constraints(schema, "p", DdlStatement.Kind.CONSTRAINT));
        statements.addAll(constraints(schema, "u", DdlStatement.Kind.CONSTRAINT));

        log.info("Exporting indexes...");
        statements.addAll(database.query(INDEXES_SQL,
                rs -> new DdlStatement(DdlStatement.Kind.INDEX, rs.getString("indexname"),
                        rs.getString("tablename"),
                        idempotentIndex(rs.getString("indexdef")) + ";"),
                schema));

        statements.addAll(constraints(schema, "f", DdlStatement.Kind.FOREIGN_KEY));
        statements.addAll(constraints(schema, "c", DdlStatement.Kind.CHECK));

        log.info("Exporting views...");
        statements.addAll(database.query(VIEWS_SQL,
                rs -> new DdlStatement(DdlStatement.Kind.VIEW, rs.getString("table_name"), null,
                        "CREATE OR REPLACE VIEW " + qs + "."
                                + TableId.quote(rs.getString("table_name")) + " AS\n"
                                + StringUtils.removeEnd(
                                        StringUtils.trim(rs.getString("view_definition")), ";")
                                + ";"),
                schema));

        log.info("Schema [{}]: {} objects collected", schema, statements.size());
        return statements;
    }

    /**
     * Writes {@code schema-<schema>.sql}.
     *
     * @param schema schema name
     * @param outputDir migration directory
     * @return written file
     * @throws SQLException if the catalog cannot be read
     * @throws IOException if the file cannot be written
     */
    public Path export(String schema, Path outputDir) throws SQLException, IOException {
        List<DdlStatement> statements = collect(schema);
        StringBuilder sql = new StringBuilder();
        sql.append("-- Schema: ").append(schema).append('\n');
        sql.append("-- Generated: ").append(ValueEncoder.formatTemporal(clock.instant()))
                .append("\n\n");
        sql.append("CREATE SCHEMA IF NOT EXISTS ").append(TableId.quote(schema)).append(";\n\n");
        DdlStatement.Kind section = null;
        for (DdlStatement statement : statements) {
            if (statement.getKind() != section) {
                section = statement.getKind();
                sql.append("-- ").append(StringUtils.capitalize(
                        section.name().toLowerCase(Locale.ROOT).replace('_', ' '))).append('\n');
            }
            sql.append(statement.getSql()).append("\n\n");
        }
        Path file = ArtifactLayout.schemaFile(outputDir, schema);
        FileUtils.writeStringToFile(file.toFile(), sql.toString(), StandardCharsets.UTF_8);
        log.info("Schema exported: {}", file);
        return file;
    }

    private List<DdlStatement> constraints(String schema, String contype, DdlStatement.Kind kind)
            throws SQLException {
        String qs = TableId.quote(schema);
        return database.query(CONSTRAINTS_SQL,
                rs -> new DdlStatement(kind, rs.getString("conname"), rs.getString("table_name"),
                        guarded("ALTER TABLE " + qs + "."
                                + TableId.quote(rs.getString("table_name")) + " ADD CONSTRAINT "
                                + TableId.quote(rs.getString("conname")) + " "
                                + rs.getString("definition") + ";")),
                schema, contype);
    }

    /**
     * Wraps a statement in a {@code DO} block that ignores "already exists" errors.
     *
     * @param statement DDL statement ending with {@code ;}
     * @return anonymous block
     */
    static String guarded(String statement) {
        return "DO $ddl$ BEGIN\n    " + statement + "\nEXCEPTION WHEN duplicate_object"
                + " OR duplicate_table OR invalid_table_definition THEN NULL;\nEND $ddl$;";
    }

    private static DdlStatement enumType(String quotedSchema, ResultSet rs) throws SQLException {
        String name = rs.getString("typname");
        Array labels = rs.getArray("labels");
        String values;
        try {
            Object[] raw = (Object[]) labels.getArray();
            List<String> quoted = new ArrayList<>();
            for (Object label : raw) {
                quoted.add(ValueEncoder.quote(String.valueOf(label)));
            }
            values = String.join(", ", quoted);
        } finally {
            labels.free();
        }
        // CREATE TYPE has no IF NOT EXISTS
        String create = "CREATE TYPE " + quotedSchema + "." + TableId.quote(name) + " AS ENUM ("
                + values + ");";
        return new DdlStatement(DdlStatement.Kind.TYPE, name, null, guarded(create));
    }

    private String tableDefinition(String schema, String table) throws SQLException {
        String qs = TableId.quote(schema);
        List<String> columns = database.query(COLUMNS_SQL, rs -> {
            String type = columnType(qs, rs);
            StringBuilder def = new StringBuilder("    ")
                    .append(TableId.quote(rs.getString("column_name"))).append(' ').append(type);
            String dflt = rs.getString("column_default");
            if (dflt != null) {
                def.append(" DEFAULT ").append(dflt);
            }
            if ("NO".equals(rs.getString("is_nullable"))) {
                def.append(" NOT NULL");
            }
            return def.toString();
        }, schema, table);
        return "CREATE TABLE IF NOT EXISTS " + qs + "." + TableId.quote(table) + " (\n"
                + columns.stream().collect(Collectors.joining(",\n")) + "\n);";
    }

    private static String columnType(String quotedSchema, ResultSet rs) throws SQLException {
        String type = rs.getString("data_type");
        String udt = rs.getString("udt_name");
        int charLen = rs.getInt("character_maximum_length");
        boolean hasCharLen = !rs.wasNull();
        int precision = rs.getInt("numeric_precision");
        boolean hasPrecision = !rs.wasNull();
        int scale = rs.getInt("numeric_scale");

        if ("USER-DEFINED".equals(type)) {
            return quotedSchema + "." + TableId.quote(udt);
        }
        if ("ARRAY".equals(type)) {
            // udt_name of an array is the element type prefixed with '_'
            return StringUtils.removeStart(udt, "_") + "[]";
        }
        if ("character varying".equals(type) && hasCharLen) {
            return "varchar(" + charLen + ")";
        }
        if ("character".equals(type) && hasCharLen) {
            return "char(" + charLen + ")";
        }
        if ("numeric".equals(type) && hasPrecision) {
            return scale > 0 ? "numeric(" + precision + "," + scale + ")"
                    : "numeric(" + precision + ")";
        }
        return type;
    }

    static String idempotentIndex(String indexDef) {
        return CREATE_INDEX.matcher(indexDef).replaceFirst("CREATE $1INDEX IF NOT EXISTS ");
    }
}
