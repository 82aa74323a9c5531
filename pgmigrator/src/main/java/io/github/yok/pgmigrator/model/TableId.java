package io.github.yok.pgmigrator.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Identifies one table by schema and table name.
 *
 * <p>
 * {@link #toString()} returns the dotted form {@code schema.table} used in artifact names and in
 * {@code table-ordering.txt}; {@link #quoted()} returns the SQL form {@code "schema"."table"}.
 * </p>
 */
@Getter
@EqualsAndHashCode
public final class TableId implements Comparable<TableId> {

    private final String schema;
    private final String table;

    private TableId(String schema, String table) {
        this.schema = schema;
        this.table = table;
    }

    /**
     * Creates a table identifier.
     *
     * @param schema schema name
     * @param table table name
     * @return identifier
     */
    public static TableId of(String schema, String table) {
        Validate.notBlank(schema, "schema must not be blank.");
        Validate.notBlank(table, "table must not be blank.");
        return new TableId(schema, table);
    }

    /**
     * Parses the dotted form {@code schema.table}. The schema is everything before the first dot.
     *
     * @param dotted dotted name
     * @return identifier
     */
    public static TableId parse(String dotted) {
        Validate.isTrue(StringUtils.contains(dotted, '.'), "Not a qualified table name: %s",
                dotted);
        return of(StringUtils.substringBefore(dotted, "."),
                StringUtils.substringAfter(dotted, "."));
    }

    /**
     * Quotes a single identifier, doubling embedded double quotes.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    public static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /**
     * @return {@code "schema"."table"}
     */
    public String quoted() {
        return quote(schema) + '.' + quote(table);
    }

    @Override
    public int compareTo(TableId other) {
        int bySchema = schema.compareTo(other.schema);
        return bySchema != 0 ? bySchema : table.compareTo(other.table);
    }

    @Override
    public String toString() {
        return schema + '.' + table;
    }
}
