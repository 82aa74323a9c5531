package io.github.yok.pgmigrator.db;

import io.github.yok.pgmigrator.model.ForeignKeyEdge;
import io.github.yok.pgmigrator.model.TableId;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link CatalogReader} backed by JDBC {@link DatabaseMetaData}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcCatalogReader implements CatalogReader {

    private final Database database;

    @Override
    public List<String> listTables(String schema) throws SQLException {
        DatabaseMetaData meta = database.getMetaData();
        List<String> tables = new ArrayList<>();
        String schemaPattern = literalPattern(schema, meta.getSearchStringEscape());
        try (ResultSet rs =
                meta.getTables(null, schemaPattern, "%", new String[] {"TABLE"})) {
            while (rs.next()) {
                tables.add(rs.getString("TABLE_NAME"));
            }
        }
        Collections.sort(tables);
        log.debug("Schema [{}] base tables: {}", schema, tables);
        return tables;
    }

    /**
     * Escapes the LIKE wildcards of a name so metadata lookups match it literally.
     *
     * @param name schema or table name
     * @param escape the driver's search string escape, or {@code null} when it has none
     * @return pattern matching only {@code name}
     */
    static String literalPattern(String name, String escape) {
        if (name == null || StringUtils.isEmpty(escape)) {
            return name;
        }
        return StringUtils.replaceEach(name, new String[] {escape, "_", "%"},
                new String[] {escape + escape, escape + "_", escape + "%"});
    }

    @Override
    public List<ForeignKeyEdge> listForeignKeys(String schema) throws SQLException {
        DatabaseMetaData meta = database.getMetaData();
        List<ForeignKeyEdge> edges = new ArrayList<>();
        for (String child : listTables(schema)) {
            try (ResultSet rs = meta.getImportedKeys(null, schema, child)) {
                while (rs.next()) {
                    String parentSchema = rs.getString("PKTABLE_SCHEM");
                    String parent = rs.getString("PKTABLE_NAME");
                    if (parent == null || !schema.equals(parentSchema)) {
                        continue;
                    }
                    edges.add(new ForeignKeyEdge(child, parent));
                }
            }
        }
        return edges;
    }

    @Override
    public List<String> primaryKeyColumns(TableId table) throws SQLException {
        DatabaseMetaData meta = database.getMetaData();
        Map<Integer, String> bySeq = new TreeMap<>();
        try (ResultSet rs = meta.getPrimaryKeys(null, table.getSchema(), table.getTable())) {
            while (rs.next()) {
                bySeq.put(rs.getInt("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(bySeq.values());
    }
}
