package io.github.yok.pgmigrator.db;

import io.github.yok.pgmigrator.model.ForeignKeyEdge;
import io.github.yok.pgmigrator.model.TableId;
import java.sql.SQLException;
import java.util.List;

/**
 * Read access to the parts of the catalog needed for ordering and streaming table data.
 */
public interface CatalogReader {

    /**
     * Lists the base tables of a schema.
     *
     * @param schema schema name
     * @return table names sorted alphabetically
     * @throws SQLException if the catalog cannot be read
     */
    List<String> listTables(String schema) throws SQLException;

    /**
     * Lists the foreign-key edges whose child and parent both live in {@code schema}.
     *
     * @param schema schema name
     * @return edges, possibly including self references
     * @throws SQLException if the catalog cannot be read
     */
    List<ForeignKeyEdge> listForeignKeys(String schema) throws SQLException;

    /**
     * Returns the primary-key columns of a table in key sequence order.
     *
     * @param table table
     * @return column names, empty when the table has no primary key
     * @throws SQLException if the catalog cannot be read
     */
    List<String> primaryKeyColumns(TableId table) throws SQLException;
}
