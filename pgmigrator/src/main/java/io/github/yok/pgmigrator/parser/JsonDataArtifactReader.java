package io.github.yok.pgmigrator.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.pgmigrator.core.SqlScripts;
import io.github.yok.pgmigrator.model.ColumnValue;
import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a JSON data artifact into a replayable SQL script.
 *
 * <p>
 * The artifact must hold one top-level array of flat objects. Each object becomes a
 * conflict-tolerant INSERT; the script is wrapped in the same session replication role statements
 * as a SQL data artifact. An empty array yields an empty script.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class JsonDataArtifactReader {

    private final ObjectMapper objectMapper;

    /**
     * Reads a JSON artifact and renders it as SQL.
     *
     * @param table target table
     * @param file JSON artifact
     * @return SQL script, empty when the array has no elements
     * @throws IOException if the file cannot be read or is not an array of objects
     */
    public String toSql(TableId table, File file) throws IOException {
        JsonNode root = objectMapper.readTree(file);
        if (root == null || root.isMissingNode()) {
            return "";
        }
        if (!root.isArray()) {
            throw new IOException("JSON data artifact must be an array: " + file.getName());
        }
        if (root.size() == 0) {
            return "";
        }

        StringBuilder sql = new StringBuilder();
        sql.append(SqlScripts.REPLICA_ROLE).append("\n\n");
        for (JsonNode element : root) {
            if (!element.isObject()) {
                throw new IOException("JSON data artifact element is not an object: "
                        + file.getName());
            }
            sql.append(SqlScripts.insert(table, toRow(element))).append('\n');
        }
        sql.append('\n').append(SqlScripts.DEFAULT_ROLE).append('\n');
        log.debug("Converted {} JSON rows for {}", root.size(), table);
        return sql.toString();
    }

    private static Row toRow(JsonNode object) {
        Row.Builder builder = Row.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.set(field.getKey(), toValue(field.getValue()));
        }
        return builder.build();
    }

    private static ColumnValue toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return ColumnValue.ofNull();
        }
        if (node.isBoolean()) {
            return ColumnValue.ofBoolean(node.booleanValue());
        }
        if (node.isNumber()) {
            return ColumnValue.ofNumber(node.decimalValue());
        }
        if (node.isTextual()) {
            return ColumnValue.ofString(node.textValue());
        }
        // Nested values are not written by the exporter but are accepted as JSON text.
        return ColumnValue.ofJson(node);
    }
}
