package io.github.yok.pgmigrator.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a JSON data artifact: one top-level array holding a flat object per row.
 *
 * <p>
 * Output shape is {@code [\n  {...},\n  {...}\n]\n}; with no rows it is {@code [\n]\n}.
 * </p>
 */
public class JsonTableDataWriter implements TableDataWriter {

    private final Writer out;
    private final ObjectMapper objectMapper;
    private boolean firstRow = true;

    public JsonTableDataWriter(Path file, ObjectMapper objectMapper) throws IOException {
        this(Files.newBufferedWriter(file, StandardCharsets.UTF_8), objectMapper);
    }

    JsonTableDataWriter(Writer out, ObjectMapper objectMapper) {
        this.out = out instanceof BufferedWriter ? out : new BufferedWriter(out);
        this.objectMapper = objectMapper;
    }

    @Override
    public void begin(TableId table, long totalRows) throws IOException {
        out.write("[\n");
    }

    @Override
    public void write(List<Row> batch) throws IOException {
        for (Row row : batch) {
            ObjectNode node = objectMapper.createObjectNode();
            for (String column : row.getColumnNames()) {
                node.set(column, ValueEncoder.toJsonNode(row.get(column)));
            }
            out.write(firstRow ? "  " : ",\n  ");
            out.write(objectMapper.writeValueAsString(node));
            firstRow = false;
        }
    }

    @Override
    public void end() throws IOException {
        out.write(firstRow ? "]\n" : "\n]\n");
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
