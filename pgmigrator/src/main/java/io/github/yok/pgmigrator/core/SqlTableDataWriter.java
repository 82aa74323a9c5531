package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Writes a SQL data artifact: comment header, replica role, one INSERT per row, default role.
 */
public class SqlTableDataWriter implements TableDataWriter {

    private final Writer out;
    private final Clock clock;
    private TableId table;

    public SqlTableDataWriter(Path file, Clock clock) throws IOException {
        this(Files.newBufferedWriter(file, StandardCharsets.UTF_8), clock);
    }

    SqlTableDataWriter(Writer out, Clock clock) {
        this.out = out instanceof BufferedWriter ? out : new BufferedWriter(out);
        this.clock = clock;
    }

    @Override
    public void begin(TableId table, long totalRows) throws IOException {
        this.table = table;
        out.write(SqlScripts.header(table, clock.instant(), totalRows));
        out.write("\n");
        out.write(SqlScripts.REPLICA_ROLE);
        out.write("\n\n");
    }

    @Override
    public void write(List<Row> batch) throws IOException {
        for (Row row : batch) {
            out.write(SqlScripts.insert(table, row));
            out.write("\n");
        }
    }

    @Override
    public void end() throws IOException {
        out.write("\n");
        out.write(SqlScripts.DEFAULT_ROLE);
        out.write("\n");
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
