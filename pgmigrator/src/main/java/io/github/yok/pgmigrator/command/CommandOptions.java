package io.github.yok.pgmigrator.command;

import io.github.yok.pgmigrator.config.ConnectionConfig;
import io.github.yok.pgmigrator.config.MigrationConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options of one command run: configuration defaults overridden by command-line arguments.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CommandOptions {

    private String command;
    private String source;
    private String target;
    // migration directory: export output and import input
    private String dir;
    private String schema;
    private String table;
    private String function;
    private String trigger;
    private String format;
    private int batchSize;
    private boolean dryRun;
    private boolean truncate;
    private boolean includeData;
    private boolean dataOnly;

    /**
     * Builds options holding the configured defaults.
     *
     * @param connections connection settings
     * @param migration migration settings
     * @return options without a command
     */
    public static CommandOptions defaults(ConnectionConfig connections,
            MigrationConfig migration) {
        return CommandOptions.builder().source(connections.getSource())
                .target(connections.getTarget()).dir(migration.getOutputDir())
                .schema(migration.getSchema()).format(migration.getFormat())
                .batchSize(migration.getBatchSize()).dryRun(migration.isDryRun())
                .truncate(migration.isTruncate()).includeData(migration.isIncludeData())
                .dataOnly(migration.isDataOnly()).build();
    }
}
