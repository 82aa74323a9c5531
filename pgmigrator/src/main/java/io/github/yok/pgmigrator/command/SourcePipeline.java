package io.github.yok.pgmigrator.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.pgmigrator.config.MigrationConfig;
import io.github.yok.pgmigrator.core.JdbcRowSource;
import io.github.yok.pgmigrator.core.RowSource;
import io.github.yok.pgmigrator.core.TableDataStreamer;
import io.github.yok.pgmigrator.db.ColumnValueReader;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.db.JdbcCatalogReader;
import io.github.yok.pgmigrator.util.TableDependencyResolver;
import lombok.Getter;

/**
 * Read-side components bound to one source database.
 */
@Getter
class SourcePipeline {

    private final RowSource rowSource;
    private final TableDependencyResolver resolver;
    private final TableDataStreamer streamer;

    SourcePipeline(Database source, MigrationConfig config, int batchSize,
            ObjectMapper objectMapper) {
        JdbcCatalogReader catalog = new JdbcCatalogReader(source);
        this.rowSource = new JdbcRowSource(source, catalog, new ColumnValueReader(objectMapper));
        this.resolver = new TableDependencyResolver(catalog, config.getMaxDependencyDepth());
        this.streamer = new TableDataStreamer(rowSource,
                batchSize > 0 ? batchSize : config.getBatchSize(), config.getProgressInterval());
    }
}
