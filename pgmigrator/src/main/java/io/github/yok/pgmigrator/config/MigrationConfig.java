package io.github.yok.pgmigrator.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds defaults for export, import and live migration runs.
 *
 * <p>
 * You can specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code migration.schema}: schema to migrate (default {@code public})</li>
 * <li>{@code migration.output-dir}: directory that receives or provides artifacts</li>
 * <li>{@code migration.batch-size}: rows fetched per page while streaming a table</li>
 * <li>{@code migration.format}: data artifact format, {@code sql} or {@code json}</li>
 * <li>{@code migration.dry-run}: log statements instead of executing them</li>
 * <li>{@code migration.truncate}: truncate target tables before a live data copy</li>
 * <li>{@code migration.include-data} / {@code migration.data-only}: export scope</li>
 * <li>{@code migration.exclude-tables}: tables skipped by data export and copy</li>
 * <li>{@code migration.display-line-limit}: lines of SQL shown per step in dry-run</li>
 * <li>{@code migration.max-dependency-depth}: depth cap of the dependency resolver</li>
 * <li>{@code migration.progress-interval}: batches between progress log lines</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "migration")
@Getter
@Setter
@NoArgsConstructor
public class MigrationConfig {

    private String schema = "public";

    private String outputDir = "./pg-migrator";

    private int batchSize = 1000;

    private String format = "sql";

    private boolean dryRun;

    private boolean truncate;

    private boolean includeData = true;

    private boolean dataOnly;

    /**
     * Table names excluded from data export and copy.
     */
    private List<String> excludeTables = ImmutableList.of();

    private int displayLineLimit = 20;

    private int maxDependencyDepth = 20;

    private int progressInterval = 10;
}
