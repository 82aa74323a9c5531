package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.MigrationStep;
import io.github.yok.pgmigrator.model.StepCategory;
import io.github.yok.pgmigrator.model.TableId;
import io.github.yok.pgmigrator.parser.DataFormat;
import io.github.yok.pgmigrator.util.TableOrderingFile;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Discovers the artifacts of one schema in a migration directory and orders them for replay.
 *
 * <p>
 * Order: {@code schema-<schema>.sql} (rank 1), {@code functions-<schema>.sql} (rank 2),
 * {@code triggers-<schema>.sql} (rank 3), then one step per table found under
 * {@code data/<schema>.<table>.sql|json} (ranks 4..N). Missing artifacts are simply not planned.
 * </p>
 *
 * <p>
 * Data steps follow {@code data/table-ordering.txt} when present; tables not listed there follow in
 * lexical order of their file names, as do all tables when the file is absent. When a table has
 * both a SQL and a JSON artifact, the SQL artifact is used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MigrationStepPlanner {

    static final int SCHEMA_RANK = 1;
    static final int FUNCTIONS_RANK = 2;
    static final int TRIGGERS_RANK = 3;
    static final int FIRST_DATA_RANK = 4;

    /**
     * Plans the steps for one schema.
     *
     * @param migrationDir migration directory
     * @param schema schema name
     * @return steps ordered by rank; empty when the directory is missing or holds no artifacts
     * @throws IOException if the data directory or ordering file cannot be read
     */
    public List<MigrationStep> plan(Path migrationDir, String schema) throws IOException {
        List<MigrationStep> steps = new ArrayList<>();
        if (!Files.isDirectory(migrationDir)) {
            log.warn("Migration directory not found: {}", migrationDir);
            return steps;
        }

        addIfPresent(steps, "Schema", ArtifactLayout.schemaFile(migrationDir, schema),
                SCHEMA_RANK, StepCategory.SCHEMA);
        addIfPresent(steps, "Functions", ArtifactLayout.functionsFile(migrationDir, schema),
                FUNCTIONS_RANK, StepCategory.FUNCTIONS);
        addIfPresent(steps, "Triggers", ArtifactLayout.triggersFile(migrationDir, schema),
                TRIGGERS_RANK, StepCategory.TRIGGERS);

        // ranks stay fixed whether or not the catalog artifacts exist
        int rank = FIRST_DATA_RANK;
        Map<String, Path> dataFiles = discoverDataFiles(migrationDir, schema);
        for (Map.Entry<String, Path> entry : orderDataFiles(migrationDir, dataFiles).entrySet()) {
            Path file = entry.getValue();
            DataFormat format =
                    DataFormat.fromName(FilenameUtils.getExtension(file.getFileName().toString()));
            steps.add(new MigrationStep("Data: " + entry.getKey(), file, rank++,
                    StepCategory.DATA, format));
        }

        if (steps.isEmpty()) {
            log.warn("No migration artifacts for schema [{}] in {}", schema, migrationDir);
        } else {
            log.info("Planned {} steps for schema [{}]", steps.size(), schema);
        }
        return steps;
    }

    private static void addIfPresent(List<MigrationStep> steps, String name, Path file, int rank,
            StepCategory category) {
        if (Files.isRegularFile(file)) {
            steps.add(new MigrationStep(name, file, rank, category, DataFormat.SQL));
        }
    }

    /**
     * Finds data artifacts of the schema keyed by table name in lexical file order, preferring SQL
     * over JSON.
     */
    private static Map<String, Path> discoverDataFiles(Path migrationDir, String schema) {
        File dataDir = ArtifactLayout.dataDir(migrationDir).toFile();
        File[] files = dataDir.listFiles(File::isFile);
        Map<String, Path> byTable = new TreeMap<>();
        if (files == null) {
            return byTable;
        }
        String prefix = schema + ".";
        // file name -> file, lexical
        Map<String, File> sorted = new TreeMap<>();
        for (File f : files) {
            sorted.put(f.getName(), f);
        }
        for (File f : sorted.values()) {
            String name = f.getName();
            String ext = FilenameUtils.getExtension(name);
            if (!name.startsWith(prefix)
                    || !(DataFormat.SQL.matches(ext) || DataFormat.JSON.matches(ext))) {
                continue;
            }
            String table = FilenameUtils.getBaseName(name).substring(prefix.length());
            if (table.isEmpty()) {
                continue;
            }
            Path existing = byTable.get(table);
            if (existing == null || DataFormat.SQL.matches(ext)) {
                byTable.put(table, f.toPath());
            }
        }
        return byTable;
    }

    private static Map<String, Path> orderDataFiles(Path migrationDir,
            Map<String, Path> dataFiles) throws IOException {
        Optional<List<TableId>> recorded =
                TableOrderingFile.read(ArtifactLayout.dataDir(migrationDir).toFile());
        if (recorded.isEmpty()) {
            return dataFiles;
        }
        Map<String, Path> ordered = new LinkedHashMap<>();
        Map<String, Path> remaining = new TreeMap<>(dataFiles);
        for (TableId table : recorded.get()) {
            Path file = remaining.remove(table.getTable());
            if (file != null) {
                ordered.put(table.getTable(), file);
            }
        }
        ordered.putAll(remaining);
        return ordered;
    }
}
