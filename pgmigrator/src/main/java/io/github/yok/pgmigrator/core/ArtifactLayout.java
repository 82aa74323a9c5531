package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.TableId;
import io.github.yok.pgmigrator.parser.DataFormat;
import java.nio.file.Path;
import lombok.Generated;

/**
 * File names of the migration artifacts inside a migration directory.
 *
 * <pre>
 * schema-&lt;schema&gt;.sql
 * functions-&lt;schema&gt;.sql
 * triggers-&lt;schema&gt;.sql
 * data/&lt;schema&gt;.&lt;table&gt;.sql|json
 * data/table-ordering.txt
 * </pre>
 */
public final class ArtifactLayout {

    public static final String DATA_DIR = "data";

    @Generated
    private ArtifactLayout() {}

    public static Path schemaFile(Path dir, String schema) {
        return dir.resolve("schema-" + schema + ".sql");
    }

    public static Path functionsFile(Path dir, String schema) {
        return dir.resolve("functions-" + schema + ".sql");
    }

    public static Path triggersFile(Path dir, String schema) {
        return dir.resolve("triggers-" + schema + ".sql");
    }

    public static Path dataDir(Path dir) {
        return dir.resolve(DATA_DIR);
    }

    public static Path dataFile(Path dir, TableId table, DataFormat format) {
        return dataDir(dir).resolve(table + "." + format.extension());
    }
}
