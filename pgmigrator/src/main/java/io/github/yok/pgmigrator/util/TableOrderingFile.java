package io.github.yok.pgmigrator.util;

import io.github.yok.pgmigrator.model.TableId;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads and writes {@code table-ordering.txt}, the dependency order captured at export time.
 *
 * <p>
 * The file sits beside the data artifacts and holds one {@code schema.table} per line, parents
 * before children. The step planner uses it to order data steps when present.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class TableOrderingFile {

    public static final String FILE_NAME = "table-ordering.txt";

    private TableOrderingFile() {
        // Utility class; do not instantiate.
    }

    /**
     * Writes the ordered table list, replacing any existing file.
     *
     * @param dir data artifact directory
     * @param tables tables in dependency order
     * @throws IOException if the file cannot be written
     */
    public static void write(File dir, List<TableId> tables) throws IOException {
        File orderFile = new File(dir, FILE_NAME);
        String content = tables.stream().map(TableId::toString)
                .collect(Collectors.joining(System.lineSeparator()));
        FileUtils.writeStringToFile(orderFile, content, StandardCharsets.UTF_8);
        log.info("Generated {}: {}", FILE_NAME, orderFile.getAbsolutePath());
    }

    /**
     * Reads the ordered table list. Blank lines and {@code #} comments are ignored.
     *
     * @param dir data artifact directory
     * @return tables in recorded order, or empty when the file does not exist
     * @throws IOException if the file exists but cannot be read
     */
    public static Optional<List<TableId>> read(File dir) throws IOException {
        File orderFile = new File(dir, FILE_NAME);
        if (!orderFile.isFile()) {
            return Optional.empty();
        }
        List<TableId> tables = new ArrayList<>();
        for (String line : FileUtils.readLines(orderFile, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (StringUtils.isEmpty(trimmed) || trimmed.startsWith("#")) {
                continue;
            }
            if (!trimmed.contains(".")) {
                log.warn("Ignoring malformed line in {}: {}", FILE_NAME, trimmed);
                continue;
            }
            tables.add(TableId.parse(trimmed));
        }
        return Optional.of(tables);
    }
}
