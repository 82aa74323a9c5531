package io.github.yok.pgmigrator.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported data artifact formats.
 *
 * <p>
 * {@link #SQL} artifacts hold replayable INSERT scripts; {@link #JSON} artifacts hold one array of
 * flat row objects per table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Conflict-tolerant INSERT script.
    SQL("sql"),

    // Array of flat JSON objects.
    JSON("json");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * @return the canonical extension written on export
     */
    public String extension() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a format from its name or extension.
     *
     * @param value {@code sql} or {@code json}, case-insensitive
     * @return format
     * @throws IllegalArgumentException if the value names no supported format
     */
    public static DataFormat fromName(String value) {
        for (DataFormat format : values()) {
            if (format.matches(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported data format: " + value);
    }
}
