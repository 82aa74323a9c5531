package io.github.yok.pgmigrator.model;

import io.github.yok.pgmigrator.parser.DataFormat;
import java.nio.file.Path;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One planned replay step: an artifact file, its category and its rank in the plan.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class MigrationStep {

    // Display name, e.g. "Schema" or "Data: users"
    private final String name;
    private final Path artifact;
    // 1-based position in the plan
    private final int rank;
    private final StepCategory category;
    private final DataFormat format;
}
