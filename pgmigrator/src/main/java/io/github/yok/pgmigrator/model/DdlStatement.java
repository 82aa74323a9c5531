package io.github.yok.pgmigrator.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One catalog object rendered as DDL. {@code table} is the owning table for constraints, indexes
 * and triggers, otherwise {@code null}.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class DdlStatement {

    /**
     * Catalog object kinds, in the order the schema exporter emits them.
     */
    public enum Kind {
        EXTENSION, TYPE, SEQUENCE, TABLE, CONSTRAINT, INDEX, FOREIGN_KEY, CHECK, VIEW, FUNCTION,
        TRIGGER
    }

    private final Kind kind;
    private final String name;
    private final String table;
    private final String sql;
}
