package io.github.yok.pgmigrator.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Foreign-key dependency: {@code child} holds a foreign key that references {@code parent}.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ForeignKeyEdge {

    private final String child;
    private final String parent;

    /**
     * @return {@code true} if the key references its own table
     */
    public boolean isSelfReference() {
        return child.equals(parent);
    }
}
