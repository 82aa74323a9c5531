package io.github.yok.pgmigrator.model;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Ordered mapping of column name to {@link ColumnValue} for one table row.
 *
 * <p>
 * Iteration order is the column order of the source result set.
 * </p>
 */
@EqualsAndHashCode
@ToString
public final class Row {

    private final Map<String, ColumnValue> values;

    public Row(Map<String, ColumnValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public List<String> getColumnNames() {
        return ImmutableList.copyOf(values.keySet());
    }

    /**
     * Returns the value of a column, or a NULL value when the column is absent.
     *
     * @param column column name
     * @return value
     */
    public ColumnValue get(String column) {
        ColumnValue value = values.get(column);
        return value != null ? value : ColumnValue.ofNull();
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public Map<String, ColumnValue> asMap() {
        return values;
    }

    /**
     * @return a builder keeping insertion order
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Incremental builder for {@link Row}.
     */
    public static final class Builder {

        private final Map<String, ColumnValue> values = new LinkedHashMap<>();

        public Builder set(String column, ColumnValue value) {
            values.put(column, value);
            return this;
        }

        public Row build() {
            return new Row(values);
        }
    }
}
