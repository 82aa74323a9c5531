package io.github.yok.pgmigrator.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.temporal.TemporalAccessor;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * One column value tagged with its kind.
 *
 * <p>
 * The kind is decided once when the value is read from the database and drives both SQL literal
 * and JSON rendering. The payload type per kind is fixed:
 * </p>
 * <ul>
 * <li>{@link Kind#NULL}: {@code null}</li>
 * <li>{@link Kind#BOOLEAN}: {@link Boolean}</li>
 * <li>{@link Kind#NUMBER}: {@link Number}</li>
 * <li>{@link Kind#STRING}: {@link String}</li>
 * <li>{@link Kind#TIMESTAMP}: a {@link TemporalAccessor} from {@code java.time}</li>
 * <li>{@link Kind#JSON}: {@link JsonNode}</li>
 * </ul>
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public final class ColumnValue {

    /**
     * Value kinds.
     */
    public enum Kind {
        NULL, BOOLEAN, NUMBER, STRING, TIMESTAMP, JSON
    }

    private static final ColumnValue NULL_VALUE = new ColumnValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    public static ColumnValue ofNull() {
        return NULL_VALUE;
    }

    public static ColumnValue ofBoolean(boolean value) {
        return new ColumnValue(Kind.BOOLEAN, value);
    }

    public static ColumnValue ofNumber(Number value) {
        Validate.notNull(value, "number must not be null.");
        return new ColumnValue(Kind.NUMBER, value);
    }

    public static ColumnValue ofString(String value) {
        Validate.notNull(value, "string must not be null.");
        return new ColumnValue(Kind.STRING, value);
    }

    public static ColumnValue ofTimestamp(TemporalAccessor value) {
        Validate.notNull(value, "timestamp must not be null.");
        return new ColumnValue(Kind.TIMESTAMP, value);
    }

    public static ColumnValue ofJson(JsonNode value) {
        Validate.notNull(value, "json must not be null.");
        return new ColumnValue(Kind.JSON, value);
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }
}
