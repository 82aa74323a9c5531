package io.github.yok.pgmigrator.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.yok.pgmigrator.model.ColumnValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import lombok.Generated;

/**
 * Converts tagged column values into SQL literals and JSON nodes.
 *
 * <h2>SQL literals</h2>
 * <ul>
 * <li>NULL: {@code NULL}</li>
 * <li>BOOLEAN: {@code true} / {@code false}</li>
 * <li>NUMBER: plain decimal text without exponent; {@code NaN} and infinities are quoted</li>
 * <li>TIMESTAMP: ISO-8601 text in single quotes; instants in UTC with milliseconds and {@code Z}
 * (e.g. {@code '2024-01-01T12:00:00.000Z'})</li>
 * <li>JSON: compact serialization in single quotes</li>
 * <li>STRING: the text in single quotes</li>
 * </ul>
 *
 * <p>
 * Every quoted literal doubles embedded single quotes.
 * </p>
 *
 * <h2>JSON</h2>
 *
 * <p>
 * Null, booleans, numbers and strings map to native JSON; temporal and composite values are written
 * in their string form so that every row object stays flat.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueEncoder {

    private static final DateTimeFormatter INSTANT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter LOCAL_DATE_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");
    private static final DateTimeFormatter LOCAL_TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSS");
    private static final DateTimeFormatter OFFSET_TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSSXXX");

    @Generated
    private ValueEncoder() {}

    /**
     * Renders a value as a SQL literal.
     *
     * @param value tagged value
     * @return SQL literal text
     */
    public static String toSqlLiteral(ColumnValue value) {
        switch (value.getKind()) {
            case NULL:
                return "NULL";
            case BOOLEAN:
                return ((Boolean) value.getValue()) ? "true" : "false";
            case NUMBER:
                return numberLiteral((Number) value.getValue());
            case TIMESTAMP:
                return quote(formatTemporal((TemporalAccessor) value.getValue()));
            case JSON:
                return quote(compactJson((JsonNode) value.getValue()));
            case STRING:
            default:
                return quote(String.valueOf(value.getValue()));
        }
    }

    /**
     * Renders a value as a flat JSON node.
     *
     * @param value tagged value
     * @return JSON node
     */
    public static JsonNode toJsonNode(ColumnValue value) {
        switch (value.getKind()) {
            case NULL:
                return NullNode.getInstance();
            case BOOLEAN:
                return BooleanNode.valueOf((Boolean) value.getValue());
            case NUMBER:
                return numberNode((Number) value.getValue());
            case TIMESTAMP:
                return TextNode.valueOf(formatTemporal((TemporalAccessor) value.getValue()));
            case JSON:
                return TextNode.valueOf(compactJson((JsonNode) value.getValue()));
            case STRING:
            default:
                return TextNode.valueOf(String.valueOf(value.getValue()));
        }
    }

    /**
     * Wraps text in single quotes, doubling embedded single quotes.
     *
     * @param text raw text
     * @return quoted literal
     */
    public static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    /**
     * Formats a {@code java.time} value as ISO-8601 text.
     *
     * @param temporal temporal value
     * @return ISO-8601 text
     */
    public static String formatTemporal(TemporalAccessor temporal) {
        if (temporal instanceof Instant) {
            return INSTANT_FORMAT.format(temporal);
        }
        if (temporal instanceof OffsetDateTime) {
            return INSTANT_FORMAT.format(((OffsetDateTime) temporal).toInstant());
        }
        if (temporal instanceof ZonedDateTime) {
            return INSTANT_FORMAT.format(((ZonedDateTime) temporal).toInstant());
        }
        if (temporal instanceof LocalDateTime) {
            return LOCAL_DATE_TIME_FORMAT.format(temporal);
        }
        if (temporal instanceof LocalDate) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(temporal);
        }
        if (temporal instanceof LocalTime) {
            return LOCAL_TIME_FORMAT.format(temporal);
        }
        if (temporal instanceof OffsetTime) {
            return OFFSET_TIME_FORMAT.format(temporal);
        }
        return temporal.toString();
    }

    private static String numberLiteral(Number number) {
        if (isNonFinite(number)) {
            return quote(nonFiniteText(number.doubleValue()));
        }
        return plainText(number);
    }

    private static JsonNode numberNode(Number number) {
        if (isNonFinite(number)) {
            return TextNode.valueOf(nonFiniteText(number.doubleValue()));
        }
        if (number instanceof BigDecimal) {
            return DecimalNode.valueOf((BigDecimal) number);
        }
        if (number instanceof BigInteger) {
            return JsonNodeFactory.instance.numberNode((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            return DoubleNode.valueOf(number.doubleValue());
        }
        return LongNode.valueOf(number.longValue());
    }

    private static String plainText(Number number) {
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).toPlainString();
        }
        if (number instanceof Double || number instanceof Float) {
            // Double.toString may use exponent notation
            return new BigDecimal(number.toString()).toPlainString();
        }
        return number.toString();
    }

    private static boolean isNonFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d);
        }
        return false;
    }

    private static String nonFiniteText(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        return d > 0 ? "Infinity" : "-Infinity";
    }

    private static String compactJson(JsonNode node) {
        // JsonNode#toString produces compact, valid JSON
        return node.toString();
    }
}
