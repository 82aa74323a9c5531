package io.github.yok.pgmigrator.parser;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Generated;

/**
 * Factory for the {@link ObjectMapper} used for JSON artifacts and JSON column values.
 *
 * <p>
 * Decimal numbers are read as {@link java.math.BigDecimal} and written without exponent so that
 * {@code numeric} values keep their precision through a JSON artifact.
 * </p>
 */
public final class JsonMappers {

    @Generated
    private JsonMappers() {}

    /**
     * @return a new, fully configured mapper
     */
    public static ObjectMapper create() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }
}
