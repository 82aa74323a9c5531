package io.github.yok.pgmigrator.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.pgmigrator.model.ColumnValue;
import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import io.github.yok.pgmigrator.parser.JsonMappers;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonTableDataWriterTest {

    private final ObjectMapper mapper = JsonMappers.create();

    @Test
    void write_正常ケース_複数行_配列形式で出力されること() throws Exception {
        StringWriter out = new StringWriter();
        try (JsonTableDataWriter writer = new JsonTableDataWriter(out, mapper)) {
            writer.begin(TableId.of("public", "users"), 2);
            writer.write(List.of(
                    Row.builder().set("id", ColumnValue.ofNumber(1))
                            .set("name", ColumnValue.ofString("Ann")).build(),
                    Row.builder().set("id", ColumnValue.ofNumber(2))
                            .set("name", ColumnValue.ofNull()).build()));
            writer.end();
        }

        assertEquals("[\n  {\"id\":1,\"name\":\"Ann\"},\n  {\"id\":2,\"name\":null}\n]\n",
                out.toString());
    }

    @Test
    void write_正常ケース_バッチをまたぐ_区切りのカンマが正しく入ること() throws Exception {
        StringWriter out = new StringWriter();
        try (JsonTableDataWriter writer = new JsonTableDataWriter(out, mapper)) {
            writer.begin(TableId.of("public", "t"), 2);
            writer.write(List.of(Row.builder().set("v", ColumnValue.ofBoolean(true)).build()));
            writer.write(List.of(Row.builder()
                    .set("v", ColumnValue.ofNumber(new BigDecimal("1E+3"))).build()));
            writer.end();
        }

        JsonNode array = mapper.readTree(out.toString());
        assertEquals(2, array.size());
        assertEquals("[\n  {\"v\":true},\n  {\"v\":1000}\n]\n", out.toString());
    }

    @Test
    void write_正常ケース_行なし_空配列が出力されること() throws Exception {
        StringWriter out = new StringWriter();
        try (JsonTableDataWriter writer = new JsonTableDataWriter(out, mapper)) {
            writer.begin(TableId.of("public", "t"), 0);
            writer.end();
        }

        assertEquals("[\n]\n", out.toString());
    }
}
