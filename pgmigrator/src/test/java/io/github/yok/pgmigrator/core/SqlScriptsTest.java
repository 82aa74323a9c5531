package io.github.yok.pgmigrator.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import io.github.yok.pgmigrator.model.ColumnValue;
import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SqlScriptsTest {

    private static final TableId USERS = TableId.of("public", "users");

    @Test
    void insert_正常ケース_列順どおりに引用符付きで出力されること() {
        Row row = Row.builder().set("id", ColumnValue.ofNumber(1))
                .set("name", ColumnValue.ofString("Ann")).set("deleted_at", ColumnValue.ofNull())
                .build();

        assertEquals("INSERT INTO \"public\".\"users\" (\"id\", \"name\", \"deleted_at\") "
                + "VALUES (1, 'Ann', NULL) ON CONFLICT DO NOTHING;", SqlScripts.insert(USERS, row));
    }

    @Test
    void header_正常ケース_テーブル名生成日時件数が出力されること() {
        assertEquals("-- Data for table: public.users\n"
                + "-- Generated: 2024-05-01T00:00:00.000Z\n" + "-- Total rows: 3\n",
                SqlScripts.header(USERS, Instant.parse("2024-05-01T00:00:00Z"), 3));
    }

    @Test
    void truncateCascade_正常ケース_CASCADE付きで出力されること() {
        assertEquals("TRUNCATE TABLE \"public\".\"users\" CASCADE;",
                SqlScripts.truncateCascade(USERS));
    }
}
