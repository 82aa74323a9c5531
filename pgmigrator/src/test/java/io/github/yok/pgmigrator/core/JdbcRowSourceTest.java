package io.github.yok.pgmigrator.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.pgmigrator.db.CatalogReader;
import io.github.yok.pgmigrator.db.ColumnValueReader;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.db.ResultSetMapper;
import io.github.yok.pgmigrator.model.TableId;
import io.github.yok.pgmigrator.parser.JsonMappers;
import java.util.List;
import org.junit.jupiter.api.Test;

class JdbcRowSourceTest {

    private static final TableId ITEMS = TableId.of("public", "order_items");

    @Test
    void selectPage_正常ケース_主キーあり_ORDER_BY付きで生成されること() {
        assertEquals("SELECT * FROM \"public\".\"order_items\" ORDER BY \"order_id\", \"line_no\""
                + " LIMIT ? OFFSET ?",
                JdbcRowSource.selectPage(ITEMS, List.of("order_id", "line_no")));
    }

    @Test
    void selectPage_正常ケース_主キーなし_ORDER_BYなしで生成されること() {
        assertEquals("SELECT * FROM \"public\".\"order_items\" LIMIT ? OFFSET ?",
                JdbcRowSource.selectPage(ITEMS, List.of()));
    }

    @Test
    void count_正常ケース_引用符付きのCOUNTクエリが発行されること() throws Exception {
        Database database = mock(Database.class);
        when(database.queryForLong("SELECT COUNT(*) FROM \"public\".\"order_items\""))
                .thenReturn(42L);
        JdbcRowSource source = new JdbcRowSource(database, mock(CatalogReader.class),
                new ColumnValueReader(JsonMappers.create()));

        assertEquals(42L, source.count(ITEMS));
    }

    @SuppressWarnings("unchecked")
    @Test
    void fetch_正常ケース_LIMITとOFFSETがパラメータで渡されること() throws Exception {
        Database database = mock(Database.class);
        JdbcRowSource source = new JdbcRowSource(database, mock(CatalogReader.class),
                new ColumnValueReader(JsonMappers.create()));

        source.fetch(ITEMS, List.of("order_id"), 500, 1500L);

        verify(database).query(eq("SELECT * FROM \"public\".\"order_items\" ORDER BY "
                + "\"order_id\" LIMIT ? OFFSET ?"), any(ResultSetMapper.class), eq(500),
                eq(1500L));
    }
}
