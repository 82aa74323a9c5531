package io.github.yok.pgmigrator.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.model.DdlStatement;
import io.github.yok.pgmigrator.model.MigrationResult;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaMigratorTest {

    private SchemaExporter schemaExporter;
    private FunctionsExporter functionsExporter;
    private TriggersExporter triggersExporter;
    private Database target;
    private SchemaMigrator migrator;

    @BeforeEach
    void setUp() {
        schemaExporter = mock(SchemaExporter.class);
        functionsExporter = mock(FunctionsExporter.class);
        triggersExporter = mock(TriggersExporter.class);
        target = mock(Database.class);
        migrator = new SchemaMigrator(schemaExporter, functionsExporter, triggersExporter, target);
    }

    @Test
    void migrateSchema_正常ケース_既存オブジェクトで失敗_警告として継続されること()
            throws Exception {
        DdlStatement users = new DdlStatement(DdlStatement.Kind.TABLE, "users", "users",
                "CREATE TABLE IF NOT EXISTS \"public\".\"users\" (id int);");
        DdlStatement pk = new DdlStatement(DdlStatement.Kind.CONSTRAINT, "users_pkey", "users",
                "ALTER TABLE \"public\".\"users\" ADD CONSTRAINT \"users_pkey\" PRIMARY KEY (id);");
        when(schemaExporter.collect("public")).thenReturn(List.of(users, pk));
        doThrow(new SQLException("multiple primary keys for table \"users\" are not allowed"))
                .when(target).execute(pk.getSql());

        MigrationResult result = migrator.migrateSchema("public", false);

        assertTrue(result.isSuccess());
        assertEquals(1L, result.getItemsProcessed());
        assertEquals("Applied 1 of 2 schema objects", result.getMessage());
        assertEquals(1, result.getWarnings().size());
        verify(target).execute("CREATE SCHEMA IF NOT EXISTS \"public\";");
        verify(target).execute(users.getSql());
    }

    @Test
    void migrateSchema_異常ケース_移行元の読込失敗_失敗結果が返ること() throws Exception {
        when(schemaExporter.collect("public")).thenThrow(new SQLException("connection refused"));

        MigrationResult result = migrator.migrateSchema("public", false);

        assertFalse(result.isSuccess());
        assertEquals(List.of("connection refused"), result.getErrors());
        verify(target, never()).execute(anyString());
    }

    @Test
    void migrateFunctions_異常ケース_一部の関数が失敗_エラーが集計され失敗となること()
            throws Exception {
        DdlStatement ok = new DdlStatement(DdlStatement.Kind.FUNCTION, "ok", null,
                "CREATE FUNCTION public.ok() RETURNS int AS $$ SELECT 1 $$ LANGUAGE sql;");
        DdlStatement bad = new DdlStatement(DdlStatement.Kind.FUNCTION, "bad", null,
                "CREATE FUNCTION public.bad() RETURNS int AS $$ SELECT x $$ LANGUAGE sql;");
        when(functionsExporter.collect("public", null)).thenReturn(List.of(ok, bad));
        doThrow(new SQLException("column \"x\" does not exist")).when(target)
                .execute("CREATE OR REPLACE FUNCTION public.bad() RETURNS int AS $$ SELECT x $$"
                        + " LANGUAGE sql;");

        MigrationResult result = migrator.migrateFunctions("public", null, false);

        assertFalse(result.isSuccess());
        assertEquals("Migrated 1 of 2 functions", result.getMessage());
        assertEquals(List.of("bad: column \"x\" does not exist"), result.getErrors());
        verify(target).execute(
                "CREATE OR REPLACE FUNCTION public.ok() RETURNS int AS $$ SELECT 1 $$ LANGUAGE sql;");
    }

    @Test
    void migrateTriggers_正常ケース_DROP_TRIGGER付きで実行されること() throws Exception {
        DdlStatement trigger = new DdlStatement(DdlStatement.Kind.TRIGGER, "trg", "users",
                "CREATE TRIGGER trg BEFORE UPDATE ON public.users "
                        + "FOR EACH ROW EXECUTE FUNCTION touch();");
        when(triggersExporter.collect("public", "trg")).thenReturn(List.of(trigger));

        MigrationResult result = migrator.migrateTriggers("public", "trg", false);

        assertTrue(result.isSuccess());
        verify(target).execute("DROP TRIGGER IF EXISTS trg ON public.users;\n"
                + trigger.getSql());
    }

    @Test
    void migrateTriggers_正常ケース_ドライラン_実行されないこと() throws Exception {
        when(triggersExporter.collect("public", null)).thenReturn(List.of(
                new DdlStatement(DdlStatement.Kind.TRIGGER, "t", "x", "CREATE TRIGGER t ...;")));

        MigrationResult result = migrator.migrateTriggers("public", null, true);

        assertTrue(result.isSuccess());
        assertEquals(1L, result.getItemsProcessed());
        verify(target, never()).execute(anyString());
    }
}
