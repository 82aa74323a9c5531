package io.github.yok.pgmigrator.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.model.MigrationStep;
import io.github.yok.pgmigrator.model.StepCategory;
import io.github.yok.pgmigrator.model.StepResult;
import io.github.yok.pgmigrator.model.StepStatus;
import io.github.yok.pgmigrator.parser.DataFormat;
import io.github.yok.pgmigrator.parser.JsonDataArtifactReader;
import io.github.yok.pgmigrator.parser.JsonMappers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

class MigrationExecutorTest {

    @TempDir
    Path dir;

    private Database target;
    private MigrationListener listener;
    private final JsonDataArtifactReader jsonReader =
            new JsonDataArtifactReader(JsonMappers.create());

    @BeforeEach
    void setUp() {
        target = mock(Database.class);
        listener = mock(MigrationListener.class);
    }

    private MigrationStep step(String file, String content, int rank, StepCategory category,
            DataFormat format) throws IOException {
        Path path = dir.resolve(file);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        return new MigrationStep(file, path, rank, category, format);
    }

    private MigrationExecutor executor(boolean dryRun) {
        return new MigrationExecutor(target, dryRun, 20, listener, jsonReader);
    }

    @Test
    void execute_正常ケース_全ステップ成功_変換後のSQLが順に実行されること() throws Exception {
        List<MigrationStep> steps = List.of(
                step("schema-public.sql", "CREATE SCHEMA public;", 1, StepCategory.SCHEMA,
                        DataFormat.SQL),
                step("functions-public.sql", "CREATE FUNCTION f() RETURNS int AS $$ 1 $$;", 2,
                        StepCategory.FUNCTIONS, DataFormat.SQL));

        List<StepResult> results = executor(false).execute(steps);

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(r -> r.getStatus() == StepStatus.SUCCEEDED));
        verify(target).execute("CREATE SCHEMA IF NOT EXISTS public;");
        verify(target).execute("CREATE OR REPLACE FUNCTION f() RETURNS int AS $$ 1 $$;");
        verify(listener).onStepStarted(steps.get(0), 2);
        verify(listener).onStepFinished(eq(steps.get(1)), any(StepResult.class));
    }

    @Test
    void execute_異常ケース_2番目のステップが失敗_以降のステップが実行されないこと()
            throws Exception {
        List<MigrationStep> steps = List.of(
                step("schema-public.sql", "CREATE TABLE a (id int);", 1, StepCategory.SCHEMA,
                        DataFormat.SQL),
                step("functions-public.sql", "CREATE FUNCTION broken", 2,
                        StepCategory.FUNCTIONS, DataFormat.SQL),
                step("triggers-public.sql", "CREATE TRIGGER t BEFORE INSERT ON a "
                        + "FOR EACH ROW EXECUTE FUNCTION f();", 3, StepCategory.TRIGGERS,
                        DataFormat.SQL));
        PSQLException error = new PSQLException(new ServerErrorMessage(
                "SERROR\0C42601\0Msyntax error at end of input\0Dthe detail\0Hthe hint\0"));
        doThrow(error).when(target).execute(contains("broken"));

        List<StepResult> results = executor(false).execute(steps);

        assertEquals(2, results.size());
        StepResult failed = results.get(1);
        assertEquals(StepStatus.FAILED, failed.getStatus());
        assertTrue(failed.getError().contains("syntax error at end of input"));
        assertEquals("the detail", failed.getDetail());
        assertEquals("the hint", failed.getHint());
        verify(target, times(2)).execute(anyString());
        verify(listener, never()).onStepStarted(eq(steps.get(2)), eq(3));
    }

    @Test
    void execute_正常ケース_ドライラン_DBに接続せず全ステップ成功となること() throws Exception {
        List<MigrationStep> steps = List.of(
                step("schema-public.sql", "CREATE SCHEMA public;", 1, StepCategory.SCHEMA,
                        DataFormat.SQL),
                step("data/public.users.sql", "INSERT INTO x VALUES (1);", 2,
                        StepCategory.DATA, DataFormat.SQL));

        List<StepResult> results = executor(true).execute(steps);

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(r -> r.getStatus() == StepStatus.SUCCEEDED));
        verify(target, never()).execute(anyString());
    }

    @Test
    void execute_正常ケース_ドライランで実行時に失敗するステップを含む_3ステップとも成功となること()
            throws Exception {
        List<MigrationStep> steps = List.of(
                step("schema-public.sql", "CREATE TABLE a (id int);", 1, StepCategory.SCHEMA,
                        DataFormat.SQL),
                step("functions-public.sql", "CREATE FUNCTION broken", 2,
                        StepCategory.FUNCTIONS, DataFormat.SQL),
                step("data/public.a.sql", "INSERT INTO a VALUES (1);", 4, StepCategory.DATA,
                        DataFormat.SQL));
        doThrow(new PSQLException(new ServerErrorMessage(
                "SERROR\0C42601\0Msyntax error at end of input\0"))).when(target)
                        .execute(contains("broken"));

        List<StepResult> results = executor(true).execute(steps);

        assertEquals(3, results.size());
        assertTrue(results.stream().allMatch(r -> r.getStatus() == StepStatus.SUCCEEDED));
        assertTrue(results.stream().allMatch(r -> r.getError() == null));
        verify(target, never()).execute(anyString());
        verify(listener).onStepFinished(eq(steps.get(2)), any(StepResult.class));
    }

    @Test
    void execute_正常ケース_ドライランで読込失敗_後続ステップが継続されること() throws Exception {
        MigrationStep broken = new MigrationStep("Data: users",
                dir.resolve("data/public.users.json"), 1, StepCategory.DATA, DataFormat.JSON);
        MigrationStep next = step("data/public.posts.sql", "INSERT INTO p VALUES (1);", 2,
                StepCategory.DATA, DataFormat.SQL);

        List<StepResult> results = executor(true).execute(List.of(broken, next));

        assertEquals(StepStatus.FAILED, results.get(0).getStatus());
        assertTrue(results.get(0).getError().startsWith("Failed to read artifact: "));
        assertEquals(StepStatus.SUCCEEDED, results.get(1).getStatus());
    }

    @Test
    void execute_正常ケース_空の成果物とコメントのみ_スキップされること() throws Exception {
        List<MigrationStep> steps = List.of(
                step("functions-public.sql", "", 1, StepCategory.FUNCTIONS, DataFormat.SQL),
                step("triggers-public.sql", "-- Triggers for schema: public\n\n", 2,
                        StepCategory.TRIGGERS, DataFormat.SQL),
                step("data/public.users.json", "[]", 3, StepCategory.DATA, DataFormat.JSON));

        List<StepResult> results = executor(false).execute(steps);

        assertEquals(3, results.size());
        assertTrue(results.stream().allMatch(r -> r.getStatus() == StepStatus.SKIPPED));
        verify(target, never()).execute(anyString());
    }

    @Test
    void execute_正常ケース_JSON成果物_INSERT文に変換して実行されること() throws Exception {
        MigrationStep step = step("data/public.users.json", "[{\"id\":1}]", 1,
                StepCategory.DATA, DataFormat.JSON);

        StepResult result = executor(false).execute(List.of(step)).get(0);

        assertEquals(StepStatus.SUCCEEDED, result.getStatus());
        assertNull(result.getError());
        verify(target).execute(contains(
                "INSERT INTO \"public\".\"users\" (\"id\") VALUES (1) ON CONFLICT DO NOTHING;"));
    }

    @Test
    void isBlankScript_正常ケース_空白とコメントのみ_trueが返ること() {
        assertTrue(MigrationExecutor.isBlankScript("  \n\t"));
        assertTrue(MigrationExecutor.isBlankScript("-- a\n  -- b\n"));
        assertEquals(false, MigrationExecutor.isBlankScript("-- a\nSELECT 1;"));
    }

    @Test
    void preview_正常ケース_上限を超える_残り行数が表示されること() {
        assertEquals("a\nb\n... (3 more lines)", MigrationExecutor.preview("a\nb\nc\nd\ne", 2));
        assertEquals("a\nb", MigrationExecutor.preview("a\nb", 2));
    }
}
