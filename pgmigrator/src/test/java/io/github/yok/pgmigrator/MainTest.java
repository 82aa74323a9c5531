package io.github.yok.pgmigrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.pgmigrator.command.CommandOptions;
import io.github.yok.pgmigrator.command.ExportCommand;
import io.github.yok.pgmigrator.command.ImportCommand;
import io.github.yok.pgmigrator.command.MigrateCommand;
import io.github.yok.pgmigrator.config.ConnectionConfig;
import io.github.yok.pgmigrator.config.MigrationConfig;
import io.github.yok.pgmigrator.exception.MigrationException;
import io.github.yok.pgmigrator.model.MigrationResult;
import io.github.yok.pgmigrator.util.ErrorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private ConnectionConfig connectionConfig;
    private MigrationConfig migrationConfig;
    private Main main;

    @BeforeEach
    void setup() {
        connectionConfig = new ConnectionConfig();
        connectionConfig.setSource("postgresql://user:pw@source/app");
        connectionConfig.setTarget("postgresql://user:pw@target/app");
        migrationConfig = new MigrationConfig();
        main = new Main(connectionConfig, migrationConfig);
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    // run(String...) をスタブ
                    when(mock.run(any(String[].class))).thenReturn(null);

                    // コンストラクタ引数を検証
                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"export", "--dry-run"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("export"), eq("--dry-run"));
        }
    }

    @Test
    void parseArguments_正常ケース_オプション指定_設定値を上書きすること() {
        CommandOptions options = main.parseArguments("export", "-s", "postgresql://a/b",
                "--output", "/tmp/out", "--schema", "sales", "--format", "json",
                "--batch-size", "500", "--no-data", "--dry-run");

        assertEquals("export", options.getCommand());
        assertEquals("postgresql://a/b", options.getSource());
        assertEquals("postgresql://user:pw@target/app", options.getTarget());
        assertEquals("/tmp/out", options.getDir());
        assertEquals("sales", options.getSchema());
        assertEquals("json", options.getFormat());
        assertEquals(500, options.getBatchSize());
        assertFalse(options.isIncludeData());
        assertTrue(options.isDryRun());
    }

    @Test
    void parseArguments_正常ケース_オプションなし_設定値が使われること() {
        CommandOptions options = main.parseArguments("data", "--truncate", "--table", "users",
                "--unknown");

        assertEquals("data", options.getCommand());
        assertEquals("postgresql://user:pw@source/app", options.getSource());
        assertEquals("public", options.getSchema());
        assertEquals("users", options.getTable());
        assertEquals(1000, options.getBatchSize());
        assertTrue(options.isTruncate());
    }

    @Test
    void parseArguments_異常ケース_不正な引数_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> main.parseArguments());
        assertThrows(IllegalArgumentException.class, () -> main.parseArguments("--dry-run"));
        assertThrows(IllegalArgumentException.class, () -> main.parseArguments("rollback"));
        assertThrows(IllegalArgumentException.class,
                () -> main.parseArguments("import", "--batch-size", "0"));
        assertThrows(IllegalArgumentException.class,
                () -> main.parseArguments("import", "--batch-size", "many"));
        assertThrows(IllegalArgumentException.class,
                () -> main.parseArguments("import", "--dir"));
    }

    @Test
    void run_異常ケース_コマンド未指定_ErrorHandlerが呼ばれ終了コード1となること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run();

            mocked.verify(() -> ErrorHandler.errorAndExit(
                    eq("A command is required: export, import, data, functions, migrate-all, "
                            + "schema, triggers")));
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_exportコマンド_ExportCommandが実行され終了コード0となること() {
        try (MockedConstruction<ExportCommand> mocked = mockConstruction(ExportCommand.class,
                (mock, ctx) -> when(mock.run(any(CommandOptions.class)))
                        .thenReturn(MigrationResult.builder().success(true).message("ok")
                                .build()))) {

            main.run("export", "--data-only");

            ArgumentCaptor<CommandOptions> captor = ArgumentCaptor.forClass(CommandOptions.class);
            verify(mocked.constructed().get(0)).run(captor.capture());
            assertTrue(captor.getValue().isDataOnly());
            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_import失敗_終了コード1となること() {
        try (MockedConstruction<ImportCommand> mocked = mockConstruction(ImportCommand.class,
                (mock, ctx) -> when(mock.run(any(CommandOptions.class)))
                        .thenReturn(MigrationResult.builder().success(false).build()))) {

            main.run("import", "--dir", "/tmp/in");

            assertEquals(1, mocked.constructed().size());
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_コマンドが例外を送出_ErrorHandlerに原因付きで渡されること() {
        MigrationException failure = new MigrationException("connection refused");
        try (MockedConstruction<MigrateCommand> mocked = mockConstruction(MigrateCommand.class,
                (mock, ctx) -> when(mock.run(any(CommandOptions.class))).thenThrow(failure));
                MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class)) {

            main.run("migrate-all", "--include-data");

            handler.verify(() -> ErrorHandler.errorAndExit(eq("Fatal error: connection refused"),
                    eq(failure)));
            assertEquals(1, main.getExitCode());
        }
    }

    @Test
    void run_異常ケース_exit無効時_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            assertThrows(IllegalStateException.class, () -> main.run("unknown-command"));
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void run_正常ケース_パスワードを含む引数_例外なく処理されること() {
        try (MockedConstruction<MigrateCommand> mocked = mockConstruction(MigrateCommand.class,
                (mock, ctx) -> when(mock.run(any(CommandOptions.class)))
                        .thenReturn(MigrationResult.builder().success(true).build()));
                MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class)) {

            main.run("schema", "--source", "postgresql://u:secret@h/db", "--target",
                    "postgresql://u:secret@h2/db");

            handler.verify(() -> ErrorHandler.errorAndExit(anyString()),
                    never());
            assertEquals(0, main.getExitCode());
        }
    }
}
