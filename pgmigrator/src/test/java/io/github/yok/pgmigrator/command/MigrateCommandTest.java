package io.github.yok.pgmigrator.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import io.github.yok.pgmigrator.config.MigrationConfig;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.exception.MigrationException;
import io.github.yok.pgmigrator.parser.JsonMappers;
import java.time.Clock;
import org.junit.jupiter.api.Test;

class MigrateCommandTest {

    private final Database database = mock(Database.class);
    private final MigrateCommand command = new MigrateCommand(url -> database,
            new MigrationConfig(), Clock.systemUTC(), JsonMappers.create());

    private static CommandOptions.CommandOptionsBuilder options() {
        return CommandOptions.builder().command(MigrateCommand.SCHEMA)
                .source("postgresql://src/app").target("postgresql://dst/app").schema("public");
    }

    @Test
    void run_異常ケース_移行元未指定_MigrationExceptionが送出されること() {
        MigrationException ex = assertThrows(MigrationException.class,
                () -> command.run(options().source(null).build()));
        assertTrue(ex.getMessage().startsWith("Source connection string is required"));
    }

    @Test
    void run_異常ケース_移行先未指定_MigrationExceptionが送出されること() {
        MigrationException ex = assertThrows(MigrationException.class,
                () -> command.run(options().target("").build()));
        assertTrue(ex.getMessage().startsWith("Target connection string is required"));
    }

    @Test
    void run_異常ケース_未知のコマンド_MigrationExceptionが送出され接続が閉じられること()
            throws Exception {
        MigrationException ex = assertThrows(MigrationException.class,
                () -> command.run(options().command("rollback").build()));

        assertEquals("Unknown migrate command: rollback", ex.getMessage());
        verify(database, times(2)).close();
    }
}
