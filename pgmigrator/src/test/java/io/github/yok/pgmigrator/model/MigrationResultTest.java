package io.github.yok.pgmigrator.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

class MigrationResultTest {

    @Test
    void countSteps_正常ケース_状態ごとの件数が返ること() {
        MigrationResult result = MigrationResult.builder().success(false)
                .step(StepResult.succeeded("Schema", 10L)).step(StepResult.skipped("Functions"))
                .step(StepResult.builder().stepName("Data: public.users")
                        .status(StepStatus.FAILED).error("boom").build())
                .step(StepResult.succeeded("Triggers", 3L)).build();

        assertEquals(2, result.countSteps(StepStatus.SUCCEEDED));
        assertEquals(1, result.countSteps(StepStatus.SKIPPED));
        assertEquals(1, result.countSteps(StepStatus.FAILED));
        assertEquals(0, result.countSteps(StepStatus.STARTED));
    }

    @Test
    void toBuilder_正常ケース_エラーを追加する_既存の内容が保持されること() {
        MigrationResult base = MigrationResult.builder().success(true).message("ok")
                .warning("w1").file("a.sql").build();

        MigrationResult copy = base.toBuilder().success(false).error("e1").build();

        assertEquals("ok", copy.getMessage());
        assertEquals(1, copy.getWarnings().size());
        assertEquals(1, copy.getFiles().size());
        assertEquals(1, copy.getErrors().size());
        assertEquals(0, base.getErrors().size());
    }
}
