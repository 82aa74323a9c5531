package io.github.yok.pgmigrator.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.pgmigrator.model.MigrationStep;
import io.github.yok.pgmigrator.model.StepCategory;
import io.github.yok.pgmigrator.parser.DataFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MigrationStepPlannerTest {

    @TempDir
    Path dir;

    private final MigrationStepPlanner planner = new MigrationStepPlanner();

    private void touch(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static List<String> names(List<MigrationStep> steps) {
        return steps.stream().map(MigrationStep::getName).collect(Collectors.toList());
    }

    @Test
    void plan_正常ケース_全成果物あり_スキーマ関数トリガデータの順に並ぶこと() throws IOException {
        touch("schema-public.sql", "CREATE TABLE t (id int);");
        touch("functions-public.sql", "CREATE FUNCTION f() ...");
        touch("triggers-public.sql", "CREATE TRIGGER ...");
        touch("data/public.users.sql", "INSERT ...");
        touch("data/public.posts.sql", "INSERT ...");
        touch("data/table-ordering.txt", "public.users\npublic.posts\n");

        List<MigrationStep> steps = planner.plan(dir, "public");

        assertEquals(List.of("Schema", "Functions", "Triggers", "Data: users", "Data: posts"),
                names(steps));
        for (int i = 0; i < steps.size(); i++) {
            assertEquals(i + 1, steps.get(i).getRank());
        }
        assertEquals(StepCategory.SCHEMA, steps.get(0).getCategory());
        assertEquals(StepCategory.DATA, steps.get(4).getCategory());
    }

    @Test
    void plan_正常ケース_スキーマ成果物なし_関数とトリガとデータの順位が固定であること()
            throws IOException {
        touch("functions-public.sql", "CREATE FUNCTION f() ...");
        touch("triggers-public.sql", "CREATE TRIGGER ...");
        touch("data/public.users.sql", "INSERT ...");
        touch("data/public.posts.sql", "INSERT ...");
        touch("data/table-ordering.txt", "public.users\npublic.posts\n");

        List<MigrationStep> steps = planner.plan(dir, "public");

        assertEquals(List.of("Functions", "Triggers", "Data: users", "Data: posts"),
                names(steps));
        assertEquals(2, steps.get(0).getRank());
        assertEquals(3, steps.get(1).getRank());
        assertEquals(4, steps.get(2).getRank());
        assertEquals(5, steps.get(3).getRank());
    }

    @Test
    void plan_正常ケース_データのみ_データの順位が4から始まること() throws IOException {
        touch("data/public.b.sql", "x");
        touch("data/public.a.sql", "x");

        List<MigrationStep> steps = planner.plan(dir, "public");

        assertEquals(List.of(4, 5),
                steps.stream().map(MigrationStep::getRank).collect(Collectors.toList()));
    }

    @Test
    void plan_正常ケース_順序ファイルなし_ファイル名の辞書順になること() throws IOException {
        touch("data/public.zebra.sql", "x");
        touch("data/public.alpha.json", "[]");
        touch("data/public.mid.sql", "x");

        assertEquals(List.of("Data: alpha", "Data: mid", "Data: zebra"),
                names(planner.plan(dir, "public")));
    }

    @Test
    void plan_正常ケース_順序ファイルに無いテーブル_末尾に辞書順で追加されること()
            throws IOException {
        touch("data/public.c.sql", "x");
        touch("data/public.b.sql", "x");
        touch("data/public.a.sql", "x");
        touch("data/table-ordering.txt", "public.c\npublic.gone\n");

        assertEquals(List.of("Data: c", "Data: a", "Data: b"),
                names(planner.plan(dir, "public")));
    }

    @Test
    void plan_正常ケース_SQLとJSONの両方あり_SQLが採用されること() throws IOException {
        touch("data/public.users.json", "[]");
        touch("data/public.users.sql", "x");

        List<MigrationStep> steps = planner.plan(dir, "public");

        assertEquals(1, steps.size());
        assertEquals(DataFormat.SQL, steps.get(0).getFormat());
        assertTrue(steps.get(0).getArtifact().toString().endsWith("public.users.sql"));
    }

    @Test
    void plan_正常ケース_他スキーマや対象外拡張子_無視されること() throws IOException {
        touch("schema-other.sql", "x");
        touch("data/other.users.sql", "x");
        touch("data/public.users.csv", "x");
        touch("data/public.orders.json", "[]");

        List<MigrationStep> steps = planner.plan(dir, "public");

        assertEquals(List.of("Data: orders"), names(steps));
        assertEquals(DataFormat.JSON, steps.get(0).getFormat());
    }

    @Test
    void plan_正常ケース_ディレクトリなし_空リストが返ること() throws IOException {
        assertTrue(planner.plan(dir.resolve("missing"), "public").isEmpty());
    }
}
