package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.StepCategory;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Rewrites captured DDL so that replaying it against a partially populated target does not abort.
 *
 * <ul>
 * <li>{@link StepCategory#SCHEMA}: {@code CREATE SCHEMA x} becomes
 * {@code CREATE SCHEMA IF NOT EXISTS x}.</li>
 * <li>{@link StepCategory#FUNCTIONS}: {@code CREATE FUNCTION} becomes
 * {@code CREATE OR REPLACE FUNCTION}.</li>
 * <li>{@link StepCategory#TRIGGERS}: each {@code CREATE TRIGGER name ... ON table} is preceded by
 * {@code DROP TRIGGER IF EXISTS name ON table;}.</li>
 * <li>{@link StepCategory#DATA}: unchanged; data artifacts are conflict-tolerant already.</li>
 * </ul>
 *
 * <p>
 * Matching is case-insensitive. Each rewrite recognizes its own output, so transforming twice
 * gives the same text as transforming once.
 * </p>
 */
public final class IdempotencyTransformer {

    private static final Pattern CREATE_SCHEMA =
            Pattern.compile("\\bCREATE\\s+SCHEMA\\s++(?!IF\\s+NOT\\s+EXISTS\\b)",
                    Pattern.CASE_INSENSITIVE);

    private static final Pattern CREATE_FUNCTION =
            Pattern.compile("\\bCREATE\\s+FUNCTION\\b", Pattern.CASE_INSENSITIVE);

    // identifier: quoted ("a""b") or bare, optionally schema-qualified
    private static final String IDENT = "(?:\"(?:[^\"]|\"\")+\"|[\\w$]+)";
    private static final String QUALIFIED = IDENT + "(?:\\s*\\.\\s*" + IDENT + ")?";

    private static final Pattern CREATE_TRIGGER = Pattern.compile(
            "\\bCREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:CONSTRAINT\\s+)?TRIGGER\\s+(" + IDENT
                    + ")[^;]*?\\bON\\s+(" + QUALIFIED + ")",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    @Generated
    private IdempotencyTransformer() {}

    /**
     * Applies the rewrite of a category.
     *
     * @param category artifact category
     * @param sql SQL text
     * @return rewritten text
     */
    public static String transform(StepCategory category, String sql) {
        switch (category) {
            case SCHEMA:
                return CREATE_SCHEMA.matcher(sql).replaceAll("CREATE SCHEMA IF NOT EXISTS ");
            case FUNCTIONS:
                return CREATE_FUNCTION.matcher(sql).replaceAll("CREATE OR REPLACE FUNCTION");
            case TRIGGERS:
                return guardTriggers(sql);
            case DATA:
            default:
                return sql;
        }
    }

    private static String guardTriggers(String sql) {
        Matcher m = CREATE_TRIGGER.matcher(sql);
        StringBuilder out = new StringBuilder(sql.length() + 128);
        int last = 0;
        while (m.find()) {
            String drop = "DROP TRIGGER IF EXISTS " + m.group(1) + " ON " + m.group(2) + ";";
            String before = sql.substring(last, m.start());
            out.append(before);
            if (!endsWithStatement(sql.substring(0, m.start()), drop)) {
                out.append(drop).append('\n');
            }
            out.append(m.group());
            last = m.end();
        }
        out.append(sql.substring(last));
        return out.toString();
    }

    private static boolean endsWithStatement(String prefix, String statement) {
        return prefix.stripTrailing().toLowerCase(Locale.ROOT)
                .endsWith(statement.toLowerCase(Locale.ROOT));
    }
}
