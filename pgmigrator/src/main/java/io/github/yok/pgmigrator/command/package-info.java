/**
 * Command package.
 *
 * <p>
 * One class per command line operation. Each command validates its inputs, opens the databases it
 * needs through an injected connector, wires the core components and returns a
 * {@link io.github.yok.pgmigrator.model.MigrationResult}.
 * </p>
 */
package io.github.yok.pgmigrator.command;
