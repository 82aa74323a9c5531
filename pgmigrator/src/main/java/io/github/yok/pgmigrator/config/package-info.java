/**
 * Configuration model package for pg-migrator.
 *
 * <p>
 * Defines classes bound from {@code application.yml}: the source and target connection strings
 * and the defaults of export, import and live migration runs.
 * </p>
 */
package io.github.yok.pgmigrator.config;
