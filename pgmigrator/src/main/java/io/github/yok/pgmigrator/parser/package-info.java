/**
 * Artifact format package: data formats, SQL literal decoding and JSON artifact replay.
 */
package io.github.yok.pgmigrator.parser;
