package io.github.yok.schemaarchitect.config;

/**
 * Decides what happens to statements of a DDL batch that carry no recognizable
 * {@code CREATE TABLE} header when the batch is reordered.
 *
 * @author Yasuharu.Okawauchi
 */
public enum UnparsedStatementPolicy {
    // Leave them out of the ordered output
    DROP,
    // Emit them after the ordered tables, in their original order
    APPEND
}
