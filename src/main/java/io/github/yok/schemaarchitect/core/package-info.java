/**
 * Schema design helpers built around DDL text.
 *
 * <p>
 * Includes the response code-block formatter that applies dependency ordering to {@code sql}
 * blocks, the DDL optimization annotator, the sample-data validator, and the rule-based performance
 * and query-output simulators. None of them touch a database.
 * </p>
 */
package io.github.yok.schemaarchitect.core;
