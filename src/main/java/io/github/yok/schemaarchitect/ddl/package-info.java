/**
 * Foreign-key-aware ordering of {@code CREATE TABLE} batches.
 *
 * <p>
 * {@link io.github.yok.schemaarchitect.ddl.SqlTokenizer} and
 * {@link io.github.yok.schemaarchitect.ddl.CreateTableParser} extract table names and references
 * from loosely formatted text, {@link io.github.yok.schemaarchitect.ddl.DependencyGraph} orders
 * them, and {@link io.github.yok.schemaarchitect.ddl.DdlDependencyResolver} ties the steps
 * together and renders the result.
 * </p>
 */
package io.github.yok.schemaarchitect.ddl;
