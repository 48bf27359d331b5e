/**
 * Root package of Schema Architect.
 *
 * <p>
 * Provides a CLI/library that orders {@code CREATE TABLE} batches by foreign key dependency and
 * produces schema design reports from DDL text.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.schemaarchitect.config}: configuration models</li>
 * <li>{@code io.github.yok.schemaarchitect.ddl}: tokenizing, parsing and ordering of DDL</li>
 * <li>{@code io.github.yok.schemaarchitect.core}: report generators and response formatting</li>
 * <li>{@code io.github.yok.schemaarchitect.util}: CLI helpers</li>
 * </ul>
 */
package io.github.yok.schemaarchitect;
