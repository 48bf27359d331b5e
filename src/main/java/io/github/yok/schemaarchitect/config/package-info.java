/**
 * Configuration models bound from {@code application.yml}, and the enums they refer to.
 */
package io.github.yok.schemaarchitect.config;
