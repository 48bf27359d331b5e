/**
 * Stateless helpers for the command line: fatal error reporting and UTF-8 script file access.
 */
package io.github.yok.schemaarchitect.util;
