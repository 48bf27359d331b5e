package io.github.yok.schemaarchitect.ddl;

/**
 * Kinds of tokens produced by {@link SqlTokenizer}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum SqlTokenType {
    // Bare word: keyword, unquoted identifier or number
    WORD,
    // Identifier delimited by double quotes or backticks
    QUOTED_IDENTIFIER,
    // Single-quoted string literal
    STRING_LITERAL,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    DOT,
    // Statement terminator ';'
    SEMICOLON,
    // Line comment (--) or block comment (/* */)
    COMMENT,
    // Any other single character
    SYMBOL
}
