package io.github.yok.schemaarchitect.ddl;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text into {@link SqlToken}s.
 *
 * <p>
 * This is not a full SQL lexer. It only knows enough to keep quoted literals, quoted identifiers
 * and comments intact so that the statement splitter and the {@code CREATE TABLE} parser never see
 * a {@code ;} or a keyword that lives inside one of them.
 * </p>
 *
 * <ul>
 * <li>Whitespace separates tokens and is not emitted.</li>
 * <li>{@code --} starts a line comment, {@code /*} a block comment. An unterminated block comment
 * runs to the end of input.</li>
 * <li>{@code '...'} is a string literal; {@code ''} inside it is an escaped quote, and so is
 * {@code \'} (a backslash escapes the character after it, as in MySQL).</li>
 * <li>{@code "..."} and {@code `...`} are quoted identifiers; a doubled delimiter is an escaped
 * delimiter.</li>
 * <li>Letters, digits, {@code _} and {@code $} form words.</li>
 * </ul>
 *
 * <p>
 * Tokenizing never fails: unterminated quotes simply run to the end of input.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlTokenizer {

    private SqlTokenizer() {
        throw new AssertionError("SqlTokenizer must not be instantiated.");
    }

    /**
     * Tokenizes the given SQL text.
     *
     * @param sql SQL text; {@code null} is treated as empty
     * @return tokens in source order, comments included
     */
    public static List<SqlToken> tokenize(String sql) {
        List<SqlToken> tokens = new ArrayList<>();
        if (sql == null) {
            return tokens;
        }

        int length = sql.length();
        int pos = 0;
        while (pos < length) {
            char c = sql.charAt(pos);
            char next = pos + 1 < length ? sql.charAt(pos + 1) : '\0';

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            int start = pos;
            if (c == '-' && next == '-') {
                int eol = sql.indexOf('\n', pos);
                pos = eol < 0 ? length : eol;
                tokens.add(plain(SqlTokenType.COMMENT, sql, start, pos));
            } else if (c == '/' && next == '*') {
                int close = sql.indexOf("*/", pos + 2);
                pos = close < 0 ? length : close + 2;
                tokens.add(plain(SqlTokenType.COMMENT, sql, start, pos));
            } else if (c == '\'') {
                pos = endOfQuoted(sql, pos, '\'');
                tokens.add(plain(SqlTokenType.STRING_LITERAL, sql, start, pos));
            } else if (c == '"' || c == '`') {
                pos = endOfQuoted(sql, pos, c);
                tokens.add(quotedIdentifier(sql, start, pos, c));
            } else if (isWordChar(c)) {
                while (pos < length && isWordChar(sql.charAt(pos))) {
                    pos++;
                }
                tokens.add(plain(SqlTokenType.WORD, sql, start, pos));
            } else {
                pos++;
                tokens.add(plain(punctuationType(c), sql, start, pos));
            }
        }
        return tokens;
    }

    /**
     * Returns whether the token is a string literal or quoted identifier that is never closed.
     *
     * @param token token to inspect
     * @return {@code true} if the quoted section runs to the end of the tokenized input
     */
    public static boolean isUnterminated(SqlToken token) {
        if (!token.is(SqlTokenType.STRING_LITERAL) && !token.is(SqlTokenType.QUOTED_IDENTIFIER)) {
            return false;
        }
        String text = token.getText();
        return closingEnd(text, 0, text.charAt(0)) < 0;
    }

    private static int endOfQuoted(String sql, int open, char delimiter) {
        int end = closingEnd(sql, open, delimiter);
        return end < 0 ? sql.length() : end;
    }

    /**
     * Returns the position just after the closing delimiter of a quoted section that starts at
     * {@code open}, or -1 if it is never closed.
     */
    private static int closingEnd(String sql, int open, char delimiter) {
        int pos = open + 1;
        int length = sql.length();
        while (pos < length) {
            char c = sql.charAt(pos);
            if (c == '\\' && delimiter == '\'') {
                pos += 2;
                continue;
            }
            if (c == delimiter) {
                if (pos + 1 < length && sql.charAt(pos + 1) == delimiter) {
                    pos += 2;
                    continue;
                }
                return pos + 1;
            }
            pos++;
        }
        return -1;
    }

    private static SqlToken quotedIdentifier(String sql, int start, int end, char delimiter) {
        String text = sql.substring(start, end);
        boolean closed = end - start >= 2 && text.charAt(text.length() - 1) == delimiter;
        String inner = text.substring(1, closed ? text.length() - 1 : text.length());
        String doubled = String.valueOf(delimiter) + delimiter;
        String value = inner.replace(doubled, String.valueOf(delimiter));
        return new SqlToken(SqlTokenType.QUOTED_IDENTIFIER, text, value, start, end);
    }

    private static SqlToken plain(SqlTokenType type, String sql, int start, int end) {
        String text = sql.substring(start, end);
        return new SqlToken(type, text, text, start, end);
    }

    private static SqlTokenType punctuationType(char c) {
        switch (c) {
            case '(':
                return SqlTokenType.LEFT_PAREN;
            case ')':
                return SqlTokenType.RIGHT_PAREN;
            case ',':
                return SqlTokenType.COMMA;
            case '.':
                return SqlTokenType.DOT;
            case ';':
                return SqlTokenType.SEMICOLON;
            default:
                return SqlTokenType.SYMBOL;
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
