package io.github.yok.schemaarchitect.ddl;

import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single lexical unit of SQL text.
 *
 * <p>
 * {@code text} is the exact source slice, {@code value} is the meaningful content: the unquoted
 * name for {@link SqlTokenType#QUOTED_IDENTIFIER}, the source text for everything else.
 * {@code start} (inclusive) and {@code end} (exclusive) are character offsets into the tokenized
 * input.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class SqlToken {

    private final SqlTokenType type;
    private final String text;
    private final String value;
    private final int start;
    private final int end;

    /**
     * Returns whether this token is a bare word equal to {@code keyword}, ignoring case.
     *
     * @param keyword keyword to compare with
     * @return {@code true} if this is a matching {@link SqlTokenType#WORD}
     */
    public boolean isKeyword(String keyword) {
        return type == SqlTokenType.WORD && value.equalsIgnoreCase(keyword);
    }

    /**
     * Returns whether this token can name a table: a bare word or a quoted identifier.
     *
     * @return {@code true} for {@link SqlTokenType#WORD} and {@link SqlTokenType#QUOTED_IDENTIFIER}
     */
    public boolean isIdentifier() {
        return type == SqlTokenType.WORD || type == SqlTokenType.QUOTED_IDENTIFIER;
    }

    /**
     * Returns whether this token is of the given type.
     *
     * @param expected expected type
     * @return {@code true} if the types are equal
     */
    public boolean is(SqlTokenType expected) {
        return type == expected;
    }

    /**
     * Returns the key that identifies the object this token names.
     *
     * <p>
     * Bare words are folded to lower case; quoted identifiers keep their exact case, so
     * {@code "Users"} and {@code users} are different tables while {@code "users"} and
     * {@code USERS} are the same.
     * </p>
     *
     * @return identity key of this identifier
     */
    public String identityKey() {
        return type == SqlTokenType.QUOTED_IDENTIFIER ? value : normalizedValue();
    }

    /**
     * Returns the value normalized for case-insensitive name comparison.
     *
     * @return lower-case value ({@link Locale#ROOT})
     */
    public String normalizedValue() {
        return value.toLowerCase(Locale.ROOT);
    }
}
