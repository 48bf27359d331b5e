package io.github.yok.schemaarchitect.ddl;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits a SQL batch into statement fragments at the {@code ;} terminator.
 *
 * <p>
 * Fragments are trimmed and empty fragments are discarded. The terminator itself is not part of a
 * fragment. A {@code ;} inside a string literal, a quoted identifier or a comment does not
 * terminate a statement.
 * </p>
 *
 * <p>
 * If the batch ends inside a string literal or quoted identifier that is never closed, every
 * {@code ;} splits instead, so a single stray quote cannot swallow the rest of the batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class StatementSplitter {

    private static final Splitter PLAIN_SPLITTER =
            Splitter.on(';').trimResults().omitEmptyStrings();

    private StatementSplitter() {
        throw new AssertionError("StatementSplitter must not be instantiated.");
    }

    /**
     * Splits the given batch into trimmed, non-empty statement fragments.
     *
     * @param batch SQL batch; {@code null} or blank yields an empty list
     * @return fragments in source order, without terminators
     */
    public static List<String> split(String batch) {
        List<String> fragments = new ArrayList<>();
        if (batch == null || batch.isBlank()) {
            return fragments;
        }

        List<SqlToken> tokens = SqlTokenizer.tokenize(batch);
        if (!tokens.isEmpty() && SqlTokenizer.isUnterminated(tokens.get(tokens.size() - 1))) {
            log.warn("Unterminated quote at offset {}; splitting at every ';'",
                    tokens.get(tokens.size() - 1).getStart());
            return new ArrayList<>(PLAIN_SPLITTER.splitToList(batch));
        }

        int fragmentStart = 0;
        for (SqlToken token : tokens) {
            if (token.is(SqlTokenType.SEMICOLON)) {
                addIfNotEmpty(fragments, batch.substring(fragmentStart, token.getStart()));
                fragmentStart = token.getEnd();
            }
        }
        addIfNotEmpty(fragments, batch.substring(fragmentStart));
        return fragments;
    }

    private static void addIfNotEmpty(List<String> fragments, String raw) {
        String trimmed = raw.trim();
        if (!trimmed.isEmpty()) {
            fragments.add(trimmed);
        }
    }
}
