package io.github.yok.schemaarchitect.ddl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Extracts the created table and its foreign key targets from one statement fragment.
 *
 * <h2>Header</h2>
 *
 * <p>
 * The header is {@code CREATE TABLE [IF NOT EXISTS] <name> (}, keywords matched
 * case-insensitively. {@code <name>} is a single bare word or a quoted identifier
 * ({@code "name"} or {@code `name`}) and must be directly followed by {@code (}. Schema-qualified
 * names and {@code CREATE TABLE ... AS SELECT} therefore have no recognized header. When the
 * fragment contains several {@code CREATE TABLE} keyword pairs, the first one that forms a valid
 * header wins. Bare names are matched case-insensitively, quoted names exactly.
 * </p>
 *
 * <h2>References</h2>
 *
 * <p>
 * Every {@code REFERENCES <name>} in the fragment contributes {@code <name>}, which covers inline
 * column constraints ({@code a_id INT REFERENCES a(id)}) as well as table-level constraints
 * ({@code FOREIGN KEY (x, y) REFERENCES parent (x, y)}). A name followed by {@code .} is
 * schema-qualified and is not recorded.
 * </p>
 *
 * <p>
 * Comments are ignored; keywords inside string literals or quoted identifiers are never matched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class CreateTableParser {

    private CreateTableParser() {
        throw new AssertionError("CreateTableParser must not be instantiated.");
    }

    /**
     * Parses a statement fragment.
     *
     * @param fragment statement text without terminator
     * @return the parsed statement, or empty if the fragment has no recognized header
     */
    public static Optional<DdlStatement> parse(String fragment) {
        List<SqlToken> tokens = SqlTokenizer.tokenize(fragment).stream()
                .filter(t -> !t.is(SqlTokenType.COMMENT)).collect(Collectors.toList());

        Optional<SqlToken> tableName = findTableName(tokens);
        if (tableName.isEmpty()) {
            log.debug("No CREATE TABLE header recognized: {}", abbreviate(fragment));
            return Optional.empty();
        }

        DdlStatement statement = new DdlStatement(tableName.get().getValue(),
                tableName.get().identityKey(), fragment, findReferences(tokens));
        log.debug("Parsed CREATE TABLE '{}' referencing {}", statement.getTableName(),
                statement.getDependsOn());
        return Optional.of(statement);
    }

    /**
     * Finds the table name token of the first valid {@code CREATE TABLE} header.
     */
    static Optional<SqlToken> findTableName(List<SqlToken> tokens) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (!tokens.get(i).isKeyword("CREATE") || !tokens.get(i + 1).isKeyword("TABLE")) {
                continue;
            }
            int nameIndex = i + 2;
            if (matchesKeywords(tokens, nameIndex, "IF", "NOT", "EXISTS")) {
                nameIndex += 3;
            }
            if (nameIndex + 1 < tokens.size() && tokens.get(nameIndex).isIdentifier()
                    && tokens.get(nameIndex + 1).is(SqlTokenType.LEFT_PAREN)) {
                return Optional.of(tokens.get(nameIndex));
            }
        }
        return Optional.empty();
    }

    /**
     * Collects referenced table names keyed by {@link SqlToken#identityKey()}, first spelling
     * kept.
     */
    static Map<String, String> findReferences(List<SqlToken> tokens) {
        Map<String, String> references = new LinkedHashMap<>();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (!tokens.get(i).isKeyword("REFERENCES")) {
                continue;
            }
            SqlToken target = tokens.get(i + 1);
            if (!target.isIdentifier()) {
                continue;
            }
            boolean qualified = i + 2 < tokens.size() && tokens.get(i + 2).is(SqlTokenType.DOT);
            if (qualified) {
                continue;
            }
            references.putIfAbsent(target.identityKey(), target.getValue());
        }
        return references;
    }

    private static boolean matchesKeywords(List<SqlToken> tokens, int from, String... keywords) {
        if (from + keywords.length > tokens.size()) {
            return false;
        }
        for (int k = 0; k < keywords.length; k++) {
            if (!tokens.get(from + k).isKeyword(keywords[k])) {
                return false;
            }
        }
        return true;
    }

    private static String abbreviate(String fragment) {
        return StringUtils.abbreviate(StringUtils.normalizeSpace(fragment), 60);
    }
}
