package io.github.yok.schemaarchitect.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.schemaarchitect.ddl.SqlToken;
import io.github.yok.schemaarchitect.ddl.SqlTokenType;
import io.github.yok.schemaarchitect.ddl.SqlTokenizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Simulates the result of a {@code SELECT} query as a Markdown table.
 *
 * <p>
 * Nothing is executed. Output columns are guessed from the select list and the rows come from a
 * small set of canned data sets chosen by keywords in the query:
 * </p>
 *
 * <ul>
 * <li>{@code MEMBER} together with {@code KPI} or {@code VALUE}: member KPI rows (5 columns)</li>
 * <li>{@code TEAM} together with {@code MEMBER}: team member rows (3 columns)</li>
 * <li>otherwise: generic rows (2 columns)</li>
 * </ul>
 *
 * <p>
 * If the number of guessed columns does not match the width of the chosen rows, the columns are
 * named {@code Column_1 .. Column_n} instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DmlOutputSimulator {

    static final List<String> FALLBACK_COLUMNS = ImmutableList.of("col_1", "col_2", "col_3");

    static final List<List<String>> MEMBER_KPI_ROWS = ImmutableList.of(
            ImmutableList.of("Budi", "Santoso", "Sales Revenue", "95000.00", "2023-10-26"),
            ImmutableList.of("Siti", "Aminah", "Sales Revenue", "88000.00", "2023-10-26"));

    static final List<List<String>> TEAM_MEMBER_ROWS = ImmutableList.of(
            ImmutableList.of("101", "Budi Santoso", "Sales Team A"),
            ImmutableList.of("102", "Siti Aminah", "Sales Team A"));

    static final List<List<String>> GENERIC_ROWS =
            ImmutableList.of(ImmutableList.of("Sample_Value_A", "123"),
                    ImmutableList.of("Sample_Value_B", "456"));

    /**
     * Builds the simulated output section for a query.
     *
     * @param selectQuery the {@code SELECT} query; {@code null} is treated as empty
     * @param resultDescription short description of the returned data
     * @return Markdown section with the query and the simulated result table
     */
    public String simulate(String selectQuery, String resultDescription) {
        String query = StringUtils.defaultString(selectQuery).trim();
        List<List<String>> rows = pickRows(query);
        int width = rows.get(0).size();

        List<String> columns = guessColumns(query);
        if (columns.size() != width) {
            columns = IntStream.rangeClosed(1, width).mapToObj(i -> "Column_" + i)
                    .collect(Collectors.toList());
        }
        log.info("Simulating query output with columns {}", columns);

        List<String> table = new ArrayList<>();
        table.add(markdownRow(columns));
        table.add(markdownRow(columns.stream().map(c -> "---").collect(Collectors.toList())));
        rows.forEach(row -> table.add(markdownRow(row)));

        return "### Simulated Query Output: (" + StringUtils.defaultString(resultDescription)
                + ")\n\n**Query:**\n```sql\n" + query + "\n```\n\n" + String.join("\n", table);
    }

    /**
     * Guesses the output column names of a query's select list.
     *
     * <p>
     * The select list runs from the first {@code SELECT} to the first {@code FROM} outside
     * parentheses. Each item yields its alias ({@code AS alias}, or a trailing name after a
     * closing parenthesis or another name), else the last part of a possibly qualified column
     * name. Items such as {@code *} yield nothing. If nothing is found,
     * {@link #FALLBACK_COLUMNS} is returned.
     * </p>
     *
     * @param selectQuery query text
     * @return guessed column names
     */
    static List<String> guessColumns(String selectQuery) {
        List<SqlToken> tokens = SqlTokenizer.tokenize(selectQuery).stream()
                .filter(t -> !t.is(SqlTokenType.COMMENT)).collect(Collectors.toList());

        int start = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isKeyword("SELECT")) {
                start = i + 1;
                break;
            }
        }

        List<List<SqlToken>> items = new ArrayList<>();
        List<SqlToken> current = new ArrayList<>();
        int depth = 0;
        for (int i = start; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (depth == 0 && (token.isKeyword("FROM") || token.is(SqlTokenType.SEMICOLON))) {
                break;
            }
            if (token.is(SqlTokenType.LEFT_PAREN)) {
                depth++;
            } else if (token.is(SqlTokenType.RIGHT_PAREN)) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is(SqlTokenType.COMMA)) {
                items.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        items.add(current);

        List<String> columns = new ArrayList<>();
        for (List<SqlToken> item : items) {
            String name = columnName(item);
            if (name != null) {
                columns.add(name);
            }
        }
        return columns.isEmpty() ? FALLBACK_COLUMNS : columns;
    }

    private static String columnName(List<SqlToken> item) {
        List<SqlToken> tokens = new ArrayList<>(item);
        while (!tokens.isEmpty()
                && (tokens.get(0).isKeyword("DISTINCT") || tokens.get(0).isKeyword("ALL"))) {
            tokens.remove(0);
        }
        if (tokens.isEmpty()) {
            return null;
        }

        int last = tokens.size() - 1;
        SqlToken lastToken = tokens.get(last);
        if (!lastToken.isIdentifier()) {
            return null;
        }
        if (last == 0) {
            return lastToken.getValue();
        }

        SqlToken previous = tokens.get(last - 1);
        if (previous.isKeyword("AS") || previous.is(SqlTokenType.DOT)
                || previous.is(SqlTokenType.RIGHT_PAREN) || previous.isIdentifier()) {
            return lastToken.getValue();
        }
        return null;
    }

    private static List<List<String>> pickRows(String query) {
        String upper = query.toUpperCase(Locale.ROOT);
        if (upper.contains("MEMBER") && (upper.contains("KPI") || upper.contains("VALUE"))) {
            return MEMBER_KPI_ROWS;
        }
        if (upper.contains("TEAM") && upper.contains("MEMBER")) {
            return TEAM_MEMBER_ROWS;
        }
        return GENERIC_ROWS;
    }

    private static String markdownRow(List<String> cells) {
        return "| " + String.join(" | ", cells) + " |";
    }
}
