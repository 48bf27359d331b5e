package io.github.yok.schemaarchitect.ddl;

import io.github.yok.schemaarchitect.config.DdlOrderingConfig;
import io.github.yok.schemaarchitect.config.UnparsedStatementPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reorders the {@code CREATE TABLE} statements of a SQL batch so that every table follows the
 * tables it references through foreign keys.
 *
 * <h2>Flow</h2>
 *
 * <ol>
 * <li>Input that does not contain {@code CREATE TABLE} (case-insensitive) is returned unchanged.
 * DML such as {@code SELECT} or {@code INSERT} therefore passes through untouched.</li>
 * <li>The batch is split at {@code ;} ({@link StatementSplitter}).</li>
 * <li>Each fragment is parsed by {@link CreateTableParser}. Fragments without a recognized header
 * are handled according to {@link DdlOrderingConfig#getUnparsedStatementPolicy()}.</li>
 * <li>The statements are ordered by {@link DependencyGraph#sort()}.</li>
 * <li>If a cycle is found, the original input is returned, prefixed with
 * {@link #CYCLE_WARNING_PREFIX} and the names of the unresolved tables.</li>
 * <li>Otherwise {@link #ORDERED_HEADER} is emitted, followed by each statement with a blank line
 * after every terminator.</li>
 * </ol>
 *
 * <h2>Errors</h2>
 *
 * <p>
 * {@link #resolve(String)} is defined for every input and never throws. Callers tell the paths
 * apart by the leading marker line.
 * </p>
 *
 * <p>
 * Instances hold no per-call state and can be shared between threads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DdlDependencyResolver {

    /**
     * First line of a successfully reordered batch.
     */
    public static final String ORDERED_HEADER = "-- DDL commands sorted by FOREIGN KEY dependency:";

    /**
     * Start of the first line of a batch whose tables could not be ordered.
     */
    public static final String CYCLE_WARNING_PREFIX =
            "-- WARNING: Not all tables could be topologically sorted";

    /**
     * Separates the appended statements when {@link UnparsedStatementPolicy#APPEND} is active.
     */
    public static final String UNPARSED_HEADER =
            "-- Statements without a recognized CREATE TABLE header (original order):";

    private static final String CREATE_TABLE = "CREATE TABLE";
    private static final String STATEMENT_SEPARATOR = "\n\n";

    private final DdlOrderingConfig config;

    /**
     * Reorders the {@code CREATE TABLE} statements of a batch by foreign key dependency.
     *
     * @param sqlText SQL batch; may be {@code null}
     * @return the input unchanged if it holds no {@code CREATE TABLE}; the reordered DDL; or the
     *         input prefixed with a cycle warning
     */
    public String resolve(String sqlText) {
        if (!containsCreateTable(sqlText)) {
            log.debug("No CREATE TABLE found; returning input unchanged");
            return sqlText;
        }

        List<DdlStatement> statements = new ArrayList<>();
        List<String> unparsed = new ArrayList<>();
        for (String fragment : StatementSplitter.split(sqlText)) {
            CreateTableParser.parse(fragment).ifPresentOrElse(statements::add,
                    () -> unparsed.add(fragment));
        }

        OrderedResult result = order(statements);
        if (result.isCycleDetected()) {
            return cycleWarning(result.getUnresolvedTables()) + "\n" + sqlText;
        }

        if (!unparsed.isEmpty()
                && config.getUnparsedStatementPolicy() == UnparsedStatementPolicy.DROP) {
            log.warn("{} statement(s) without a recognized CREATE TABLE header are left out of the "
                    + "ordered output", unparsed.size());
        }

        log.info("Resolved CREATE TABLE order (parent-first): {}",
                result.getOrderedStatements().stream().map(DdlStatement::getTableName)
                        .collect(Collectors.toList()));
        return assemble(result.getOrderedStatements(), unparsed);
    }

    /**
     * Orders already parsed statements.
     *
     * @param statements parsed statements in batch order
     * @return ordering result
     */
    public OrderedResult order(List<DdlStatement> statements) {
        return DependencyGraph.build(statements, config.isIgnoreSelfReferences()).sort();
    }

    /**
     * Returns whether the text contains {@code CREATE TABLE}, ignoring case.
     *
     * @param sqlText text to inspect; may be {@code null}
     * @return {@code true} if the literal {@code CREATE TABLE} occurs in the upper-cased text
     */
    public static boolean containsCreateTable(String sqlText) {
        return sqlText != null && sqlText.toUpperCase(Locale.ROOT).contains(CREATE_TABLE);
    }

    private String assemble(List<DdlStatement> ordered, List<String> unparsed) {
        StringBuilder out = new StringBuilder(ORDERED_HEADER);
        for (DdlStatement statement : ordered) {
            out.append(STATEMENT_SEPARATOR).append(statement.getRawText());
        }
        if (config.getUnparsedStatementPolicy() == UnparsedStatementPolicy.APPEND
                && !unparsed.isEmpty()) {
            out.append(STATEMENT_SEPARATOR).append(UNPARSED_HEADER);
            for (String fragment : unparsed) {
                out.append(STATEMENT_SEPARATOR).append(fragment).append(DdlStatement.TERMINATOR);
            }
        }
        return out.toString();
    }

    private static String cycleWarning(List<String> unresolvedTables) {
        return CYCLE_WARNING_PREFIX + " (possible circular dependencies: "
                + String.join(", ", unresolvedTables) + "). Using original order.";
    }
}
