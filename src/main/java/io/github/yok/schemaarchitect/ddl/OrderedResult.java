package io.github.yok.schemaarchitect.ddl;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of ordering a {@link DependencyGraph}.
 *
 * <p>
 * On success {@link #getOrderedStatements()} covers every table of the graph, each one after all
 * of the in-batch tables it references, and {@link #getUnresolvedTables()} is empty. When a cycle
 * is detected, {@link #getOrderedStatements()} holds the acyclic prefix that could be ordered and
 * {@link #getUnresolvedTables()} names the remaining tables in batch order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OrderedResult {

    private final List<DdlStatement> orderedStatements;
    private final List<String> unresolvedTables;

    /**
     * Creates a successful result.
     *
     * @param orderedStatements all statements in dependency order
     * @return successful result
     */
    public static OrderedResult ordered(List<DdlStatement> orderedStatements) {
        return new OrderedResult(ImmutableList.copyOf(orderedStatements), ImmutableList.of());
    }

    /**
     * Creates a cycle-detected result.
     *
     * @param orderedPrefix statements that could be ordered before the cycle blocked progress
     * @param unresolvedTables names of the tables left unordered; must not be empty
     * @return failed result
     */
    public static OrderedResult cycle(List<DdlStatement> orderedPrefix,
            List<String> unresolvedTables) {
        return new OrderedResult(ImmutableList.copyOf(orderedPrefix),
                ImmutableList.copyOf(unresolvedTables));
    }

    /**
     * Returns whether some tables could not be ordered.
     *
     * @return {@code true} if at least one table is part of, or blocked by, a dependency cycle
     */
    public boolean isCycleDetected() {
        return !unresolvedTables.isEmpty();
    }
}
