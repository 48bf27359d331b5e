package io.github.yok.schemaarchitect.ddl;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Table-level dependency graph of one DDL batch.
 *
 * <h2>Representation</h2>
 *
 * <p>
 * Statements are stored in an arena (list) in batch order and looked up by their table key
 * ({@link DdlStatement#key()}). For every node the graph owns the index list of its dependents
 * (edge {@code parent -> child} when {@code child} references {@code parent}) and a separate
 * in-degree count: the number of distinct tables of this batch the node references.
 * </p>
 *
 * <h2>Rules</h2>
 *
 * <ul>
 * <li>References to tables that are not part of the batch create no edge; such tables are assumed
 * to exist already.</li>
 * <li>A table referencing itself gets a self edge and can never become ready, unless self
 * references are ignored.</li>
 * <li>If the same table is created twice, the later statement replaces the earlier one and keeps
 * the earlier position.</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 *
 * <p>
 * {@link #sort()} applies Kahn's algorithm with a FIFO ready queue. The queue is seeded with the
 * tables that have no in-batch dependency, in batch order, and dependents are released in batch
 * order, so the result is deterministic for a given input. The graph itself is not modified;
 * remaining in-degrees are tracked on a copy.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class DependencyGraph {

    private final List<DdlStatement> nodes;
    private final Map<String, Integer> indexByKey;
    private final List<List<Integer>> dependents;
    private final int[] inDegree;

    private DependencyGraph(List<DdlStatement> nodes, Map<String, Integer> indexByKey,
            List<List<Integer>> dependents, int[] inDegree) {
        this.nodes = nodes;
        this.indexByKey = indexByKey;
        this.dependents = dependents;
        this.inDegree = inDegree;
    }

    /**
     * Builds the graph of the given statements.
     *
     * @param statements parsed statements in batch order
     * @param ignoreSelfReferences whether a reference from a table to itself is dropped
     * @return dependency graph
     * @throws NullPointerException if {@code statements} is {@code null}
     */
    public static DependencyGraph build(List<DdlStatement> statements,
            boolean ignoreSelfReferences) {
        Preconditions.checkNotNull(statements, "statements must not be null");

        // Step 1: arena in batch order (later duplicate replaces earlier, position kept).
        List<DdlStatement> nodes = new ArrayList<>();
        Map<String, Integer> indexByKey = new HashMap<>();
        for (DdlStatement statement : statements) {
            Integer existing = indexByKey.get(statement.key());
            if (existing != null) {
                log.warn("Table '{}' is created more than once. The last definition is used.",
                        statement.getTableName());
                nodes.set(existing, statement);
                continue;
            }
            indexByKey.put(statement.key(), nodes.size());
            nodes.add(statement);
        }

        // Step 2: edges parent -> child and in-degree per child.
        List<List<Integer>> dependents = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            dependents.add(new ArrayList<>());
        }
        int[] inDegree = new int[nodes.size()];
        for (int child = 0; child < nodes.size(); child++) {
            DdlStatement statement = nodes.get(child);
            for (String referencedKey : statement.getDependencyKeys()) {
                Integer parent = indexByKey.get(referencedKey);
                if (parent == null) {
                    log.debug("'{}' references '{}' outside the batch; not a blocking dependency",
                            statement.getTableName(), referencedKey);
                    continue;
                }
                if (parent == child && ignoreSelfReferences) {
                    log.debug("Self reference of '{}' ignored", statement.getTableName());
                    continue;
                }
                dependents.get(parent).add(child);
                inDegree[child]++;
                log.debug("FK dependency detected: parent='{}' -> child='{}'",
                        nodes.get(parent).getTableName(), statement.getTableName());
            }
        }

        return new DependencyGraph(Collections.unmodifiableList(nodes), indexByKey, dependents,
                inDegree);
    }

    /**
     * Returns the number of tables in the graph.
     *
     * @return node count
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Returns the statements in batch order, duplicates already merged.
     *
     * @return unmodifiable list of statements
     */
    public List<DdlStatement> statements() {
        return nodes;
    }

    /**
     * Returns whether the batch creates the given table.
     *
     * @param tableName table key, or a bare name compared case-insensitively
     * @return {@code true} if the table is a node of this graph
     */
    public boolean contains(String tableName) {
        return lookup(tableName) != null;
    }

    /**
     * Returns the number of in-batch tables the given table depends on.
     *
     * @param tableName table key, or a bare name compared case-insensitively
     * @return in-degree of the table
     * @throws IllegalArgumentException if the table is not part of the graph
     */
    public int inDegreeOf(String tableName) {
        return inDegree[indexOf(tableName)];
    }

    /**
     * Returns the tables that directly reference the given table, in batch order.
     *
     * @param tableName table key, or a bare name compared case-insensitively
     * @return dependent table names
     * @throws IllegalArgumentException if the table is not part of the graph
     */
    public List<String> dependentsOf(String tableName) {
        return dependents.get(indexOf(tableName)).stream()
                .map(i -> nodes.get(i).getTableName()).collect(Collectors.toList());
    }

    /**
     * Orders the tables so that every table follows the in-batch tables it references.
     *
     * @return the ordered statements, or a cycle result naming the tables that could not be
     *         ordered
     */
    public OrderedResult sort() {
        int[] remaining = inDegree.clone();
        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (remaining[i] == 0) {
                ready.add(i);
            }
        }

        List<DdlStatement> ordered = new ArrayList<>(nodes.size());
        boolean[] emitted = new boolean[nodes.size()];
        while (!ready.isEmpty()) {
            int current = ready.poll();
            ordered.add(nodes.get(current));
            emitted[current] = true;

            for (int child : dependents.get(current)) {
                remaining[child]--;
                if (remaining[child] == 0) {
                    ready.add(child);
                }
            }
        }

        if (ordered.size() < nodes.size()) {
            List<String> unresolved = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i++) {
                if (!emitted[i]) {
                    unresolved.add(nodes.get(i).getTableName());
                }
            }
            log.warn("Circular foreign key reference detected for tables: {}", unresolved);
            return OrderedResult.cycle(ordered, unresolved);
        }

        return OrderedResult.ordered(ordered);
    }

    private int indexOf(String tableName) {
        Integer index = lookup(tableName);
        Preconditions.checkArgument(index != null, "Unknown table: %s", tableName);
        return index;
    }

    private Integer lookup(String tableName) {
        Integer exact = indexByKey.get(tableName);
        return exact != null ? exact : indexByKey.get(DdlStatement.keyOf(tableName));
    }
}
