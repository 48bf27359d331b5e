package io.github.yok.schemaarchitect.ddl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * One {@code CREATE TABLE} statement of a batch.
 *
 * <ul>
 * <li>{@code tableName}: the created table, as written (quotes removed).</li>
 * <li>{@code rawText}: the original statement fragment with the {@code ;} terminator
 * re-appended.</li>
 * <li>{@code dependsOn}: tables named after {@code REFERENCES}, in order of first appearance and
 * as first written. A reference to the table itself is kept.</li>
 * <li>{@code dependencyKeys}: the identity keys of {@code dependsOn}, in the same order.</li>
 * </ul>
 *
 * <p>
 * Identity is the table's key ({@link #key()}): the lower-cased name for a bare word, the exact
 * name for a quoted identifier (see {@link SqlToken#identityKey()}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class DdlStatement {

    static final String TERMINATOR = ";";

    private final String tableName;
    @Getter(AccessLevel.NONE)
    private final String tableKey;
    private final String rawText;
    private final Set<String> dependsOn;
    private final Set<String> dependencyKeys;

    /**
     * Creates a statement whose table and referenced tables are all bare (unquoted) names.
     *
     * @param tableName created table name
     * @param fragment statement fragment without terminator
     * @param dependsOn referenced table names in order of appearance
     */
    public DdlStatement(String tableName, String fragment, Set<String> dependsOn) {
        this(tableName, keyOf(tableName), fragment, bareReferences(dependsOn));
    }

    /**
     * Creates a statement with explicit identity keys.
     *
     * @param tableName created table name
     * @param tableKey identity key of the created table
     * @param fragment statement fragment without terminator
     * @param referencesByKey referenced table names keyed by identity key, in order of appearance
     */
    public DdlStatement(String tableName, String tableKey, String fragment,
            Map<String, String> referencesByKey) {
        this.tableName = tableName;
        this.tableKey = tableKey;
        this.rawText = fragment + TERMINATOR;
        this.dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(referencesByKey.values()));
        this.dependencyKeys =
                Collections.unmodifiableSet(new LinkedHashSet<>(referencesByKey.keySet()));
    }

    /**
     * Returns the identity key of this statement's table.
     *
     * @return table key
     */
    public String key() {
        return tableKey;
    }

    /**
     * Returns the key of a bare (unquoted) table name.
     *
     * @param tableName table name
     * @return table name in lower case ({@link Locale#ROOT})
     */
    public static String keyOf(String tableName) {
        return tableName.toLowerCase(Locale.ROOT);
    }

    private static Map<String, String> bareReferences(Set<String> names) {
        Map<String, String> references = new LinkedHashMap<>();
        for (String name : names) {
            references.putIfAbsent(keyOf(name), name);
        }
        return references;
    }
}
