package io.github.yok.schemaarchitect.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code ddl.ordering} section in {@code application.yml}.
 *
 * <pre>
 * ddl:
 *   ordering:
 *     unparsed-statement-policy: DROP
 *     ignore-self-references: false
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "ddl.ordering")
@Data
public class DdlOrderingConfig {

    /**
     * Handling of statements without a recognized {@code CREATE TABLE} header. Defaults to
     * {@link UnparsedStatementPolicy#DROP}.
     */
    private UnparsedStatementPolicy unparsedStatementPolicy = UnparsedStatementPolicy.DROP;

    /**
     * When {@code true}, a foreign key from a table to itself does not block ordering. Defaults to
     * {@code false}, in which case such a table is reported as part of a cycle.
     */
    private boolean ignoreSelfReferences = false;
}
