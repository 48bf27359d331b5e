package io.github.yok.schemaarchitect.config;

import java.util.Locale;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Enumerates the data processing categories a schema can be tuned for.
 *
 * <p>
 * The constant name doubles as the label used in reports and on the command line (for example
 * {@code --usage OLAP}).
 * </p>
 *
 * <ul>
 * <li>OLTP: online transaction processing</li>
 * <li>OLAP: online analytical processing</li>
 * <li>HTAP: hybrid transactional/analytical processing</li>
 * <li>OLLP: online low-latency processing</li>
 * <li>BATCH: scheduled bulk processing</li>
 * <li>STREAM: continuous event processing</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum UsageType {
    // Fast, high-volume transactions
    OLTP,
    // Complex analysis of historical data
    OLAP,
    // Mixed transactional and analytical workloads
    HTAP,
    // Decisions within microseconds
    OLLP,
    // Large volumes processed at scheduled times
    BATCH,
    // Continuous ingestion and analysis
    STREAM;

    /**
     * Parses a usage type label leniently.
     *
     * <p>
     * Surrounding whitespace is ignored and the comparison is case-insensitive. {@code null},
     * blank or unknown labels yield {@link Optional#empty()}.
     * </p>
     *
     * @param label label to parse; may be {@code null}
     * @return the matching usage type, or empty if none matches
     */
    public static Optional<UsageType> fromLabel(String label) {
        if (StringUtils.isBlank(label)) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (UsageType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
