package io.github.yok.schemaarchitect.core;

import io.github.yok.schemaarchitect.config.UsageType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Appends a canned optimization note to a DDL script, keyed by usage type.
 *
 * <p>
 * The DDL itself is not analyzed or changed. The note consists of a header line
 * {@code -- OPTIMIZATION FOR <LABEL>:} followed by one recommendation comment line.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DdlOptimizer {

    /**
     * Recommendation line per usage type.
     */
    static final Map<UsageType, String> RECOMMENDATIONS;

    static {
        Map<UsageType, String> m = new EnumMap<>(UsageType.class);
        m.put(UsageType.OLTP, "-- Optimized for high-volume write speed and data integrity "
                + "(suggesting indexes on FK/PK and proper normalization).");
        m.put(UsageType.OLAP, "-- Optimized for read speed and aggregation "
                + "(suggesting Columnar Indexes, partitioning by time, or denormalization).");
        m.put(UsageType.HTAP, "-- Optimized for low latency on real-time data analytics "
                + "(suggesting In-Memory tables or hybrid indexing).");
        m.put(UsageType.OLLP, "-- Optimized for sub-millisecond decisions "
                + "(ensuring minimal structure, focusing on data locality and low network "
                + "overhead).");
        m.put(UsageType.BATCH, "-- Optimized for high-throughput scheduled processing "
                + "(suggesting large block sizes, table partitioning for parallel loading, and "
                + "minimal indexing during load).");
        m.put(UsageType.STREAM, "-- Optimized for continuous ingestion and real-time event "
                + "detection (suggesting Time-Series partitioning, Kafka integration points, and "
                + "high-speed primary key lookups).");
        RECOMMENDATIONS = Collections.unmodifiableMap(m);
    }

    /** Used when the usage type is unknown. */
    static final String GENERAL_RECOMMENDATION =
            "-- General optimization applied. No specific processing type detected.";

    /**
     * Appends the optimization note for {@code usageType} to {@code ddl}.
     *
     * @param ddl DDL script; {@code null} is treated as empty
     * @param usageType usage type label, case-insensitive; unknown labels get the general note
     * @return the DDL followed by the optimization note
     */
    public String optimize(String ddl, String usageType) {
        String label = StringUtils.defaultString(usageType).toUpperCase(Locale.ROOT);
        String recommendation = UsageType.fromLabel(usageType).map(RECOMMENDATIONS::get)
                .orElse(GENERAL_RECOMMENDATION);
        log.info("Annotating DDL for usage type [{}]", label);
        return StringUtils.defaultString(ddl) + "\n-- OPTIMIZATION FOR " + label + ":\n"
                + recommendation + "\n";
    }
}
