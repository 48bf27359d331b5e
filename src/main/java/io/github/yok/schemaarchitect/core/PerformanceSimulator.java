package io.github.yok.schemaarchitect.core;

import io.github.yok.schemaarchitect.config.SimulationConfig;
import io.github.yok.schemaarchitect.config.UsageType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Produces a rule-based performance comparison of all usage types for a given data volume.
 *
 * <h2>Model</h2>
 *
 * <p>
 * Every usage type has a static pair of multipliers: one for a simple single-row transaction
 * (latency) and one for a complex analysis over all rows (throughput). An estimate is
 * {@code baseFactorMs * scale * factor} where
 * {@code scale = max(1, rowCount / rowsPerScaleStep)}; both constants come from
 * {@link SimulationConfig}.
 * </p>
 *
 * <h2>Report</h2>
 *
 * <p>
 * A Markdown document with a comparison table (the proposed type in bold), the details of the
 * proposed type and a conclusion naming the fastest type for transactions and for high-volume
 * analysis. When several types tie, the one listed first wins.
 * </p>
 *
 * <p>
 * The DDL is accepted for interface symmetry with the other tools; the estimate does not depend
 * on it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PerformanceSimulator {

    static final String INVALID_TYPE_MESSAGE =
            "ERROR: Proposed usage type is invalid for performance estimation.";

    /**
     * Multipliers per usage type, in report order.
     */
    static final Map<UsageType, Profile> PROFILES;

    static {
        Map<UsageType, Profile> m = new LinkedHashMap<>();
        m.put(UsageType.OLTP, new Profile(0.1, 500.0));
        m.put(UsageType.OLAP, new Profile(10.0, 20.0));
        m.put(UsageType.HTAP, new Profile(0.5, 40.0));
        m.put(UsageType.STREAM, new Profile(0.01, 1000.0));
        m.put(UsageType.OLLP, new Profile(0.001, 2000.0));
        m.put(UsageType.BATCH, new Profile(50.0, 5.0));
        PROFILES = Collections.unmodifiableMap(m);
    }

    private final SimulationConfig config;

    /**
     * Builds the performance report.
     *
     * @param ddl DDL the estimate is made for; not inspected
     * @param rowCount anticipated total row count
     * @param proposedUsageType usage type proposed for the schema, case-insensitive
     * @return Markdown report, or {@link #INVALID_TYPE_MESSAGE} if the usage type is unknown
     */
    public String simulate(String ddl, long rowCount, String proposedUsageType) {
        Optional<UsageType> proposed = UsageType.fromLabel(proposedUsageType);
        if (proposed.isEmpty() || !PROFILES.containsKey(proposed.get())) {
            log.warn("Unknown usage type for performance estimation: {}", proposedUsageType);
            return INVALID_TYPE_MESSAGE;
        }
        UsageType proposedType = proposed.get();
        double scale = scaleFor(rowCount);

        List<String> report = new ArrayList<>();
        report.add(String.format(Locale.ROOT, "## Performance Simulation Report (%d Rows)",
                rowCount));
        report.add("The time estimates below are simulated (rule-based) for relative comparison:");
        report.add("");
        report.add("### Comparison Table for All Processing Types:");
        report.add("| Processing Type | Simple Transaction (Latency) "
                + "| Complex Analysis (Throughput) |");
        report.add("| :--- | :--- | :--- |");

        UsageType bestTransactionType = null;
        UsageType bestAnalysisType = null;
        double bestTransactionMs = Double.POSITIVE_INFINITY;
        double bestAnalysisMs = Double.POSITIVE_INFINITY;
        for (Map.Entry<UsageType, Profile> entry : PROFILES.entrySet()) {
            double transactionMs = estimate(scale, entry.getValue().getTransactionFactor());
            double analysisMs = estimate(scale, entry.getValue().getComplexAnalysisFactor());
            if (transactionMs < bestTransactionMs) {
                bestTransactionMs = transactionMs;
                bestTransactionType = entry.getKey();
            }
            if (analysisMs < bestAnalysisMs) {
                bestAnalysisMs = analysisMs;
                bestAnalysisType = entry.getKey();
            }
            String label = entry.getKey() == proposedType ? "**" + entry.getKey() + "**"
                    : entry.getKey().name();
            report.add(String.format(Locale.ROOT, "| %s | %s | %s |", label,
                    formatMillis(transactionMs), formatMinutes(analysisMs)));
        }
        report.add("");

        Profile proposedProfile = PROFILES.get(proposedType);
        report.add(String.format(Locale.ROOT, "### Estimation Details for Proposed Type (%s):",
                proposedType));
        report.add("- **Simple Transaction (1 row):** "
                + formatMillis(estimate(scale, proposedProfile.getTransactionFactor())));
        report.add(String.format(Locale.ROOT, "- **Complex Analysis (%d rows):** %s", rowCount,
                formatMinutes(estimate(scale, proposedProfile.getComplexAnalysisFactor()))));
        report.add("");

        report.add("## Performance Conclusion");
        report.add("From this simulation, the best type for **Transaction Speed** is: **"
                + bestTransactionType + "**.");
        report.add("The best type for **High Volume Analysis** is: **" + bestAnalysisType + "**.");

        log.info("Performance simulation finished. rows={}, proposed={}, bestTransaction={}, "
                + "bestAnalysis={}", rowCount, proposedType, bestTransactionType, bestAnalysisType);
        return String.join("\n", report);
    }

    /**
     * Returns the volume scale for the given row count, never below 1.
     */
    double scaleFor(long rowCount) {
        double step = Math.max(1L, config.getRowsPerScaleStep());
        return Math.max(1.0, rowCount / step);
    }

    private double estimate(double scale, double factor) {
        return config.getBaseFactorMs() * scale * factor;
    }

    private static String formatMillis(double millis) {
        return String.format(Locale.ROOT, "%.3f ms", millis);
    }

    private static String formatMinutes(double millis) {
        return String.format(Locale.ROOT, "%.2f min", millis / 1000.0 / 60.0);
    }

    /**
     * Latency and throughput multipliers of one usage type.
     */
    @Getter
    @AllArgsConstructor
    static final class Profile {
        // Multiplier for a simple single-row transaction
        private final double transactionFactor;
        // Multiplier for a complex analysis over all rows
        private final double complexAnalysisFactor;
    }
}
