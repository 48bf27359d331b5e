package io.github.yok.schemaarchitect.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Holds the constants of the rule-based performance estimation.
 *
 * <ul>
 * <li>{@code simulation.base-factor-ms}: base time unit in milliseconds</li>
 * <li>{@code simulation.rows-per-scale-step}: number of rows that make up one scale step</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "simulation")
@Getter
@Setter
@NoArgsConstructor
public class SimulationConfig {

    /**
     * Base time unit in milliseconds, multiplied by the scale and the per-type factor.
     */
    private double baseFactorMs = 100.0;

    /**
     * Row count corresponding to one scale step. The scale never drops below 1.
     */
    private long rowsPerScaleStep = 100_000L;
}
