package io.github.yok.schemaarchitect.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code designer} section in {@code application.yml}. Holds
 * the defaults applied by the command line when an option is omitted.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "designer")
@Data
public class DesignerConfig {

    // Usage type label used when --usage is omitted
    private String defaultUsageType = UsageType.OLTP.name();

    // Result description used when --description is omitted
    private String defaultResultDescription = "Sample result";
}
