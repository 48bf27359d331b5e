package io.github.yok.schemaarchitect;

import io.github.yok.schemaarchitect.config.DesignerConfig;
import io.github.yok.schemaarchitect.core.DdlOptimizer;
import io.github.yok.schemaarchitect.core.DmlOutputSimulator;
import io.github.yok.schemaarchitect.core.PerformanceSimulator;
import io.github.yok.schemaarchitect.core.SchemaValidator;
import io.github.yok.schemaarchitect.core.SqlCodeBlockFormatter;
import io.github.yok.schemaarchitect.ddl.DdlDependencyResolver;
import io.github.yok.schemaarchitect.util.ErrorHandler;
import io.github.yok.schemaarchitect.util.ScriptFiles;
import java.io.IOException;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Exactly one mode option selects the operation; its argument is the input file ({@code -} reads
 * standard input):
 * </p>
 * <ul>
 * <li>{@code --order} / {@code -o}: orders the {@code CREATE TABLE} statements of a SQL file by
 * foreign key dependency ({@link DdlDependencyResolver}).</li>
 * <li>{@code --format} / {@code -f}: orders the {@code sql} code blocks of a Markdown response
 * ({@link SqlCodeBlockFormatter}).</li>
 * <li>{@code --optimize} / {@code -z}: appends the optimization note for {@code --usage}
 * ({@link DdlOptimizer}).</li>
 * <li>{@code --estimate} / {@code -e}: prints the performance report for {@code --rows} and
 * {@code --usage} ({@link PerformanceSimulator}).</li>
 * <li>{@code --validate} / {@code -v}: validates against the JSON file given by {@code --sample}
 * ({@link SchemaValidator}).</li>
 * <li>{@code --simulate-dml} / {@code -s}: simulates the output of a {@code SELECT} query, using
 * {@code --description} as caption ({@link DmlOutputSimulator}).</li>
 * </ul>
 *
 * <p>
 * Auxiliary options: {@code --usage}/{@code -u}, {@code --rows}/{@code -r}, {@code --sample},
 * {@code --description} and {@code --out} (write the result to a file instead of standard output).
 * Omitted {@code --usage} and {@code --description} fall back to {@link DesignerConfig}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see DesignerConfig
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final DesignerConfig designerConfig;
    private final DdlDependencyResolver resolver;
    private final SqlCodeBlockFormatter formatter;
    private final DdlOptimizer optimizer;
    private final SchemaValidator validator;
    private final PerformanceSimulator performanceSimulator;
    private final DmlOutputSimulator dmlOutputSimulator;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = null;
        String input = null;
        String usage = null;
        String rows = null;
        String sample = null;
        String description = null;
        String out = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--order":
                case "-o":
                    mode = "order";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--format":
                case "-f":
                    mode = "format";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--optimize":
                case "-z":
                    mode = "optimize";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--estimate":
                case "-e":
                    mode = "estimate";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--validate":
                case "-v":
                    mode = "validate";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--simulate-dml":
                case "-s":
                    mode = "simulate-dml";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--usage":
                case "-u":
                    usage = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--rows":
                case "-r":
                    rows = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--sample":
                    sample = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--description":
                    description = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--out":
                    out = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null) {
            ErrorHandler.reportFatal("No mode specified. Use one of --order, --format, "
                    + "--optimize, --estimate, --validate or --simulate-dml.");
            return;
        }
        if (StringUtils.isBlank(input)) {
            ErrorHandler.reportFatal("Input file is required in " + mode + " mode.");
            return;
        }

        // Defaults
        if (StringUtils.isBlank(usage)) {
            usage = designerConfig.getDefaultUsageType();
        }
        if (StringUtils.isBlank(description)) {
            description = designerConfig.getDefaultResultDescription();
        }

        long rowCount = 0L;
        if ("estimate".equals(mode)) {
            if (StringUtils.isBlank(rows)) {
                ErrorHandler.reportFatal("Row count (--rows) is required in estimate mode.");
                return;
            }
            try {
                rowCount = Long.parseLong(rows.trim());
            } catch (NumberFormatException e) {
                ErrorHandler.reportFatal("Row count must be a whole number: " + rows);
                return;
            }
        }
        if ("validate".equals(mode) && StringUtils.isBlank(sample)) {
            ErrorHandler.reportFatal("Sample data file (--sample) is required in validate mode.");
            return;
        }

        log.info("Mode: {}, Input: {}, Usage: {}", mode, input, usage);

        // Execute
        try {
            String text = ScriptFiles.read(input);
            String result;
            switch (mode) {
                case "order":
                    result = resolver.resolve(text);
                    break;
                case "format":
                    result = formatter.format(text);
                    break;
                case "optimize":
                    result = optimizer.optimize(text, usage);
                    break;
                case "estimate":
                    result = performanceSimulator.simulate(text, rowCount, usage);
                    break;
                case "validate":
                    result = validator.validate(text, ScriptFiles.read(sample));
                    break;
                default:
                    result = dmlOutputSimulator.simulate(text, description);
                    break;
            }

            if (out != null) {
                ScriptFiles.write(out, result);
            } else {
                System.out.println(result);
            }
            log.info("Completed {} mode.", mode);

        } catch (IOException e) {
            ErrorHandler.reportFatal("Fatal error in " + mode + " mode: " + e.getMessage(), e);
        }
    }
}
