package com.cenalert.runner;

import com.cenalert.core.config.ParametersLoader;
import com.cenalert.core.model.DetectorParameters;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Typed, immutable configuration of one runner invocation.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromArgs(String[])} for the command line, or the
 * {@link Builder} for programmatic / test scenarios. The builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    static final List<String> ALGORITHMS = List.of(DetectorParameters.CHEBYSHEV, DetectorParameters.MEDIAN,
            DetectorParameters.IFOREST, DetectorParameters.LOF);

    // ---------------------------------------------------------------
    // Input
    // ---------------------------------------------------------------
    private final Path seriesPath;
    private final Path eventsPath;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final String algorithm;
    private final Path parametersPath;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final Path outputDirectory;
    private final boolean dryRun;
    private final int parallelism;

    private RunnerConfig(Builder b) {
        this.seriesPath = b.seriesPath;
        this.eventsPath = b.eventsPath;
        this.algorithm = b.algorithm;
        this.parametersPath = b.parametersPath;
        this.outputDirectory = b.dryRun ? null : (b.outputDirectory != null ? b.outputDirectory : Path.of("."));
        this.dryRun = b.dryRun;
        this.parallelism = b.parallelism;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from the command line
    // ---------------------------------------------------------------

    /**
     * @return the options understood by {@link #fromArgs(String[])}
     */
    public static Options options() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("path").hasArg().argName("file|dir").required()
                .desc("series CSV, or a directory of series CSVs").build());
        options.addOption(Option.builder().longOpt("events").hasArg().argName("file")
                .desc("known events to match anomalies against").build());
        options.addOption(Option.builder().longOpt("algorithm").hasArg().argName("name")
                .desc("anomaly detection algorithm: " + String.join(", ", ALGORITHMS)).build());
        options.addOption(Option.builder().longOpt("parameters").hasArg().argName("file")
                .desc("YAML file with the algorithm parameters (default: $"
                        + ParametersLoader.ENV_PARAMETERS_PATH + ", else the bundled defaults)").build());
        options.addOption(Option.builder().longOpt("parallelism").hasArg().argName("n")
                .desc("worker threads for directory input (default: available processors)").build());

        OptionGroup output = new OptionGroup();
        output.addOption(Option.builder().longOpt("output").hasArg().argName("dir")
                .desc("output directory (default: .)").build());
        output.addOption(Option.builder().longOpt("dry-run")
                .desc("do not write any files").build());
        options.addOptionGroup(output);
        return options;
    }

    /**
     * Build a {@link RunnerConfig} from command-line arguments.
     *
     * @param args raw arguments
     * @return validated configuration
     * @throws ParseException           if the arguments are malformed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static RunnerConfig fromArgs(String[] args) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Builder builder = new Builder()
                .seriesPath(Path.of(cmd.getOptionValue("path")))
                .algorithm(cmd.getOptionValue("algorithm"))
                .dryRun(cmd.hasOption("dry-run"));
        if (cmd.hasOption("parameters")) {
            builder.parametersPath(Path.of(cmd.getOptionValue("parameters")));
        }
        if (cmd.hasOption("events")) {
            builder.eventsPath(Path.of(cmd.getOptionValue("events")));
        }
        if (cmd.hasOption("output")) {
            builder.outputDirectory(Path.of(cmd.getOptionValue("output")));
        }
        if (cmd.hasOption("parallelism")) {
            try {
                builder.parallelism(Integer.parseInt(cmd.getOptionValue("parallelism")));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "parallelism must be an integer, got: " + cmd.getOptionValue("parallelism"), e);
            }
        }
        return builder.build();
    }

    /**
     * Print usage to {@code out}.
     *
     * @param out target writer
     */
    public static void printUsage(PrintWriter out) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(out, HelpFormatter.DEFAULT_WIDTH, "cen-alert", null, options(),
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        out.flush();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getSeriesPath() {
        return seriesPath;
    }

    /**
     * @return events file, or {@code null} when none was given
     */
    public Path getEventsPath() {
        return eventsPath;
    }

    /**
     * @return algorithm override, or {@code null} to use the parameters file
     */
    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * @return parameters file, or {@code null} to resolve it through
     *         {@link ParametersLoader#load(String)}
     */
    public Path getParametersPath() {
        return parametersPath;
    }

    /**
     * @return output directory, or {@code null} on a dry run
     */
    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the series path is set, the algorithm (if any) is known, parallelism is positive,
     * and that an output directory is not combined with a dry run.
     * </p>
     */
    public static class Builder {
        private Path seriesPath;
        private Path eventsPath;
        private String algorithm;
        private Path parametersPath;
        private Path outputDirectory;
        private boolean dryRun;
        private int parallelism = Runtime.getRuntime().availableProcessors();

        public Builder seriesPath(Path v) {
            this.seriesPath = v;
            return this;
        }

        public Builder eventsPath(Path v) {
            this.eventsPath = v;
            return this;
        }

        public Builder algorithm(String v) {
            this.algorithm = v != null ? v.trim().toLowerCase(Locale.ROOT) : null;
            return this;
        }

        public Builder parametersPath(Path v) {
            this.parametersPath = v;
            return this;
        }

        public Builder outputDirectory(Path v) {
            this.outputDirectory = v;
            return this;
        }

        public Builder dryRun(boolean v) {
            this.dryRun = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws NullPointerException     if a required path is missing
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            Objects.requireNonNull(seriesPath, "seriesPath required");

            if (algorithm != null && !ALGORITHMS.contains(algorithm)) {
                throw new IllegalArgumentException(
                        "algorithm must be one of " + ALGORITHMS + ", got: " + algorithm);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (dryRun && outputDirectory != null) {
                throw new IllegalArgumentException("outputDirectory cannot be combined with dryRun");
            }

            return new RunnerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "seriesPath=" + seriesPath +
                ", eventsPath=" + eventsPath +
                ", algorithm='" + algorithm + '\'' +
                ", parametersPath=" + parametersPath +
                ", outputDirectory=" + outputDirectory +
                ", dryRun=" + dryRun +
                ", parallelism=" + parallelism +
                '}';
    }
}
