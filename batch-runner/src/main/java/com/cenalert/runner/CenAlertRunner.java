package com.cenalert.runner;

import com.cenalert.core.config.ParametersLoader;
import com.cenalert.core.model.DetectorParameters;
import com.cenalert.core.model.SeriesPoint;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Main entry point for the batch runner.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   series CSV (or directory of series CSVs)
 *     → AnomalyLifecycle per series (algorithm from the parameters file)
 *     → EpisodeExtractor
 *     → EventMatcher (nearest known event)
 *     → annotated.csv, anomalies.csv, explainable.csv
 * </pre>
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@value #EXIT_OK}: every series was processed</li>
 * <li>{@value #EXIT_INPUT_ERROR}: an input file is missing or unreadable, or
 * a series failed</li>
 * <li>{@value #EXIT_USAGE_ERROR}: malformed arguments or parameters</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class CenAlertRunner {

    private static final Logger LOG = LoggerFactory.getLogger(CenAlertRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_USAGE_ERROR = 2;

    private CenAlertRunner() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run one invocation.
     *
     * @param args command-line arguments
     * @return process exit code
     */
    static int run(String[] args) {
        // 1. Parse arguments
        RunnerConfig config;
        try {
            config = RunnerConfig.fromArgs(args);
        } catch (ParseException | IllegalArgumentException e) {
            System.err.println(e.getMessage());
            RunnerConfig.printUsage(new PrintWriter(System.err, true, StandardCharsets.UTF_8));
            return EXIT_USAGE_ERROR;
        }
        LOG.info("Starting cen-alert with config: {}", config);

        // 2. Load and bind parameters
        DetectorParameters parameters;
        try {
            parameters = loadParameters(config);
        } catch (IllegalArgumentException e) {
            LOG.error("{}", e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IllegalStateException e) {
            LOG.error("{}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        LOG.info("Using {}", parameters);

        try {
            // 3. Load events
            SeriesCsvReader reader = new SeriesCsvReader();
            EventMatcher matcher = new EventMatcher(
                    config.getEventsPath() != null ? reader.readEvents(config.getEventsPath()) : List.of());

            // 4. Detect, match and report
            if (Files.isDirectory(config.getSeriesPath())) {
                return runDirectory(config, parameters, matcher);
            }
            List<SeriesPoint> series = reader.readSeries(config.getSeriesPath());
            SeriesReport report = SeriesBatch.analyze(
                    SeriesBatch.seriesName(config.getSeriesPath()), series, parameters, matcher);
            for (MatchedEpisode episode : report.getAnomalies()) {
                LOG.info("  {}", episode);
            }
            if (!config.isDryRun()) {
                new ReportWriter().write(report, config.getOutputDirectory());
            }
            return EXIT_OK;
        } catch (IllegalArgumentException | IOException e) {
            LOG.error("{}", e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Read the parameters file, apply the algorithm override and validate.
     * Without a parameters path the file comes from
     * {@value ParametersLoader#ENV_PARAMETERS_PATH} or the bundled defaults.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file or parameters are invalid
     */
    static DetectorParameters loadParameters(RunnerConfig config) {
        DetectorParameters parameters = config.getParametersPath() != null
                ? ParametersLoader.fromFile(config.getParametersPath().toString())
                : ParametersLoader.load(ParametersLoader.DEFAULT_RESOURCE);
        if (config.getAlgorithm() != null) {
            parameters.setAlgorithm(config.getAlgorithm());
        }
        parameters.validate();
        return parameters;
    }

    private static int runDirectory(RunnerConfig config, DetectorParameters parameters, EventMatcher matcher)
            throws IOException {
        List<Path> files = SeriesBatch.seriesFiles(config.getSeriesPath());
        if (files.isEmpty()) {
            LOG.error("No series files ({}) found in {}", SeriesBatch.SERIES_SUFFIX, config.getSeriesPath());
            return EXIT_INPUT_ERROR;
        }
        LOG.info("Processing {} series with parallelism {}", files.size(), config.getParallelism());

        SeriesBatch batch = new SeriesBatch(parameters, matcher, config.getOutputDirectory(),
                config.getParallelism());
        List<SeriesReport> reports = batch.run(files);
        return reports.size() == files.size() ? EXIT_OK : EXIT_INPUT_ERROR;
    }
}
