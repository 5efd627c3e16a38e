package com.cenalert.runner;

import com.cenalert.core.detection.AnomalyLifecycle;
import com.cenalert.core.detection.DetectorFactory;
import com.cenalert.core.episode.EpisodeExtractor;
import com.cenalert.core.model.AnnotatedRecord;
import com.cenalert.core.model.DetectorParameters;
import com.cenalert.core.model.SeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs detection over many series in parallel.
 *
 * <p>
 * Every series gets its own {@link AnomalyLifecycle} from
 * {@link DetectorFactory}; lifecycles share nothing, so series are
 * distributed over a fixed thread pool. A series that fails (unreadable,
 * malformed) is logged and left out of the result without stopping the
 * others.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesBatch {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesBatch.class);

    static final String SERIES_SUFFIX = ".csv";

    private final DetectorParameters parameters;
    private final EventMatcher matcher;
    private final SeriesCsvReader reader;
    private final ReportWriter writer;
    private final Path outputRoot;
    private final int parallelism;

    /**
     * @param parameters  validated detector parameters
     * @param matcher     event matcher shared by all series
     * @param outputRoot  directory receiving one sub-directory per series, or
     *                    {@code null} to write nothing
     * @param parallelism number of worker threads
     * @throws IllegalArgumentException if {@code parallelism} &lt; 1
     */
    public SeriesBatch(DetectorParameters parameters, EventMatcher matcher, Path outputRoot, int parallelism) {
        this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.outputRoot = outputRoot;
        this.parallelism = parallelism;
        this.reader = new SeriesCsvReader();
        this.writer = new ReportWriter();
    }

    /**
     * Run one series through a fresh lifecycle and match its episodes.
     *
     * @param name       series name used in logs and reports
     * @param series     the points
     * @param parameters validated detector parameters
     * @param matcher    event matcher
     * @return the series report
     */
    public static SeriesReport analyze(String name, List<SeriesPoint> series, DetectorParameters parameters,
            EventMatcher matcher) {
        AnomalyLifecycle lifecycle = DetectorFactory.create(parameters);
        List<AnnotatedRecord> records = lifecycle.run(series);

        List<MatchedEpisode> anomalies = matcher.matchAll(EpisodeExtractor.extract(records)).stream()
                .sorted(Comparator.comparingDouble(MatchedEpisode::getImpact))
                .collect(Collectors.toList());
        List<MatchedEpisode> explainable = anomalies.stream()
                .filter(m -> m.isWithin(EventMatcher.EXPLAINABLE_DAYS))
                .collect(Collectors.toList());

        SeriesReport report = new SeriesReport(name, records, anomalies, explainable);
        LOG.info("Series [{}]: {} episode(s), total impact {}, {} explainable",
                name, anomalies.size(), report.totalImpact(), explainable.size());
        return report;
    }

    /**
     * List the series files of a directory, sorted by name.
     *
     * @param directory directory to scan
     * @return the {@value #SERIES_SUFFIX} files directly inside it
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> seriesFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SERIES_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Process every file and, unless this batch has no output root, write each
     * report to {@code <outputRoot>/<series-name>/}.
     *
     * @param files series files
     * @return reports of the series that completed, in file order
     */
    public List<SeriesReport> run(List<Path> files) {
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
        try {
            List<Future<SeriesReport>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> process(file)));
            }

            List<SeriesReport> reports = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    reports.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    LOG.error("Series [{}] failed: {}", seriesName(files.get(i)), e.getCause().getMessage(),
                            e.getCause());
                }
            }
            LOG.info("Processed {} of {} series", reports.size(), files.size());
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for series results", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private SeriesReport process(Path file) throws IOException {
        String name = seriesName(file);
        SeriesReport report = analyze(name, reader.readSeries(file), parameters, matcher);
        if (outputRoot != null) {
            writer.write(report, outputRoot.resolve(name));
        }
        return report;
    }

    static String seriesName(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.endsWith(SERIES_SUFFIX)
                ? fileName.substring(0, fileName.length() - SERIES_SUFFIX.length())
                : fileName;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "cenalert-series-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
