package com.signal.corroboration.cli;

import com.signal.corroboration.aggregate.AggregatorOptions;
import com.signal.corroboration.aggregate.CorroborationAggregator;
import com.signal.corroboration.core.model.EntityRecord;
import com.signal.corroboration.fetch.BlockedOriginRegistry;
import com.signal.corroboration.fetch.FetcherConfig;
import com.signal.corroboration.fetch.HttpTransport;
import com.signal.corroboration.fetch.JdkHttpTransport;
import com.signal.corroboration.fetch.ResilientFetcher;
import com.signal.corroboration.inventory.CsvEntityExporter;
import com.signal.corroboration.inventory.EntityExporter;
import com.signal.corroboration.inventory.ExportResult;
import com.signal.corroboration.inventory.JsonEntityExporter;
import com.signal.corroboration.inventory.RankedInventory;
import com.signal.corroboration.metrics.MetricsService;
import com.signal.corroboration.metrics.MicrometerMetricsService;
import com.signal.corroboration.pipeline.CollectionPipeline;
import com.signal.corroboration.pipeline.PipelineOptions;
import com.signal.corroboration.pipeline.PipelineReport;
import com.signal.corroboration.pipeline.SourceRegistry;
import com.signal.corroboration.rules.ObservationNormalizer;
import com.signal.corroboration.source.CatalogLoadException;
import com.signal.corroboration.source.SeedListSource;
import com.signal.corroboration.source.SourceCatalog;
import com.signal.corroboration.source.SourceDefinition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Runs a collection over the configured sources and writes the ranked inventory.
 *
 * <p>Exit code 0 for any completed run, including runs where some sources failed;
 * 1 when the catalog, seed list or output location is unusable.</p>
 */
@Command(
    name = "corroborate",
    mixinStandardHelpOptions = true,
    version = "corroborate 1.0",
    description = "Collects observations from web sources and ranks entities by corroboration."
)
public class CorroborateCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CorroborateCommand.class);

    static final String DEFAULT_CATALOG_RESOURCE = "/catalog/default-sources.json";

    enum Format { csv, json }

    @Spec
    private CommandSpec spec;

    @Option(names = {"-s", "--sources"}, split = ",",
            description = "Source ids to run, in order (default: seed plus every catalog source)")
    private List<String> sourceIds;

    @Option(names = {"-c", "--catalog"}, description = "Source catalog JSON file (default: bundled catalog)")
    private Path catalogFile;

    @Option(names = "--seed", description = "Seed list JSON file registered as source 'seed'")
    private Path seedFile;

    @Option(names = {"-o", "--output"}, defaultValue = ".",
            description = "Output directory (default: ${DEFAULT-VALUE})")
    private Path outputDir;

    @Option(names = {"-f", "--format"}, defaultValue = "csv",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Format format;

    @Option(names = "--parallel", description = "Run sources concurrently")
    private boolean parallel;

    @Option(names = "--max-concurrency", defaultValue = "4",
            description = "Sources running at once with --parallel (default: ${DEFAULT-VALUE})")
    private int maxConcurrency;

    @Option(names = "--min-interval-ms", defaultValue = "2000",
            description = "Minimum delay between requests of one source (default: ${DEFAULT-VALUE})")
    private long minIntervalMs;

    @Option(names = "--max-attempts", defaultValue = "3",
            description = "Direct attempts per document (default: ${DEFAULT-VALUE})")
    private int maxAttempts;

    @Option(names = "--backoff-ms", defaultValue = "1000",
            description = "Backoff unit between attempts (default: ${DEFAULT-VALUE})")
    private long backoffMs;

    @Option(names = "--request-timeout-ms", defaultValue = "20000",
            description = "Timeout of a single request (default: ${DEFAULT-VALUE})")
    private long requestTimeoutMs;

    @Option(names = "--top", defaultValue = "10",
            description = "Entities listed in the summary (default: ${DEFAULT-VALUE})")
    private int top;

    private final Function<FetcherConfig, HttpTransport> transportFactory;

    public CorroborateCommand() {
        this(config -> new JdkHttpTransport(config.requestTimeout()));
    }

    /**
     * @param transportFactory called once per activated source, so sources never share cookies or connections
     */
    CorroborateCommand(Function<FetcherConfig, HttpTransport> transportFactory) {
        this.transportFactory = transportFactory;
    }

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new CorroborateCommand());
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SourceCatalog catalog;
        FetcherConfig fetcherConfig;
        PipelineOptions pipelineOptions;
        try {
            if (top < 0) {
                throw new IllegalArgumentException("--top must be >= 0");
            }
            catalog = loadCatalog();
            fetcherConfig = FetcherConfig.defaults()
                    .withMinInterval(Duration.ofMillis(minIntervalMs))
                    .withMaxAttempts(maxAttempts)
                    .withBackoffUnit(Duration.ofMillis(backoffMs))
                    .withRequestTimeout(Duration.ofMillis(requestTimeoutMs));
            pipelineOptions = parallel ? PipelineOptions.parallel(maxConcurrency) : PipelineOptions.sequential();
        } catch (CatalogLoadException | IllegalArgumentException e) {
            log.error("cli.configInvalid error={}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }

        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        MetricsService metrics = new MicrometerMetricsService(meterRegistry);
        BlockedOriginRegistry blockedOrigins = new BlockedOriginRegistry();
        ObservationNormalizer normalizer = ObservationNormalizer.createDefault();

        SourceRegistry registry = new SourceRegistry();
        List<String> defaultIds = new ArrayList<>();
        try {
            if (seedFile != null) {
                SeedListSource seed = new SeedListSource(SeedListSource.DEFAULT_ID, SeedListSource.DEFAULT_LABEL,
                        SeedListSource.readEntries(seedFile), normalizer.getExclusionPolicy());
                registry.register(seed.id(), () -> seed);
                defaultIds.add(seed.id());
            }
            for (SourceDefinition definition : catalog.definitions()) {
                registry.register(definition.id(), () -> catalog.create(definition,
                        ResilientFetcher.builder()
                                .transport(transportFactory.apply(fetcherConfig))
                                .registry(blockedOrigins)
                                .config(fetcherConfig)
                                .metricsService(metrics)
                                .build(),
                        normalizer.getExclusionPolicy()));
                defaultIds.add(definition.id());
            }
        } catch (CatalogLoadException | IllegalArgumentException e) {
            log.error("cli.configInvalid error={}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            return 1;
        }

        CollectionPipeline pipeline = new CollectionPipeline(registry,
                new CorroborationAggregator(normalizer, AggregatorOptions.defaults(), metrics),
                blockedOrigins, pipelineOptions, metrics);
        PipelineReport report = pipeline.run(sourceIds != null && !sourceIds.isEmpty() ? sourceIds : defaultIds);

        EntityExporter exporter = format == Format.json ? new JsonEntityExporter() : new CsvEntityExporter();
        Path target = outputDir.resolve("entities." + exporter.getFormat());
        ExportResult exported;
        try {
            Files.createDirectories(outputDir);
            try (OutputStream os = Files.newOutputStream(target)) {
                exported = exporter.export(report.inventory(), os);
            }
        } catch (IOException e) {
            log.error("cli.exportFailed target={} error={}", target, e.getMessage());
            err.println("Cannot write " + target + ": " + e.getMessage());
            return 1;
        }

        printSummary(out, report, exported, target);
        return 0;
    }

    private SourceCatalog loadCatalog() {
        if (catalogFile != null) {
            return SourceCatalog.load(catalogFile);
        }
        try (InputStream in = CorroborateCommand.class.getResourceAsStream(DEFAULT_CATALOG_RESOURCE)) {
            if (in == null) {
                throw new CatalogLoadException("Bundled catalog " + DEFAULT_CATALOG_RESOURCE + " not found");
            }
            return SourceCatalog.load(in);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot read bundled catalog: " + e.getMessage(), e);
        }
    }

    private void printSummary(PrintWriter out, PipelineReport report, ExportResult exported, Path target) {
        RankedInventory inventory = report.inventory();
        out.printf("Observations: %d raw, %d entities, %d high confidence%n",
                inventory.rawObservationCount(), inventory.size(), inventory.highConfidence().size());
        report.observationsBySource().forEach((id, count) -> out.printf("  %-12s %d%n", id, count));
        report.failedSources().forEach((id, error) -> out.printf("  %-12s FAILED %s%n", id, error));
        if (!report.unknownSources().isEmpty()) {
            out.println("Unknown sources: " + String.join(", ", report.unknownSources()));
        }
        if (!report.blockedOrigins().isEmpty()) {
            out.println("Blocked origins: " + String.join(", ", report.blockedOrigins()));
        }
        int rank = 0;
        for (EntityRecord entity : inventory.top(top)) {
            out.printf("%3d. %s [%s] score=%d sources=%d%n", ++rank, entity.getDisplayName(),
                    entity.getRegion().isEmpty() ? "?" : entity.getRegion(),
                    entity.getCorroborationScore(), entity.getSources().size());
        }
        Map<String, Long> regions = inventory.regionCounts();
        if (!regions.isEmpty()) {
            out.println("By region: " + regions);
        }
        out.printf("Wrote %d entities to %s%n", exported.totalEntities(), target);
        out.flush();
    }
}
