package io.collector.steam;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.collector.checkpoint.CheckpointStore;
import io.collector.checkpoint.FileCheckpointStore;
import io.collector.config.CollectorConfig;
import io.collector.core.Item;
import io.collector.core.ItemSource;
import io.collector.core.RecordParser;
import io.collector.fetch.Fetcher;
import io.collector.ingestor.CollectorModule;
import io.collector.runtime.BatchProcessor;
import io.collector.runtime.RunSummary;
import io.collector.sink.CsvBatchSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI that downloads per-app data from the Steam Store or SteamSpy into a CSV, resuming from the last
 * completed batch. Only one instance may run against a data directory at a time.
 */
@CommandLine.Command(name = "steam-collect", mixinStandardHelpOptions = true,
        description = "Download Steam app data in resumable batches")
public final class SteamCollectorMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SteamCollectorMain.class);

    @CommandLine.Option(names = {"-s", "--source"}, description = "Data source: ${COMPLETION-CANDIDATES}",
            defaultValue = "STEAM")
    DataSource source;

    @CommandLine.Option(names = {"-d", "--data-dir"}, description = "Directory for data, checkpoint and app list files")
    Path dataDir;

    @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Items written per batch")
    Integer batchSize;

    @CommandLine.Option(names = {"-p", "--pause-millis"}, description = "Pause after every request (default per source)")
    Long pauseMillis;

    @CommandLine.Option(names = {"-e", "--end"}, description = "Exclusive index to stop at (default: whole app list)")
    Integer end;

    @CommandLine.Option(names = "--reset", description = "Start over from the first app, recreating the data file")
    boolean reset;

    @CommandLine.Option(names = "--refresh-app-list", description = "Refetch the app list instead of using the cached copy (needs --reset once a checkpoint exists)")
    boolean refreshAppList;

    @CommandLine.Option(names = "--max-attempts", description = "Give up a request after this many attempts (0 = retry forever)")
    Integer maxAttempts;

    @CommandLine.Option(names = "--backoff", description = "Wait between attempts: ${COMPLETION-CANDIDATES} (default fixed)")
    CollectorConfig.Backoff backoff;

    @CommandLine.Option(names = "--transport-wait-millis", description = "Wait after a connection or TLS failure")
    Long transportWaitMillis;

    @CommandLine.Option(names = "--no-response-wait-millis", description = "Wait after an empty or rate-limited response")
    Long noResponseWaitMillis;

    @CommandLine.Option(names = "--store-endpoint", hidden = true)
    String storeEndpoint = SteamEndpoints.DEFAULT.storeAppDetails();

    @CommandLine.Option(names = "--steamspy-endpoint", hidden = true)
    String steamSpyEndpoint = SteamEndpoints.DEFAULT.steamSpy();

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new SteamCollectorMain()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        CollectorConfig config;
        try {
            config = config();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 2;
        }
        Injector injector = Guice.createInjector(
                new CollectorModule(config),
                new SteamDataModule(new SteamEndpoints(storeEndpoint, steamSpyEndpoint), refreshAppList));
        try {
            return collect(injector, config);
        } catch (IllegalArgumentException e) {
            log.error("Cannot run collection: {}", e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted; resume later from the last saved checkpoint");
            return 1;
        } catch (Exception e) {
            log.error("Collection of {} failed; rerun to resume from the last saved checkpoint", source, e);
            return 1;
        } finally {
            logMetrics(injector.getInstance(MetricRegistry.class));
        }
    }

    private int collect(Injector injector, CollectorConfig config) throws Exception {
        Path dir = config.dataDir();
        CheckpointStore checkpoint = new FileCheckpointStore(dir.resolve(source.checkpointFile()));
        if (reset) {
            checkpoint.reset();
        } else if (refreshAppList) {
            // the checkpoint indexes the cached list; a refetched list may be ordered differently
            long saved = checkpoint.load();
            if (saved > 0) {
                throw new IllegalArgumentException("--refresh-app-list with a saved checkpoint of " + saved
                        + " in " + dir + " needs --reset as well");
            }
        }
        List<Item> apps = injector.getInstance(ItemSource.class).load();

        RecordParser parser = source.parser(injector.getInstance(Fetcher.class), injector.getInstance(SteamEndpoints.class));
        CsvBatchSink sink = new CsvBatchSink(dir.resolve(source.dataFile()), source.schema());
        int stop = end == null ? apps.size() : Math.min(end, apps.size());

        RunSummary summary = injector.getInstance(BatchProcessor.class)
                .resume(apps, parser, sink, checkpoint, stop, config.batchSize(), config.pause());
        log.info("{}: wrote {} app(s) in {} batch(es); checkpoint now {} of {}",
                source, summary.itemsWritten(), summary.batchesWritten(), summary.finalCursor(), apps.size());
        return 0;
    }

    CollectorConfig config() {
        CollectorConfig c = CollectorConfig.fromEnv();
        if (dataDir != null) c = c.withDataDir(dataDir);
        if (batchSize != null) c = c.withBatchSize(batchSize);
        c = c.withPause(pauseMillis != null ? Duration.ofMillis(pauseMillis) : source.defaultPause());
        if (maxAttempts != null) c = c.withMaxAttempts(maxAttempts);
        if (backoff != null) c = c.withBackoff(backoff);
        if (transportWaitMillis != null || noResponseWaitMillis != null) {
            c = c.withWaits(
                    transportWaitMillis != null ? Duration.ofMillis(transportWaitMillis) : c.transportWait(),
                    noResponseWaitMillis != null ? Duration.ofMillis(noResponseWaitMillis) : c.noResponseWait());
        }
        if (end != null && end < 0) throw new IllegalArgumentException("--end must be >= 0");
        return c;
    }

    private static void logMetrics(MetricRegistry r) {
        Timer batches = r.timer("collector.batch.time");
        log.info("metrics: items={} batches={} retries={} transportFailures={} noResponse={} malformed={} batch.mean(ms)={}",
                r.meter("collector.items.fetched").getCount(),
                r.counter("collector.batches.written").getCount(),
                r.counter("collector.fetch.retries").getCount(),
                r.counter("collector.fetch.failures.transport").getCount(),
                r.counter("collector.fetch.failures.no_response").getCount(),
                r.counter("collector.fetch.failures.malformed").getCount(),
                String.format("%.1f", batches.getSnapshot().getMean() / 1_000_000.0));
    }
}
