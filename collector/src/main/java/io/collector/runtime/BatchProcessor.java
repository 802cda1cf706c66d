package io.collector.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.collector.checkpoint.CheckpointStore;
import io.collector.config.CollectorConfig;
import io.collector.core.BatchSink;
import io.collector.core.Item;
import io.collector.core.Record;
import io.collector.core.RecordParser;
import io.collector.core.Sleeper;
import io.collector.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Walks the item list in fixed-size chunks, one item at a time: parse, pause, and once a chunk is complete
 * append it to the sink and only then move the checkpoint to the chunk's end.
 * <p>
 * A failure while parsing propagates unchanged. The partial chunk is dropped and the checkpoint stays at the
 * end of the last written chunk, so a restart re-fetches at most one chunk. A crash between the sink append
 * and the checkpoint save makes the restart append that chunk a second time; output is at-least-once.
 */
public class BatchProcessor {
    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final Sleeper sleeper;
    private final Timer batchTimer;
    private final Meter itemsFetched;
    private final Counter batchesWritten;

    public BatchProcessor(Metrics metrics, Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper);
        this.batchTimer = metrics.timer("batch.time");
        this.itemsFetched = metrics.meter("items.fetched");
        this.batchesWritten = metrics.counter("batches.written");
    }

    /**
     * Resumes from the stored checkpoint: loads the cursor, prepares the sink for it and runs to {@code end}.
     */
    public RunSummary resume(List<Item> items, RecordParser parser, BatchSink sink, CheckpointStore checkpoint,
                             int end, int batchSize, Duration pause) throws Exception {
        long cursor = checkpoint.load();
        if (cursor > items.size()) {
            throw new IllegalArgumentException("checkpoint " + cursor + " is beyond the item list (" + items.size()
                    + " items); reset it or restore the matching item list");
        }
        sink.initialize(cursor);
        return run(items, parser, sink, checkpoint, (int) cursor, Math.max((int) cursor, end), batchSize, pause);
    }

    /** Resumes through the whole item list with the configured batch size and pause. */
    public RunSummary resume(List<Item> items, RecordParser parser, BatchSink sink, CheckpointStore checkpoint,
                             CollectorConfig config) throws Exception {
        return resume(items, parser, sink, checkpoint, items.size(), config.batchSize(), config.pause());
    }

    public RunSummary run(List<Item> items, RecordParser parser, BatchSink sink, CheckpointStore checkpoint,
                          int start, int end, int batchSize, Duration pause) throws Exception {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(checkpoint, "checkpoint");
        if (end > items.size()) {
            throw new IllegalArgumentException("end " + end + " exceeds item count " + items.size());
        }
        Duration itemPause = pause == null ? Duration.ZERO : pause;
        List<ChunkRange> chunks = BatchPlan.chunks(start, end, batchSize);
        BatchProgress progress = new BatchProgress(chunks.size());
        log.info("Starting at index {} of {} ({} item(s) in {} batch(es))", start, end, end - start, chunks.size());

        long runStart = System.nanoTime();
        int written = 0;
        long cursor = start;
        for (int i = 0; i < chunks.size(); i++) {
            ChunkRange chunk = chunks.get(i);
            long t0 = System.nanoTime();

            List<Record> batch = fetchChunk(items, chunk, parser, itemPause);
            sink.append(batch);
            log.info("Exported items {}-{}", chunk.start(), chunk.stop() - 1);
            written += batch.size();
            batchesWritten.inc();

            saveCursor(checkpoint, cursor, chunk.stop());
            cursor = chunk.stop();

            long elapsed = System.nanoTime() - t0;
            batchTimer.update(elapsed, TimeUnit.NANOSECONDS);
            progress.record(Duration.ofNanos(elapsed));
            log.info("Batch {} time: {} (avg: {}, remaining: {})", i,
                    BatchProgress.format(Duration.ofNanos(elapsed)),
                    BatchProgress.format(progress.mean()),
                    BatchProgress.format(progress.estimateRemaining()));
        }
        Duration total = Duration.ofNanos(System.nanoTime() - runStart);
        log.info("Processing batches complete. {} item(s) written in {}", written, BatchProgress.format(total));
        return new RunSummary(written, chunks.size(), cursor, total);
    }

    private List<Record> fetchChunk(List<Item> items, ChunkRange chunk, RecordParser parser, Duration pause)
            throws Exception {
        List<Record> batch = new ArrayList<>(chunk.size());
        for (int idx = chunk.start(); idx < chunk.stop(); idx++) {
            Item item = items.get(idx);
            log.debug("Current index: {} ({} {})", idx, item.id(), item.name());
            Record record = parser.parse(item.id(), item.name());
            if (record == null) {
                throw new IllegalStateException("parser returned no record for item " + idx + " (" + item.id() + ")");
            }
            batch.add(record);
            itemsFetched.mark();
            sleeper.sleep(pause);
        }
        return batch;
    }

    private static void saveCursor(CheckpointStore checkpoint, long current, long next) throws IOException {
        if (next < current) {
            throw new IllegalStateException("cursor may not move backwards: " + current + " -> " + next);
        }
        checkpoint.save(next);
    }
}
