package io.collector.sink;

import io.collector.core.BatchSink;
import io.collector.core.Record;
import io.collector.core.Schema;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends records as CSV rows projected onto a fixed schema. Schema columns missing from a record stay blank,
 * record fields outside the schema are dropped. The file is opened per batch and forced to disk before it closes.
 */
public class CsvBatchSink implements BatchSink {
    private static final Logger log = LoggerFactory.getLogger(CsvBatchSink.class);

    private final Path file;
    private final Schema schema;
    private final CSVFormat format;

    public CsvBatchSink(Path file, Schema schema) {
        this(file, schema, CSVFormat.DEFAULT);
    }

    public CsvBatchSink(Path file, Schema schema, CSVFormat format) {
        this.file = file;
        this.schema = schema;
        this.format = format;
    }

    public Path file() { return file; }
    public Schema schema() { return schema; }

    @Override
    public void initialize(long cursor) throws IOException {
        if (cursor != 0) {
            log.debug("Resuming at {}, keeping existing header in {}", cursor, file);
            return;
        }
        createParent();
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
             CSVPrinter printer = new CSVPrinter(w, format)) {
            printer.printRecord(schema.columns());
        }
        log.info("Created {} with {} columns", file, schema.size());
    }

    @Override
    public void append(List<Record> batch) throws IOException {
        if (batch.isEmpty()) return;
        createParent();
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
             CSVPrinter printer = new CSVPrinter(new BufferedWriter(Channels.newWriter(channel, StandardCharsets.UTF_8)), format)) {
            for (Record r : batch) {
                printer.printRecord(row(r));
            }
            printer.flush();
            channel.force(false);
        }
    }

    List<String> row(Record record) {
        List<String> row = new ArrayList<>(schema.size());
        for (String column : schema) {
            row.add(cell(record.get(column).orElse(null)));
        }
        return row;
    }

    static String cell(Object value) {
        return Record.textOf(value);
    }

    private void createParent() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
