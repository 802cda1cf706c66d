package io.collector.steam;

import io.collector.core.Item;
import io.collector.core.ItemSource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Pins the item list to a CSV file next to the checkpoints. Checkpoints are indexes into this list, so a
 * resumed run must see the same order even if the upstream catalogue changed in the meantime.
 */
public class AppListCache implements ItemSource {
    private static final Logger log = LoggerFactory.getLogger(AppListCache.class);
    private static final String[] HEADER = {"appid", "name"};

    private final Path file;
    private final ItemSource upstream;
    private final boolean refresh;

    public AppListCache(Path file, ItemSource upstream, boolean refresh) {
        this.file = file;
        this.upstream = upstream;
        this.refresh = refresh;
    }

    @Override
    public List<Item> load() throws Exception {
        if (!refresh && Files.exists(file)) {
            List<Item> cached = read();
            log.info("Using cached app list {} ({} apps)", file, cached.size());
            return cached;
        }
        List<Item> items = upstream.load();
        write(items);
        log.info("Saved app list of {} apps to {}", items.size(), file);
        return items;
    }

    List<Item> read() throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        List<Item> items = new ArrayList<>();
        try (BufferedReader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSVParser.parse(r, format)) {
            for (CSVRecord rec : parser) {
                items.add(new Item(rec.get("appid"), rec.get("name")));
            }
        }
        return items;
    }

    void write(List<Item> items) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, CSVFormat.DEFAULT)) {
            printer.printRecord((Object[]) HEADER);
            for (Item item : items) {
                printer.printRecord(item.id(), item.name());
            }
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
}
