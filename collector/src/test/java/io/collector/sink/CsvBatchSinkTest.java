package io.collector.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.collector.core.Record;
import io.collector.core.Schema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvBatchSinkTest {
    private Path tmp;
    private final Schema schema = Schema.of("appid", "name", "price", "tags");

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("csv-sink-test");
    }

    @AfterEach
    void cleanup() throws IOException {
        try (var s = Files.walk(tmp)) {
            s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (IOException ignore) {} });
        }
    }

    @Test
    void initializeAtZeroWritesSingleHeader() throws Exception {
        Path out = tmp.resolve("data.csv");
        CsvBatchSink sink = new CsvBatchSink(out, schema);
        sink.initialize(0);
        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(List.of("appid,name,price,tags"), lines);
    }

    @Test
    void initializeAfterStartIsNoOp() throws Exception {
        Path out = tmp.resolve("data.csv");
        CsvBatchSink sink = new CsvBatchSink(out, schema);
        sink.initialize(0);
        sink.append(List.of(Record.empty().put("appid", 10).put("name", "A")));
        sink.initialize(1);
        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("appid,name,price,tags", lines.get(0));
        assertEquals("10,A,,", lines.get(1));
    }

    @Test
    void initializeAfterStartDoesNotCreateFile() throws Exception {
        Path out = tmp.resolve("data.csv");
        new CsvBatchSink(out, schema).initialize(5);
        assertFalse(Files.exists(out));
    }

    @Test
    void projectsRecordsOntoSchema() throws Exception {
        Path out = tmp.resolve("sub/data.csv");
        CsvBatchSink sink = new CsvBatchSink(out, schema);
        sink.initialize(0);
        Record full = Record.empty()
                .put("tags", new ObjectMapper().readTree("{\"Action\":12,\"Indie\":3}"))
                .put("appid", 20)
                .put("ignored", "dropped")
                .put("name", "Two, with comma")
                .put("price", "999");
        Record placeholder = Record.empty().put("name", "Gone").put("appid", 30);
        sink.append(List.of(full, placeholder));

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("20,\"Two, with comma\",999,\"{\"\"Action\"\":12,\"\"Indie\"\":3}\"", lines.get(1));
        assertEquals("30,Gone,,", lines.get(2));
        assertFalse(lines.get(1).contains("dropped"));
    }

    @Test
    void appendsAcrossInstances() throws Exception {
        Path out = tmp.resolve("data.csv");
        new CsvBatchSink(out, schema).initialize(0);
        new CsvBatchSink(out, schema).append(List.of(Record.empty().put("appid", 1)));
        new CsvBatchSink(out, schema).append(List.of(Record.empty().put("appid", 2), Record.empty().put("appid", 3)));
        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(List.of("appid,name,price,tags", "1,,,", "2,,,", "3,,,"), lines);
    }

    @Test
    void appendCreatesMissingFileAsUtf8() throws Exception {
        Path out = tmp.resolve("nested/data.csv");
        new CsvBatchSink(out, schema).append(List.of(Record.empty().put("appid", 9).put("name", "Señor Café")));
        assertEquals(List.of("9,Señor Café,,"), Files.readAllLines(out, StandardCharsets.UTF_8));
    }

    @Test
    void jsonScalarsAndNullsRenderAsText() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("", CsvBatchSink.cell(null));
        assertEquals("", CsvBatchSink.cell(mapper.readTree("null")));
        assertEquals("Valve", CsvBatchSink.cell(mapper.readTree("\"Valve\"")));
        assertEquals("true", CsvBatchSink.cell(mapper.readTree("true")));
        assertEquals("[1,2]", CsvBatchSink.cell(mapper.readTree("[1, 2]")));
    }
}
