package io.collector.steam;

import io.collector.core.Item;
import io.collector.core.ItemSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AppListCacheTest {
    private Path tmp;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("app-list-test");
    }

    @AfterEach
    void cleanup() throws IOException {
        try (var s = Files.walk(tmp)) {
            s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (IOException ignore) {} });
        }
    }

    @Test
    void secondLoadComesFromFile() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Item> upstreamItems = List.of(new Item("10", "Counter-Strike"), new Item("20", "Team Fortress, Classic"), new Item("30", ""));
        ItemSource upstream = () -> { calls.incrementAndGet(); return upstreamItems; };
        Path file = tmp.resolve("data/app_list.csv");

        assertEquals(upstreamItems, new AppListCache(file, upstream, false).load());
        assertEquals(upstreamItems, new AppListCache(file, upstream, false).load());
        assertEquals(1, calls.get());
        assertEquals("appid,name", Files.readAllLines(file).get(0));
    }

    @Test
    void refreshRefetchesAndOverwrites() throws Exception {
        Path file = tmp.resolve("app_list.csv");
        new AppListCache(file, () -> List.of(new Item("1", "Old")), false).load();
        List<Item> fresh = new AppListCache(file, () -> List.of(new Item("1", "Old"), new Item("2", "New")), true).load();
        assertEquals(2, fresh.size());
        assertEquals(fresh, new AppListCache(file, () -> { throw new AssertionError("must use cache"); }, false).load());
    }
}
