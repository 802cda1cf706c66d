package io.collector.steam;

import io.collector.fetch.Fetcher;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceTest {
    private final Fetcher unused = (endpoint, query) -> { throw new AssertionError("no fetch expected"); };

    @Test
    void sourcesKeepSeparateFilesAndPauses() {
        assertEquals("steam_app_data.csv", DataSource.STEAM.dataFile());
        assertEquals("steam_index.txt", DataSource.STEAM.checkpointFile());
        assertEquals(Duration.ofSeconds(1), DataSource.STEAM.defaultPause());
        assertEquals("steamspy_data.csv", DataSource.STEAMSPY.dataFile());
        assertEquals("steamspy_index.txt", DataSource.STEAMSPY.checkpointFile());
        assertEquals(Duration.ofMillis(300), DataSource.STEAMSPY.defaultPause());
    }

    @Test
    void schemasMatchTheirApis() {
        assertEquals(39, DataSource.STEAM.schema().size());
        assertEquals("type", DataSource.STEAM.schema().columns().get(0));
        assertEquals(20, DataSource.STEAMSPY.schema().size());
        assertEquals("appid", DataSource.STEAMSPY.schema().columns().get(0));
    }

    @Test
    void parserMatchesSource() {
        assertInstanceOf(SteamStoreParser.class, DataSource.STEAM.parser(unused, SteamEndpoints.DEFAULT));
        assertInstanceOf(SteamSpyParser.class, DataSource.STEAMSPY.parser(unused, SteamEndpoints.DEFAULT));
    }
}
