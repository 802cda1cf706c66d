package io.collector.steam;

import io.collector.core.RecordParser;
import io.collector.core.Schema;
import io.collector.fetch.Fetcher;

import java.time.Duration;

/**
 * The APIs a collection can target, each with its own output file, checkpoint file and politeness pause.
 */
public enum DataSource {
    STEAM("steam_app_data.csv", "steam_index.txt", Duration.ofSeconds(1), SteamColumns.STEAM_STORE) {
        @Override
        public RecordParser parser(Fetcher fetcher, SteamEndpoints endpoints) {
            return new SteamStoreParser(fetcher, endpoints.storeAppDetails());
        }
    },
    STEAMSPY("steamspy_data.csv", "steamspy_index.txt", Duration.ofMillis(300), SteamColumns.STEAMSPY) {
        @Override
        public RecordParser parser(Fetcher fetcher, SteamEndpoints endpoints) {
            return new SteamSpyParser(fetcher, endpoints.steamSpy());
        }
    };

    private final String dataFile;
    private final String checkpointFile;
    private final Duration defaultPause;
    private final Schema schema;

    DataSource(String dataFile, String checkpointFile, Duration defaultPause, Schema schema) {
        this.dataFile = dataFile;
        this.checkpointFile = checkpointFile;
        this.defaultPause = defaultPause;
        this.schema = schema;
    }

    public abstract RecordParser parser(Fetcher fetcher, SteamEndpoints endpoints);

    public String dataFile() { return dataFile; }
    public String checkpointFile() { return checkpointFile; }
    public Duration defaultPause() { return defaultPause; }
    public Schema schema() { return schema; }
}
