package io.collector.steam;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.collector.config.CollectorConfig;
import io.collector.core.ItemSource;
import io.collector.fetch.Fetcher;

public class SteamDataModule extends AbstractModule {
    static final String APP_LIST_FILE = "app_list.csv";

    private final SteamEndpoints endpoints;
    private final boolean refreshAppList;

    public SteamDataModule(SteamEndpoints endpoints, boolean refreshAppList) {
        this.endpoints = endpoints;
        this.refreshAppList = refreshAppList;
    }

    @Override
    protected void configure() {
        bind(SteamEndpoints.class).toInstance(endpoints);
    }

    @Provides @Singleton ItemSource appList(Fetcher fetcher, CollectorConfig config) {
        return new AppListCache(config.dataDir().resolve(APP_LIST_FILE),
                new SteamSpyAppListSource(fetcher, endpoints.steamSpy()), refreshAppList);
    }
}
