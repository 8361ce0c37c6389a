package com.datcoord.store;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import com.datcoord.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class ContentStores {
    static final String URL_ENV = "DATCOORD_CONTENT_STORE_URL";

    private ContentStores() {
    }

    public static ContentStore fromConfig(AppConfig.ContentStoreConfig config) {
        return fromConfig(config, System.getenv());
    }

    static ContentStore fromConfig(AppConfig.ContentStoreConfig config, Map<String, String> environment) {
        String overrideUrl = environment.get(URL_ENV);
        String type = overrideUrl == null || overrideUrl.isBlank()
                ? config.getType().toLowerCase(Locale.ROOT)
                : "http";

        ContentStore store;
        switch (type) {
            case "memory" -> store = new InMemoryContentStore();
            case "local" -> store = new LocalContentStore(Path.of(config.getLocalPath()));
            case "http" -> {
                String publisher = overrideUrl == null || overrideUrl.isBlank() ? config.getPublisherUrl() : overrideUrl;
                OkHttpClient client = HttpContentStore.boundedClient(Duration.ofMillis(config.getTimeoutMs()));
                store = new HttpContentStore(client, publisher, config.getAggregatorUrl(), config.getStorageEpochs());
            }
            default -> throw new IllegalArgumentException("Unknown content store type: " + config.getType());
        }
        return new RetryingContentStore(store, config.getMaxRetries(), config.getRetryBackoffMs());
    }
}
