package com.httpcache.config;

import com.httpcache.model.CacheMode;
import com.httpcache.repository.IndexedStoreOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration properties for the HTTP cache.
 */
@Data
@Component
@ConfigurationProperties(prefix = "httpcache")
public class HttpCacheProperties {

    /**
     * Mode applied when neither the mode function nor the request header picks one.
     */
    private CacheMode mode = CacheMode.DEFAULT;

    /**
     * Shared (public) cache semantics; false for a private, per-user cache.
     */
    private boolean shared = true;

    /**
     * Honour the x-http-cache-mode request header.
     */
    private boolean controlHeaderEnabled = true;

    private StorageConfig storage = new StorageConfig();
    private ClientConfig client = new ClientConfig();

    public enum StorageType {
        MEMORY,
        INDEXED,
        REDIS
    }

    @Data
    public static class StorageConfig {
        private StorageType type = StorageType.MEMORY;
        private Duration timeout = Duration.ofSeconds(5);
        private DataSize maxBodySize = DataSize.ofMegabytes(10);
        private MemoryConfig memory = new MemoryConfig();
        private IndexedConfig indexed = new IndexedConfig();
        private RedisConfig redis = new RedisConfig();
    }

    @Data
    public static class MemoryConfig {
        private long maxSize = 10000;
        private Duration expireAfterWrite;
    }

    @Data
    public static class IndexedConfig {
        private Path root = Paths.get("http-cache");
        private String namespace = "http-cache";
        private IndexedStoreOptions.StorageType storageType = IndexedStoreOptions.StorageType.RAM_COPIES;
        private boolean durable = true;

        public IndexedStoreOptions toOptions() {
            return IndexedStoreOptions.builder()
                    .root(root)
                    .namespace(namespace)
                    .storageType(storageType)
                    .durable(durable)
                    .build();
        }
    }

    @Data
    public static class RedisConfig {
        private String namespace = "default";
    }

    @Data
    public static class ClientConfig {
        private Duration responseTimeout = Duration.ofSeconds(60);
    }
}
