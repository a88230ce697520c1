package com.httpcache.repository;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Construction options for {@link IndexedCacheManager}.
 */
@Value
@Builder
public class IndexedStoreOptions {

    /**
     * Directory the store's namespaces live under.
     */
    @Builder.Default
    Path root = Paths.get("http-cache");

    /**
     * Collection name; entries are kept in {@code root/namespace}.
     */
    @Builder.Default
    String namespace = "http-cache";

    @Builder.Default
    StorageType storageType = StorageType.RAM_COPIES;

    /**
     * Force each write to disk before it becomes visible.
     */
    @Builder.Default
    boolean durable = true;

    public enum StorageType {
        /**
         * Memory only; nothing survives a restart.
         */
        RAM_COPIES,

        /**
         * Memory plus one file per entry, reloaded on open.
         */
        DISK_COPIES
    }

    public static IndexedStoreOptions defaults() {
        return IndexedStoreOptions.builder().build();
    }

    public Path directory() {
        return root.resolve(namespace);
    }
}
