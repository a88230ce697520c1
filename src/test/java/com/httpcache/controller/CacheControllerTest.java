package com.httpcache.controller;

import com.httpcache.config.JacksonConfiguration;
import com.httpcache.model.CacheMode;
import com.httpcache.model.HttpCacheOptions;
import com.httpcache.repository.CacheManager;
import com.httpcache.repository.EntryCodec;
import com.httpcache.repository.InMemoryCacheManager;
import com.httpcache.repository.IndexedCacheManager;
import com.httpcache.repository.IndexedStoreOptions;
import com.httpcache.service.CacheAdminService;
import com.httpcache.service.CacheModeParser;
import com.httpcache.service.HttpCacheFilter;
import com.httpcache.service.policy.FreshnessPolicyEngine;
import com.httpcache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;

import static com.httpcache.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CacheControllerTest {

    private static final String URL_A = "http://example.com/a";
    private static final String URL_B = "http://example.com/b";

    private MutableClock clock;
    private IndexedCacheManager store;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        store = new IndexedCacheManager(IndexedStoreOptions.defaults(),
                new EntryCodec(JacksonConfiguration.createObjectMapper()), clock);
        client = clientFor(store);

        store.put(key(URL_A), response(URL_A, "alpha body"), policy(clock.instant(), 100));
        store.put(key(URL_B), response(URL_B, "beta body"), policy(clock.instant(), 10));
        clock.advanceSeconds(20);
    }

    @Test
    void testStats() {
        client.get().uri("/v1/cache/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.backend").isEqualTo("indexed")
                .jsonPath("$.entries").isEqualTo(2)
                .jsonPath("$.mode").isEqualTo("DEFAULT");
    }

    @Test
    void testListAllEntries() {
        client.get().uri("/v1/cache/entries")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].key").isEqualTo(key(URL_A))
                .jsonPath("$[0].ageSeconds").isEqualTo(20)
                .jsonPath("$[0].timeToLiveSeconds").isEqualTo(80)
                .jsonPath("$[0].fresh").isEqualTo(true);
    }

    @Test
    void testEntriesByUrl() {
        client.get().uri(builder -> builder.path("/v1/cache/entries").queryParam("url", URL_B).build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].key").isEqualTo(key(URL_B))
                .jsonPath("$[0].fresh").isEqualTo(false);
    }

    @Test
    void testRangeQuery() {
        client.get().uri("/v1/cache/entries/range?field=time-to-live&low=0&high=1000")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].key").isEqualTo(key(URL_A));
    }

    @Test
    void testRangeQueryRejectsUnknownField() {
        client.get().uri("/v1/cache/entries/range?field=size&low=0&high=10")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void testStaleEntries() {
        client.get().uri("/v1/cache/entries/stale")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].key").isEqualTo(key(URL_B));
    }

    @Test
    void testSearch() {
        client.get().uri("/v1/cache/entries/search?q=alpha")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].url").isEqualTo(URL_A);
    }

    @Test
    void testDeleteEntry() {
        client.delete().uri(builder -> builder.path("/v1/cache/entries").queryParam("key", key(URL_A)).build())
                .exchange()
                .expectStatus().isNoContent();

        assertTrue(store.get(key(URL_A)).isEmpty());
        assertTrue(store.get(key(URL_B)).isPresent());
    }

    @Test
    void testClear() {
        client.post().uri("/v1/cache/clear")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("success");

        assertEquals(0, store.size());
    }

    @Test
    void testQueriesNeedIndexedBackend() {
        WebTestClient memoryClient = clientFor(new InMemoryCacheManager());

        memoryClient.get().uri("/v1/cache/entries/stale")
                .exchange()
                .expectStatus().isEqualTo(501);
        memoryClient.get().uri("/v1/cache/entries")
                .exchange()
                .expectStatus().isEqualTo(501);
        memoryClient.get().uri("/v1/cache/stats")
                .exchange()
                .expectStatus().isOk();
    }

    private WebTestClient clientFor(CacheManager manager) {
        HttpCacheFilter filter = new HttpCacheFilter(manager, CacheMode.DEFAULT, HttpCacheOptions.defaults(),
                new FreshnessPolicyEngine(clock, true), new CacheModeParser(), Duration.ofSeconds(5));
        return WebTestClient.bindToController(new CacheController(new CacheAdminService(filter, clock)))
                .build();
    }
}
