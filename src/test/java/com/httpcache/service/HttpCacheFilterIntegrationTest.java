package com.httpcache.service;

import com.httpcache.model.CacheHeaders;
import com.httpcache.model.CacheMode;
import com.httpcache.model.HttpCacheOptions;
import com.httpcache.repository.InMemoryCacheManager;
import com.httpcache.service.key.CacheKeyDeriver;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives a WebClient carrying the filter against a live origin.
 */
class HttpCacheFilterIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    // Past the 256 KB default in-memory codec limit
    private static final int LARGE_BODY = 300 * 1024;

    private MockWebServer server;
    private InMemoryCacheManager manager;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        manager = new InMemoryCacheManager();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void testDefaultModeCachesPublicResponse() {
        WebClient client = client(CacheMode.DEFAULT, HttpCacheOptions.defaults());
        String url = server.url("/").toString();
        server.enqueue(new MockResponse()
                .setBody("test")
                .addHeader("Cache-Control", "max-age=86400, public"));

        assertEquals("test", fetch(client, url).getBody());
        assertTrue(manager.get("GET:" + url).isPresent());

        ResponseEntity<String> second = fetch(client, url);
        assertEquals("test", second.getBody());
        assertEquals(CacheHeaders.HIT, second.getHeaders().getFirst(CacheHeaders.CACHE));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void testNoCacheModeHitsOriginEveryTime() {
        WebClient client = client(CacheMode.NO_CACHE, HttpCacheOptions.defaults());
        String url = server.url("/").toString();
        server.enqueue(new MockResponse().setBody("test").addHeader("Cache-Control", "max-age=86400, public"));
        server.enqueue(new MockResponse().setBody("test").addHeader("Cache-Control", "max-age=86400, public"));

        fetch(client, url);
        fetch(client, url);

        assertEquals(2, server.getRequestCount());
        assertTrue(manager.get("GET:" + url).isPresent());
    }

    @Test
    void testCustomKeyFunction() {
        HttpCacheOptions options = HttpCacheOptions.builder()
                .cacheKey(parts -> CacheKeyDeriver.DEFAULT.apply(parts) + ":" + parts.getVersion() + ":test")
                .build();
        WebClient client = client(CacheMode.DEFAULT, options);
        String url = server.url("/").toString();
        server.enqueue(new MockResponse().setBody("test").addHeader("Cache-Control", "max-age=86400, public"));

        assertEquals("test", fetch(client, url).getBody());

        assertTrue(manager.get("GET:" + url + ":HTTP/1.1:test").isPresent());
        assertTrue(manager.get("GET:" + url).isEmpty());
    }

    @Test
    void testRevalidationSendsValidators() throws InterruptedException {
        WebClient client = client(CacheMode.DEFAULT, HttpCacheOptions.defaults());
        String url = server.url("/doc").toString();
        server.enqueue(new MockResponse()
                .setBody("document")
                .addHeader("Cache-Control", "max-age=0")
                .addHeader("ETag", "\"abc\""));
        server.enqueue(new MockResponse()
                .setResponseCode(304)
                .addHeader("ETag", "\"abc\""));

        fetch(client, url);
        ResponseEntity<String> revalidated = fetch(client, url);

        assertEquals(200, revalidated.getStatusCode().value());
        assertEquals("document", revalidated.getBody());
        server.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest conditional = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(conditional);
        assertEquals("\"abc\"", conditional.getHeader(HttpHeaders.IF_NONE_MATCH));
    }

    @Test
    void testPrivateResponseOnlyCachedByPrivateCache() {
        String url = server.url("/me").toString();
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setBody("mine").addHeader("Cache-Control", "private, max-age=600"));
        }

        WebClient shared = client(CacheMode.DEFAULT, HttpCacheOptions.defaults());
        fetch(shared, url);
        fetch(shared, url);
        assertEquals(2, server.getRequestCount());

        WebClient personal = client(CacheMode.DEFAULT, HttpCacheOptions.builder().shared(false).build());
        fetch(personal, url);
        fetch(personal, url);
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void testModeHeaderIsNotSentToOrigin() throws InterruptedException {
        WebClient client = client(CacheMode.DEFAULT, HttpCacheOptions.defaults());
        String url = server.url("/").toString();
        server.enqueue(new MockResponse().setBody("test"));

        client.get().uri(url)
                .header(CacheHeaders.CACHE_MODE, "no-store")
                .retrieve()
                .toEntity(String.class)
                .block(TIMEOUT);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertNull(request.getHeader(CacheHeaders.CACHE_MODE));
        assertEquals(0, manager.size());
    }

    @Test
    void testBodyBeyondCodecLimitIsCached() {
        WebClient client = client(CacheMode.DEFAULT, HttpCacheOptions.defaults());
        String url = server.url("/large").toString();
        server.enqueue(new MockResponse()
                .setBody("x".repeat(LARGE_BODY))
                .addHeader("Cache-Control", "max-age=60"));

        ResponseEntity<Long> first = fetchSize(client, url);
        assertEquals(LARGE_BODY, first.getBody());
        assertEquals(CacheHeaders.MISS, first.getHeaders().getFirst(CacheHeaders.CACHE));

        ResponseEntity<Long> second = fetchSize(client, url);
        assertEquals(LARGE_BODY, second.getBody());
        assertEquals(CacheHeaders.HIT, second.getHeaders().getFirst(CacheHeaders.CACHE));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void testDeclaredBodyOverLimitPassesThroughUncached() {
        WebClient client = client(CacheMode.DEFAULT, HttpCacheOptions.builder().maxBodySize(100 * 1024).build());
        String url = server.url("/large").toString();
        server.enqueue(new MockResponse()
                .setBody("x".repeat(LARGE_BODY))
                .addHeader("Cache-Control", "max-age=60"));

        ResponseEntity<Long> response = fetchSize(client, url);

        assertEquals(LARGE_BODY, response.getBody());
        assertEquals(CacheHeaders.MISS, response.getHeaders().getFirst(CacheHeaders.CACHE));
        assertEquals(0, manager.size());
    }

    @Test
    void testChunkedBodyOverLimitIsDeliveredButNotStored() {
        WebClient client = client(CacheMode.DEFAULT, HttpCacheOptions.builder().maxBodySize(100 * 1024).build());
        String url = server.url("/chunked").toString();
        server.enqueue(new MockResponse()
                .setChunkedBody("x".repeat(LARGE_BODY), 16 * 1024)
                .addHeader("Cache-Control", "max-age=60"));

        ResponseEntity<Long> response = fetchSize(client, url);

        assertEquals(LARGE_BODY, response.getBody());
        assertEquals(0, manager.size());
    }

    @Test
    void testHugeFreshnessHeadersDoNotBreakRepeatRequests() {
        WebClient client = client(CacheMode.DEFAULT, HttpCacheOptions.defaults());
        String forever = server.url("/forever").toString();
        String ancient = server.url("/ancient").toString();
        server.enqueue(new MockResponse()
                .setBody("forever")
                .addHeader("Cache-Control", "max-age=99999999999999999, s-maxage=9223372036854775807"));
        server.enqueue(new MockResponse()
                .setBody("ancient")
                .addHeader("Cache-Control", "max-age=60")
                .addHeader("Age", "10000000000000000"));
        server.enqueue(new MockResponse()
                .setBody("refreshed")
                .addHeader("Cache-Control", "max-age=60"));

        assertEquals("forever", fetch(client, forever).getBody());
        assertEquals("ancient", fetch(client, ancient).getBody());

        ResponseEntity<String> cached = fetch(client, forever);
        assertEquals("forever", cached.getBody());
        assertEquals(CacheHeaders.HIT, cached.getHeaders().getFirst(CacheHeaders.CACHE));

        assertEquals("refreshed", fetch(client, ancient).getBody());
        assertEquals(3, server.getRequestCount());
    }

    private WebClient client(CacheMode mode, HttpCacheOptions options) {
        return WebClient.builder()
                .filter(new HttpCacheFilter(manager, mode, options))
                .build();
    }

    private static ResponseEntity<String> fetch(WebClient client, String url) {
        return client.get().uri(url)
                .retrieve()
                .toEntity(String.class)
                .block(TIMEOUT);
    }

    private static ResponseEntity<Long> fetchSize(WebClient client, String url) {
        return client.get().uri(url)
                .exchangeToMono(response -> response.bodyToFlux(DataBuffer.class)
                        .map(buffer -> {
                            long size = buffer.readableByteCount();
                            DataBufferUtils.release(buffer);
                            return size;
                        })
                        .reduce(0L, Long::sum)
                        .map(size -> ResponseEntity.status(response.statusCode())
                                .headers(response.headers().asHttpHeaders())
                                .body(size)))
                .block(TIMEOUT);
    }
}
