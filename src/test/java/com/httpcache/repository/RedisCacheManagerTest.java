package com.httpcache.repository;

import com.httpcache.config.JacksonConfiguration;
import com.httpcache.model.FreshnessPolicy;
import com.httpcache.model.HttpResponseRecord;
import com.httpcache.model.StoredEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Instant;
import java.util.Set;

import static com.httpcache.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisCacheManagerTest {

    private static final String URL = "http://example.com/a";
    private static final String REDIS_KEY = "httpcache:test:GET:" + URL;

    private RedisTemplate<String, byte[]> redisTemplate;
    private ValueOperations<String, byte[]> valueOperations;
    private EntryCodec codec;
    private RedisCacheManager manager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(RedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        codec = new EntryCodec(JacksonConfiguration.createObjectMapper());
        manager = new RedisCacheManager(redisTemplate, codec, "test");
    }

    @Test
    void testPutWritesCompressedEntryUnderNamespacedKey() {
        HttpResponseRecord response = response(URL, "hello");
        FreshnessPolicy policy = policy(Instant.parse("2024-05-01T12:00:00Z"), 60);

        manager.put(key(URL), response, policy);

        ArgumentCaptor<byte[]> written = ArgumentCaptor.forClass(byte[].class);
        verify(valueOperations).set(eq(REDIS_KEY), written.capture());
        StoredEntry decoded = codec.decode(written.getValue());
        assertEquals(key(URL), decoded.getKey());
        assertEquals(response, decoded.getResponse());
        assertEquals(policy, decoded.getPolicy());
    }

    @Test
    void testGetDecodesStoredEntry() {
        HttpResponseRecord response = response(URL, "hello");
        FreshnessPolicy policy = policy(Instant.parse("2024-05-01T12:00:00Z"), 60);
        byte[] encoded = codec.encode(StoredEntry.builder().key(key(URL)).response(response).policy(policy).build());
        when(valueOperations.get(REDIS_KEY)).thenReturn(encoded);

        StoredEntry entry = manager.get(key(URL)).orElseThrow();

        assertEquals(response, entry.getResponse());
        assertEquals(policy, entry.getPolicy());
    }

    @Test
    void testGetMissingKeyIsEmpty() {
        when(valueOperations.get(REDIS_KEY)).thenReturn(null);

        assertTrue(manager.get(key(URL)).isEmpty());
    }

    @Test
    void testUndecodableEntryIsTreatedAsAbsent() {
        when(valueOperations.get(REDIS_KEY)).thenReturn(new byte[]{1, 2, 3});

        assertTrue(manager.get(key(URL)).isEmpty());
    }

    @Test
    void testConnectionFailuresBecomeStorageExceptions() {
        when(valueOperations.get(any())).thenThrow(new RedisConnectionFailureException("down"));
        doThrow(new RedisConnectionFailureException("down")).when(valueOperations).set(any(), any());

        assertThrows(CacheStorageException.class, () -> manager.get(key(URL)));
        assertThrows(CacheStorageException.class,
                () -> manager.put(key(URL), response(URL, "x"), policy(Instant.now(), 60)));
    }

    @Test
    void testDelete() {
        manager.delete(key(URL));

        verify(redisTemplate).delete(REDIS_KEY);
    }

    @Test
    void testClearDeletesOnlyNamespaceKeys() {
        Set<String> keys = Set.of(REDIS_KEY, "httpcache:test:GET:http://example.com/b");
        when(redisTemplate.keys("httpcache:test:*")).thenReturn(keys);

        manager.clear();

        verify(redisTemplate).delete(keys);
    }

    @Test
    void testSizeCountsNamespaceKeys() {
        when(redisTemplate.keys("httpcache:test:*")).thenReturn(Set.of(REDIS_KEY));

        assertEquals(1, manager.size());
    }
}
