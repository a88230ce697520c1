package com.httpcache.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.httpcache.model.StoredEntry;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP-compressed JSON encoding of stored entries, shared by the persisted backends.
 */
public class EntryCodec {

    private final ObjectMapper objectMapper;

    public EntryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Compress stored entry using GZIP.
     */
    public byte[] encode(StoredEntry entry) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                objectMapper.writeValue(gzipOut, entry);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new CacheSerializationException("Failed to encode entry " + entry.getKey(), e);
        }
    }

    /**
     * Decompress and deserialize a stored entry.
     */
    public StoredEntry decode(byte[] compressed) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(compressed);
             GZIPInputStream gzipIn = new GZIPInputStream(bais)) {
            StoredEntry entry = objectMapper.readValue(gzipIn, StoredEntry.class);
            if (entry == null || entry.getKey() == null || entry.getResponse() == null || entry.getPolicy() == null) {
                throw new CacheSerializationException("Incomplete stored entry", null);
            }
            return entry;
        } catch (IOException e) {
            throw new CacheSerializationException("Failed to decode stored entry", e);
        }
    }
}
