package com.company.correlation.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Minimal key/value cache used for group snapshots
 */
public interface CacheClient {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value, Duration ttl);

    void delete(String key);
}
