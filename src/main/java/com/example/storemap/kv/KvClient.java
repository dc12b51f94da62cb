package com.example.storemap.kv;

import java.time.Duration;
import java.util.Optional;

public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    long incr(String key);
}
