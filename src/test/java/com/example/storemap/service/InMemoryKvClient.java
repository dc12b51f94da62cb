package com.example.storemap.service;

import com.example.storemap.kv.KvClient;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryKvClient implements KvClient {

    final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        values.put(key, value);
    }

    @Override
    public long incr(String key) {
        return Long.parseLong(values.merge(key, "1", (old, one) -> String.valueOf(Long.parseLong(old) + 1)));
    }
}
