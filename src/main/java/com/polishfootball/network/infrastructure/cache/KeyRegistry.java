package com.polishfootball.network.infrastructure.cache;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Live cache keys, tracked only so that pattern eviction can enumerate them.
 * One lock guards the set; it is held for a single insert, remove or copy.
 */
final class KeyRegistry {

    private final Set<String> keys = new HashSet<>();
    private final Object lock = new Object();

    void register(String key) {
        synchronized (lock) {
            keys.add(key);
        }
    }

    void unregister(String key) {
        synchronized (lock) {
            keys.remove(key);
        }
    }

    List<String> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(keys);
        }
    }

    boolean contains(String key) {
        synchronized (lock) {
            return keys.contains(key);
        }
    }

    int size() {
        synchronized (lock) {
            return keys.size();
        }
    }

    void clear() {
        synchronized (lock) {
            keys.clear();
        }
    }
}
