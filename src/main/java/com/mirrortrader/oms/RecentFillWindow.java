package com.mirrortrader.oms;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bounded set of recently applied fill keys. Once full, the oldest key is evicted, so a
 * replay older than the window is no longer recognized.
 */
class RecentFillWindow {

    private final Set<String> keys;

    RecentFillWindow(int capacity) {
        this.keys = Collections.newSetFromMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        });
    }

    synchronized boolean contains(String key) {
        return keys.contains(key);
    }

    /** Returns false if the key was already present. */
    synchronized boolean add(String key) {
        return keys.add(key);
    }

    synchronized int size() {
        return keys.size();
    }
}
