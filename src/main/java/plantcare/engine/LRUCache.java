package plantcare.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * LRU (Least Recently Used) cache with eviction callback.
 *
 * This implementation provides:
 * - O(1) get/put/remove operations
 * - Access-order based eviction (least recently accessed entries evicted first)
 * - Thread-safe operations via synchronized methods
 * - Point-in-time snapshots for sweeps that must not hold the cache lock
 *
 * The eviction callback runs while the cache lock is held; it may only take locks
 * whose holders never call back into the cache.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
final class LRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;

    /**
     * Creates an LRU cache with specified max size and eviction callback.
     *
     * @param maxSize Maximum number of entries (must be > 0)
     * @param evictionCallback Callback invoked when an entry is evicted (can be null)
     * @throws IllegalArgumentException if maxSize <= 0
     */
    LRUCache(int maxSize, BiConsumer<K, V> evictionCallback) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }

        this.maxSize = maxSize;

        // accessOrder=true for LRU behavior; cap the initial table for large limits
        this.map = new LinkedHashMap<>(Math.min(maxSize, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean shouldRemove = size() > LRUCache.this.maxSize;
                if (shouldRemove && evictionCallback != null) {
                    evictionCallback.accept(eldest.getKey(), eldest.getValue());
                }
                return shouldRemove;
            }
        };
    }

    LRUCache(int maxSize) {
        this(maxSize, null);
    }

    /**
     * Retrieves a value from the cache.
     * This marks the entry as recently used.
     *
     * @param key The key to look up
     * @return The value, or null if not present
     */
    synchronized V get(K key) {
        return map.get(key);
    }

    /**
     * Inserts a value only if the key is not already present.
     * May trigger eviction if size exceeds maxSize.
     *
     * @param key The key
     * @param value The value
     * @return The existing value if present, or null if the new value was inserted
     */
    synchronized V putIfAbsent(K key, V value) {
        V existing = map.get(key);
        if (existing != null) {
            return existing;
        }
        map.put(key, value);
        return null;
    }

    /**
     * Removes the entry for a key only if it is currently mapped to the given value.
     * Does NOT invoke the eviction callback.
     *
     * @return true if the entry was removed
     */
    synchronized boolean remove(K key, V value) {
        return map.remove(key, value);
    }

    /**
     * Copies the current entries in LRU order (eldest first).
     * Does not change access order.
     */
    synchronized List<Map.Entry<K, V>> snapshot() {
        List<Map.Entry<K, V>> copy = new ArrayList<>(map.size());
        for (Map.Entry<K, V> e : map.entrySet()) {
            copy.add(Map.entry(e.getKey(), e.getValue()));
        }
        return copy;
    }

    synchronized int size() {
        return map.size();
    }

    /**
     * Clears all entries from the cache.
     * Note: Does NOT invoke eviction callbacks.
     */
    synchronized void clear() {
        map.clear();
    }

    int maxSize() {
        return maxSize;
    }
}
