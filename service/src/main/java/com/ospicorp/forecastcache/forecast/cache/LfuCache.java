package com.ospicorp.forecastcache.forecast.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded least-frequently-used cache.
 *
 * <p>Each key sits in exactly one frequency bucket, the one matching its access count. Buckets
 * keep keys in the order they arrived at that frequency, so the victim is the oldest key of the
 * lowest populated bucket.
 *
 * <p>A capacity of zero disables storage: every lookup loads and nothing is kept. A failed load
 * leaves the cache untouched, since eviction only happens once the new value is in hand.
 *
 * <p>Not thread-safe. Callers sharing an instance must serialize access.
 */
public class LfuCache<K, V> {
  private static final Logger log = LoggerFactory.getLogger(LfuCache.class);

  private final int capacity;
  private final Map<K, Entry<V>> entries = new HashMap<>();
  private final NavigableMap<Integer, LinkedHashSet<K>> buckets = new TreeMap<>();

  private long hits;
  private long misses;
  private long evictions;

  public LfuCache(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must not be negative: " + capacity);
    }
    this.capacity = capacity;
  }

  /**
   * Returns the cached value for {@code key}, or loads, stores and returns it on a miss. Any
   * exception thrown by {@code loader} propagates unchanged.
   */
  public V getOrFetch(K key, Supplier<? extends V> loader) {
    Objects.requireNonNull(key, "key");
    Entry<V> entry = entries.get(key);
    if (entry != null) {
      hits++;
      promote(key, entry);
      return entry.value;
    }

    misses++;
    V value = Objects.requireNonNull(loader.get(), "loader returned null");
    if (capacity == 0) {
      return value;
    }
    if (entries.size() >= capacity) {
      evictOne();
    }
    entries.put(key, new Entry<>(value));
    buckets.computeIfAbsent(1, f -> new LinkedHashSet<>()).add(key);
    log.debug("Cached {} ({} of {} entries)", key, entries.size(), capacity);
    return value;
  }

  public void clear() {
    entries.clear();
    buckets.clear();
  }

  public boolean contains(K key) {
    return entries.containsKey(key);
  }

  public OptionalInt frequencyOf(K key) {
    Entry<V> entry = entries.get(key);
    return entry == null ? OptionalInt.empty() : OptionalInt.of(entry.frequency);
  }

  public int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  public CacheStats stats() {
    return new CacheStats(capacity, entries.size(), hits, misses, evictions);
  }

  // Copy of the bucket index, lowest frequency first
  Map<Integer, List<K>> bucketSnapshot() {
    Map<Integer, List<K>> copy = new LinkedHashMap<>();
    for (var e : buckets.entrySet()) {
      copy.put(e.getKey(), new ArrayList<>(e.getValue()));
    }
    return copy;
  }

  private void promote(K key, Entry<V> entry) {
    detach(key, entry.frequency);
    entry.frequency++;
    buckets.computeIfAbsent(entry.frequency, f -> new LinkedHashSet<>()).add(key);
  }

  private void evictOne() {
    if (buckets.isEmpty()) {
      return;
    }
    Map.Entry<Integer, LinkedHashSet<K>> lowest = buckets.firstEntry();
    Iterator<K> it = lowest.getValue().iterator();
    K victim = it.next();
    it.remove();
    if (lowest.getValue().isEmpty()) {
      buckets.remove(lowest.getKey());
    }
    entries.remove(victim);
    evictions++;
    log.debug("Evicted {} at frequency {}", victim, lowest.getKey());
  }

  private void detach(K key, int frequency) {
    LinkedHashSet<K> bucket = buckets.get(frequency);
    bucket.remove(key);
    if (bucket.isEmpty()) {
      buckets.remove(frequency);
    }
  }

  private static final class Entry<V> {
    private final V value;
    private int frequency = 1;

    private Entry(V value) {
      this.value = value;
    }
  }
}
