package com.enterprise.taskengine.revocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Worker-local set of revoked task ids with time based expiry.
 * <p>
 * Ids are compared with {@code equals}, so {@code 123} and {@code "123"} are
 * different entries. Nothing expires on its own: callers invoke
 * {@link #purge()} when they want old entries dropped, typically right
 * before an admission check. All operations may run concurrently with
 * {@link #contains(Object)}.
 */
public class RevocationRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(RevocationRegistry.class);
    
    public static final Duration DEFAULT_EXPIRES = Duration.ofHours(3);
    public static final int DEFAULT_MAX_SIZE = 50000;
    
    private final MonotonicClock clock;
    private final int maxSize;
    private volatile Duration expires;
    private volatile ConcurrentHashMap<Object, Long> entries = new ConcurrentHashMap<>();
    
    public RevocationRegistry() {
        this(DEFAULT_EXPIRES, DEFAULT_MAX_SIZE, MonotonicClock.SYSTEM);
    }
    
    /**
     * @param expires age after which {@link #purge()} drops an entry; zero disables expiry
     * @param maxSize entries kept after a purge; zero or less means unbounded
     * @param clock monotonic time source
     */
    public RevocationRegistry(Duration expires, int maxSize, MonotonicClock clock) {
        this.expires = Objects.requireNonNull(expires, "Expires cannot be null");
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }
    
    /**
     * Revoke an id now. Re-adding an id refreshes its timestamp.
     */
    public void add(Object taskId) {
        add(taskId, clock.nanoTime());
    }
    
    /**
     * Revoke an id as of the given monotonic reading
     */
    public void add(Object taskId, long now) {
        Objects.requireNonNull(taskId, "Task id cannot be null");
        entries.put(taskId, now);
    }
    
    /**
     * Revoke an id that was already {@code age} old, e.g. when restoring saved state
     */
    public void addWithAge(Object taskId, Duration age) {
        add(taskId, clock.nanoTime() - age.toNanos());
    }
    
    /**
     * Revoke every id in the iterable; an empty iterable is a no-op
     */
    public void update(Iterable<?> taskIds) {
        long now = clock.nanoTime();
        for (Object taskId : taskIds) {
            add(taskId, now);
        }
    }
    
    public void discard(Object taskId) {
        if (taskId != null) {
            entries.remove(taskId);
        }
    }
    
    /**
     * Remove an id, reporting whether it was present
     */
    public boolean popValue(Object taskId) {
        return taskId != null && entries.remove(taskId) != null;
    }
    
    public void clear() {
        entries = new ConcurrentHashMap<>();
    }
    
    public boolean contains(Object taskId) {
        return taskId != null && entries.containsKey(taskId);
    }
    
    public int size() {
        return entries.size();
    }
    
    public boolean isEmpty() {
        return entries.isEmpty();
    }
    
    public Duration getExpires() {
        return expires;
    }
    
    public void setExpires(Duration expires) {
        this.expires = Objects.requireNonNull(expires, "Expires cannot be null");
    }
    
    public int getMaxSize() {
        return maxSize;
    }
    
    /**
     * Drop expired entries as of now
     *
     * @return number of entries removed
     */
    public int purge() {
        return purge(clock.nanoTime());
    }
    
    /**
     * Drop entries older than {@link #getExpires()} as of the given reading,
     * then the oldest entries beyond {@link #getMaxSize()}.
     *
     * @return number of entries removed
     */
    public int purge(long now) {
        ConcurrentHashMap<Object, Long> current = entries;
        int before = current.size();
        
        long expiresNanos = expires.toNanos();
        if (expiresNanos > 0) {
            current.entrySet().removeIf(entry -> now - entry.getValue() > expiresNanos);
        }
        
        if (maxSize > 0 && current.size() > maxSize) {
            evictOldest(current, current.size() - maxSize);
        }
        
        int removed = Math.max(0, before - current.size());
        if (removed > 0) {
            logger.debug("Purged {} revoked task ids, {} remaining", removed, current.size());
        }
        return removed;
    }
    
    /**
     * Age of every entry as of now
     */
    public Map<Object, Duration> snapshot() {
        long now = clock.nanoTime();
        Map<Object, Duration> ages = new HashMap<>();
        entries.forEach((taskId, insertedAt) -> ages.put(taskId, Duration.ofNanos(Math.max(0, now - insertedAt))));
        return ages;
    }
    
    private void evictOldest(ConcurrentHashMap<Object, Long> current, int count) {
        List<Map.Entry<Object, Long>> oldestFirst = new ArrayList<>(current.entrySet());
        oldestFirst.sort(Comparator.comparingLong(Map.Entry::getValue));
        for (int i = 0; i < count && i < oldestFirst.size(); i++) {
            Map.Entry<Object, Long> entry = oldestFirst.get(i);
            current.remove(entry.getKey(), entry.getValue());
        }
    }
}
