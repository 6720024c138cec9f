package com.enterprise.taskengine.revocation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mapdb.Atomic;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * MapDB-backed persistence for the revoked set, so a restarted worker keeps
 * refusing tasks that were cancelled before it went down.
 * <p>
 * Monotonic timestamps mean nothing across restarts, so each id is stored
 * with its age at save time together with the wall-clock time of the save.
 * On restore the age is advanced by the time the worker was down.
 */
public class RevocationStateStore implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(RevocationStateStore.class);
    
    private final DB db;
    private final Map<String, Long> revokedAges;
    private final Atomic.Long savedAt;
    private final ObjectMapper objectMapper;
    private final Clock wallClock;
    
    public RevocationStateStore(String dbPath) {
        this(dbPath, Clock.systemUTC());
    }
    
    public RevocationStateStore(String dbPath, Clock wallClock) {
        this.wallClock = wallClock;
        this.objectMapper = new ObjectMapper();
        
        this.db = DBMaker.fileDB(new File(dbPath))
            .fileMmapEnableIfSupported()
            .transactionEnable()
            .checksumHeaderBypass()
            .closeOnJvmShutdown()
            .make();
        
        this.revokedAges = db.hashMap("revoked", Serializer.STRING, Serializer.LONG).createOrOpen();
        this.savedAt = db.atomicLong("revokedSavedAt").createOrOpen();
        
        logger.info("Revocation state store opened at: {}", dbPath);
    }
    
    /**
     * Replace the stored state with the current content of the registry
     *
     * @return number of ids written
     */
    public synchronized int save(RevocationRegistry registry) {
        try {
            revokedAges.clear();
            int written = 0;
            for (Map.Entry<Object, Duration> entry : registry.snapshot().entrySet()) {
                String key = encodeId(entry.getKey());
                if (key == null) {
                    continue;
                }
                revokedAges.put(key, entry.getValue().toMillis());
                written++;
            }
            savedAt.set(wallClock.millis());
            db.commit();
            
            logger.info("Saved {} revoked task ids", written);
            return written;
        } catch (RuntimeException e) {
            logger.error("Failed to save revoked task ids", e);
            db.rollback();
            throw e;
        }
    }
    
    /**
     * Load stored ids into the registry, skipping those that expired while
     * the worker was down
     *
     * @return number of ids restored
     */
    public synchronized int restore(RevocationRegistry registry) {
        long downtimeMs = Math.max(0, wallClock.millis() - savedAt.get());
        long expiresMs = registry.getExpires().toMillis();
        int restored = 0;
        int expired = 0;
        
        for (Map.Entry<String, Long> entry : revokedAges.entrySet()) {
            long ageMs = entry.getValue() + downtimeMs;
            if (expiresMs > 0 && ageMs > expiresMs) {
                expired++;
                continue;
            }
            Object taskId = decodeId(entry.getKey());
            if (taskId != null) {
                registry.addWithAge(taskId, Duration.ofMillis(ageMs));
                restored++;
            }
        }
        
        logger.info("Restored {} revoked task ids ({} expired while offline)", restored, expired);
        return restored;
    }
    
    public int size() {
        return revokedAges.size();
    }
    
    @Override
    public void close() {
        if (!db.isClosed()) {
            db.close();
            logger.info("Revocation state store closed");
        }
    }
    
    private String encodeId(Object taskId) {
        try {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", taskId.getClass().getName());
            node.set("value", objectMapper.valueToTree(taskId));
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Cannot persist revoked task id of type {}", taskId.getClass().getName());
            return null;
        }
    }
    
    private Object decodeId(String key) {
        try {
            JsonNode node = objectMapper.readTree(key);
            Class<?> type = Class.forName(node.get("type").asText());
            return objectMapper.treeToValue(node.get("value"), type);
        } catch (JsonProcessingException | ClassNotFoundException e) {
            logger.warn("Skipping unreadable revoked task id {}: {}", key, e.getMessage());
            return null;
        }
    }
}
