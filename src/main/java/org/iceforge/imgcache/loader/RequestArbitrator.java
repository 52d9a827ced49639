package org.iceforge.imgcache.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-flight admission: at most one in-flight load per key. A second request for an
 * active key is turned away, not queued.
 */
public class RequestArbitrator {
    private static final Logger log = LoggerFactory.getLogger(RequestArbitrator.class);

    private final ConcurrentHashMap<String, Instant> active = new ConcurrentHashMap<>();

    /**
     * Marks {@code key} active.
     *
     * @return false when another request already holds the key
     */
    public boolean tryAdmit(String key) {
        Objects.requireNonNull(key, "key");
        if (active.putIfAbsent(key, Instant.now()) == null) {
            return true;
        }
        log.debug("Request already in progress for {}", key);
        return false;
    }

    /** Clears the marker; called once per admitted request whatever its outcome. */
    public void release(String key) {
        Objects.requireNonNull(key, "key");
        active.remove(key);
    }

    public boolean isActive(String key) {
        return active.containsKey(key);
    }

    public int activeCount() {
        return active.size();
    }

    /** Admission time per active key. */
    public Map<String, Instant> snapshot() {
        return Map.copyOf(active);
    }
}
