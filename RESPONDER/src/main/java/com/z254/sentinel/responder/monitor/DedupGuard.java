package com.z254.sentinel.responder.monitor;

import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.config.ResponderProperties.DedupPolicy;
import com.z254.sentinel.responder.domain.model.FaultType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * At most one live incident per dedup key.
 * <p>
 * The key is the fault type, or a single shared key under {@link DedupPolicy#GLOBAL}. All methods
 * are synchronized so check-and-claim is atomic.
 */
@Slf4j
@Component
public class DedupGuard {

    static final String GLOBAL_KEY = "*";

    private final DedupPolicy policy;
    private final Map<String, String> liveIncidents = new HashMap<>();

    public DedupGuard(ResponderProperties properties) {
        this.policy = properties.getMonitor().getDedupPolicy();
    }

    /**
     * Claim {@code faultType} for {@code incidentId}. Returns false if another incident holds it.
     */
    public synchronized boolean tryClaim(FaultType faultType, String incidentId) {
        String key = keyFor(faultType);
        String holder = liveIncidents.get(key);
        if (holder != null && !holder.equals(incidentId)) {
            return false;
        }
        liveIncidents.put(key, incidentId);
        return true;
    }

    public synchronized Optional<String> holder(FaultType faultType) {
        return Optional.ofNullable(liveIncidents.get(keyFor(faultType)));
    }

    /**
     * Release the key, but only if {@code incidentId} still holds it.
     */
    public synchronized void release(FaultType faultType, String incidentId) {
        String key = keyFor(faultType);
        if (incidentId.equals(liveIncidents.get(key))) {
            liveIncidents.remove(key);
            log.debug("Released dedup key {} held by {}", key, incidentId);
        }
    }

    /**
     * Release whatever key {@code incidentId} holds.
     */
    public synchronized void releaseIncident(String incidentId) {
        liveIncidents.values().removeIf(incidentId::equals);
    }

    public synchronized boolean isHeld(String incidentId) {
        return liveIncidents.containsValue(incidentId);
    }

    /**
     * Replace the guard's contents. The first incident per key wins.
     */
    public synchronized void rebuild(Map<FaultType, String> active) {
        liveIncidents.clear();
        active.forEach((faultType, incidentId) -> liveIncidents.putIfAbsent(keyFor(faultType), incidentId));
        log.info("Dedup guard rebuilt with {} live incidents ({} policy)", liveIncidents.size(), policy);
    }

    public synchronized Map<String, String> snapshot() {
        return new LinkedHashMap<>(liveIncidents);
    }

    public DedupPolicy getPolicy() {
        return policy;
    }

    private String keyFor(FaultType faultType) {
        return policy == DedupPolicy.GLOBAL ? GLOBAL_KEY : faultType.getKey();
    }
}
