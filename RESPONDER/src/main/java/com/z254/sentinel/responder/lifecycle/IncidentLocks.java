package com.z254.sentinel.responder.lifecycle;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per incident. Serializes the monitor pipeline, the verifier and human actions
 * touching the same incident; different incidents never contend.
 * <p>
 * Locks of resolved or rejected incidents are retired. A thread that was waiting on a retired lock
 * notices on acquiring it and starts over with the current one.
 */
@Component
public class IncidentLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String incidentId, Supplier<T> action) {
        ReentrantLock lock = acquire(incidentId);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String incidentId, Runnable action) {
        withLock(incidentId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Forget the lock of an incident that reached a terminal status. Called by the lock holder.
     */
    public void retire(String incidentId) {
        ReentrantLock lock = locks.get(incidentId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            locks.remove(incidentId, lock);
        }
    }

    public int size() {
        return locks.size();
    }

    private ReentrantLock acquire(String incidentId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(incidentId, id -> new ReentrantLock());
            lock.lock();
            if (locks.get(incidentId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }
}
