package com.z254.sentinel.responder.domain.service;

import com.z254.sentinel.responder.broadcast.BroadcastEventType;
import com.z254.sentinel.responder.broadcast.EventBroadcaster;
import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.ActivityLogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only audit trail, capped at {@code responder.activity.max-entries} with the oldest entries
 * dropped first. Every entry is also pushed to observers as an {@code activity} event.
 */
@Slf4j
@Service
public class ActivityLogService {

    public static final String AGENT_ACTOR = "agent";

    private final EventBroadcaster broadcaster;
    private final int maxEntries;
    private final Deque<ActivityLogEntry> entries = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();

    public ActivityLogService(EventBroadcaster broadcaster, ResponderProperties properties) {
        this.broadcaster = broadcaster;
        this.maxEntries = properties.getActivity().getMaxEntries();
    }

    public ActivityLogEntry record(String incidentId, String actor, String action, String detail) {
        ActivityLogEntry entry = ActivityLogEntry.builder()
                .id(sequence.incrementAndGet())
                .incidentId(incidentId)
                .actor(actor)
                .action(action)
                .detail(detail)
                .createdAt(Instant.now())
                .build();
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > maxEntries) {
                entries.removeFirst();
            }
        }
        log.debug("Activity [{}] {} {}: {}", incidentId, actor, action, detail);
        broadcaster.broadcast(BroadcastEventType.ACTIVITY, entry);
        return entry;
    }

    public ActivityLogEntry recordAgent(String incidentId, String action, String detail) {
        return record(incidentId, AGENT_ACTOR, action, detail);
    }

    /**
     * Most recent entries first.
     */
    public List<ActivityLogEntry> recent(int limit) {
        List<ActivityLogEntry> recent = new ArrayList<>();
        synchronized (entries) {
            Iterator<ActivityLogEntry> newestFirst = entries.descendingIterator();
            while (newestFirst.hasNext() && recent.size() < limit) {
                recent.add(newestFirst.next());
            }
        }
        return recent;
    }

    /**
     * Entries for one incident, oldest first.
     */
    public List<ActivityLogEntry> forIncident(String incidentId) {
        synchronized (entries) {
            return entries.stream()
                    .filter(entry -> incidentId.equals(entry.getIncidentId()))
                    .toList();
        }
    }
}
