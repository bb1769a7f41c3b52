package com.z254.sentinel.responder.health;

import com.z254.sentinel.responder.broadcast.EventBroadcaster;
import com.z254.sentinel.responder.domain.model.HealthSignal;
import com.z254.sentinel.responder.domain.repository.IncidentRepository;
import com.z254.sentinel.responder.monitor.DedupGuard;
import com.z254.sentinel.responder.monitor.HealthMonitor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the responder itself.
 * <p>
 * Out of service only while the monitor is stopped; a failing monitored service is reported in the details
 * but is what the responder is for, not a fault of it.
 */
@Component
public class ResponderHealthIndicator implements ReactiveHealthIndicator {

    private final HealthMonitor healthMonitor;
    private final IncidentRepository incidentRepository;
    private final DedupGuard dedupGuard;
    private final EventBroadcaster broadcaster;

    public ResponderHealthIndicator(HealthMonitor healthMonitor,
                                    IncidentRepository incidentRepository,
                                    DedupGuard dedupGuard,
                                    EventBroadcaster broadcaster) {
        this.healthMonitor = healthMonitor;
        this.incidentRepository = incidentRepository;
        this.dedupGuard = dedupGuard;
        this.broadcaster = broadcaster;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        details.put("monitorRunning", healthMonitor.isRunning());
        details.put("activeIncidents", incidentRepository.findActive().size());
        details.put("dedupPolicy", dedupGuard.getPolicy().name());
        details.put("activeFaults", dedupGuard.snapshot());
        details.put("observers", broadcaster.onlineUsers().size());

        HealthSignal last = healthMonitor.lastHealth();
        if (last != null) {
            details.put("monitoredService.healthy", last.isHealthy());
            if (!last.isHealthy()) {
                details.put("monitoredService.error", String.valueOf(last.getError()));
            }
        } else {
            details.put("monitoredService.healthy", "UNKNOWN");
        }

        if (healthMonitor.isRunning()) {
            return Health.up().withDetails(details).build();
        }
        return Health.outOfService().withDetails(details).build();
    }
}
