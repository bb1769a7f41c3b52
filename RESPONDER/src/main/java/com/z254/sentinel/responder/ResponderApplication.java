package com.z254.sentinel.responder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sentinel Responder - incident response for a single monitored service.
 *
 * <p>Responder provides:
 * <ul>
 *   <li>Health monitoring with fault classification and duplicate suppression</li>
 *   <li>Diagnosis and fix proposals from a reasoning engine, with rule-based fallback</li>
 *   <li>Safety gating and confidence scoring that learns from human decisions</li>
 *   <li>Role-gated approval, auto-apply above threshold, verified recovery</li>
 *   <li>Live updates to observers over WebSocket</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ResponderApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResponderApplication.class, args);
    }
}
