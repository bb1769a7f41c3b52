package com.z254.sentinel.responder.client;

import com.z254.sentinel.responder.domain.model.SandboxResult;
import reactor.core.publisher.Mono;

/**
 * Isolated execution environment for trying a fix before it touches the service.
 */
public interface SandboxClient {

    /**
     * Apply {@code fixCode} and run {@code testCode} against it. Never errors; an unreachable
     * sandbox yields {@link SandboxResult#unavailable(String)}.
     */
    Mono<SandboxResult> test(String fixCode, String testCode);
}
