package com.z254.sentinel.responder.client;

import reactor.core.publisher.Mono;

/**
 * Text-to-speech for spoken alerts. Purely cosmetic.
 */
public interface SpeechSynthesisClient {

    /**
     * Audio for {@code text}, or empty when synthesis is unavailable.
     */
    Mono<byte[]> synthesize(String text);
}
