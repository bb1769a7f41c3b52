package com.z254.sentinel.responder.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Raw health snapshot of the monitored service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthSignal {

    private boolean healthy;

    /** Error message reported by the health endpoint */
    private String error;

    /** Error class name, e.g. ProcessDown, Timeout, ConfigParseError */
    private String errorType;

    private String traceback;

    /** Extra parser or transport detail */
    private String detail;

    private Integer statusCode;

    private Long responseTimeMs;

    private Instant checkedAt;

    public static HealthSignal healthy(long responseTimeMs) {
        return HealthSignal.builder()
                .healthy(true)
                .statusCode(200)
                .responseTimeMs(responseTimeMs)
                .checkedAt(Instant.now())
                .build();
    }

    /**
     * Signal used when the health endpoint cannot be reached at all.
     */
    public static HealthSignal unreachable(String errorType, String error) {
        return HealthSignal.builder()
                .healthy(false)
                .errorType(errorType)
                .error(error)
                .checkedAt(Instant.now())
                .build();
    }
}
