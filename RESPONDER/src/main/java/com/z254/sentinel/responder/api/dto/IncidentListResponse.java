package com.z254.sentinel.responder.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class IncidentListResponse {
    private List<IncidentDto> incidents;
    private long total;
    private int page;
    private int size;
}
