package com.z254.sentinel.responder.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for the responder service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI responderOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Sentinel Responder API")
                        .description("""
                                Incident response for a monitored service.

                                ## Features

                                - **Incidents**: detected faults with diagnosis, proposed fix, safety result and confidence
                                - **Approvals**: role-gated approve / override, reject, request changes
                                - **Agent**: start and stop monitoring, fault drills, spoken status summary

                                Live events are pushed on the `/ws/observers` WebSocket.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Incidents")
                                .description("Incident querying and human actions"),
                        new Tag()
                                .name("Agent")
                                .description("Monitoring control, drills and statistics")
                ));
    }
}
