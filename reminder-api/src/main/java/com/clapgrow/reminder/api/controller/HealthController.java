package com.clapgrow.reminder.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "Health", description = "Liveness endpoint")
public class HealthController {

    @GetMapping("/health")
    @Operation(
            summary = "Liveness check",
            description = "Returns UP while the process is serving requests. Does not touch the database."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Service is up")
    })
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "service", "reminder-api"));
    }
}
