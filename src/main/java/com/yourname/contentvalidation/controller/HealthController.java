package com.yourname.contentvalidation.controller;

import com.yourname.contentvalidation.service.TwoRoundOrchestrator;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final TwoRoundOrchestrator orchestrator;

    public HealthController(TwoRoundOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Boolean> providers = new LinkedHashMap<>();
        providers.put(orchestrator.providerA().id().name(), orchestrator.providerA().isConfigured());
        providers.put(orchestrator.providerB().id().name(), orchestrator.providerB().isConfigured());

        return Map.of(
            "status", "up",
            "providers", providers,
            "timestamp", Instant.now().toString()
        );
    }
}
