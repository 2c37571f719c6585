package com.auraide.dispatch.api;

import com.auraide.sandbox.ProviderCapabilities;
import com.auraide.sandbox.ProviderType;
import com.auraide.sandbox.SandboxManager;
import com.auraide.sandbox.model.ProviderHealth;
import com.auraide.sandbox.model.ProviderInfo;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing registered providers, their capabilities, load and health.
 */
@RestController
@RequestMapping("/api/v1/providers")
public class ProviderController {

    private final SandboxManager sandboxManager;

    public ProviderController(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    /**
     * GET /api/v1/providers: Registered providers with capabilities and current session load.
     */
    @GetMapping
    public List<Map<String, Object>> listProviders() {
        Map<ProviderType, Integer> loads = sandboxManager.getProviderLoads();
        List<Map<String, Object>> result = new ArrayList<>();
        for (ProviderType type : sandboxManager.getAvailableProviders()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", type.wireName());
            entry.put("capabilities", sandboxManager.getProviderCapabilities(type));
            entry.put("activeSessions", loads.getOrDefault(type, 0));
            result.add(entry);
        }
        return result;
    }

    @GetMapping("/{type}/info")
    public ProviderInfo getInfo(@PathVariable String type) {
        return sandboxManager.getProviderInfo(ProviderType.fromWire(type));
    }

    @GetMapping("/{type}/capabilities")
    public ProviderCapabilities getCapabilities(@PathVariable String type) {
        return sandboxManager.getProviderCapabilities(ProviderType.fromWire(type));
    }

    @GetMapping("/health")
    public Map<String, ProviderHealth> health() {
        Map<String, ProviderHealth> result = new LinkedHashMap<>();
        sandboxManager.healthCheckProviders().forEach((type, health) -> result.put(type.wireName(), health));
        return result;
    }
}
