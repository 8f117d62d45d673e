package com.platform.drengine.api;

import com.platform.drengine.config.DrConfiguration;
import com.platform.drengine.config.DrConfigurationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for DR configurations. Updates fail with 409 while an in-flight operation
 * references the scope.
 */
@Slf4j
@RestController
@RequestMapping("/api/configurations")
@RequiredArgsConstructor
@CrossOrigin(origins = "${drengine.api.allowed-origins:*}")
public class ConfigurationController {
    
    private final DrConfigurationService configurationService;
    
    @GetMapping
    public List<DrConfiguration> list() {
        return configurationService.list();
    }
    
    /**
     * Effective configuration of a scope, inherited from the system scope when it has none.
     */
    @GetMapping("/{scope}")
    public DrConfiguration get(@PathVariable String scope) {
        return configurationService.get(scope);
    }
    
    @PutMapping("/{scope}")
    public DrConfiguration update(@PathVariable String scope, @RequestBody DrConfiguration configuration) {
        log.info("API: Update DR configuration {}", scope);
        return configurationService.update(configuration.toBuilder().scopeKey(scope).build());
    }
    
    @GetMapping("/{scope}/references")
    public Map<String, Object> references(@PathVariable String scope) {
        return Map.of("scope", scope, "inFlightReferences", configurationService.references(scope));
    }
}
