package com.platform.drengine.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.CircuitBreakerManager;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Metrics source backed by the Prometheus HTTP query API.
 * Each configured query is an instant vector query with {@code {region}} substituted.
 */
@Slf4j
@Component
public class PrometheusMetricsSource implements MetricsSource {
    
    private final RestTemplate restTemplate;
    private final DrEngineProperties.Metrics config;
    
    public PrometheusMetricsSource(RestTemplate restTemplate, DrEngineProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getMetrics();
    }
    
    @Override
    @CircuitBreaker(name = CircuitBreakerManager.METRICS, fallbackMethod = "sampleFallback")
    public MetricsSample sample(String region) {
        Double connections = query(config.getConnectionsQuery(), region);
        return new MetricsSample(
            connections != null ? connections.longValue() : null,
            query(config.getCpuQuery(), region),
            query(config.getMemoryQuery(), region),
            query(config.getDiskQuery(), region)
        );
    }
    
    private Double query(String template, String region) {
        if (template == null || template.isBlank()) {
            return null;
        }
        String promql = template.replace("{region}", region);
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getPrometheusUrl())
            .path("/api/v1/query")
            .queryParam("query", "{query}")
            .encode()
            .buildAndExpand(promql)
            .toUri();
        
        JsonNode body;
        try {
            body = restTemplate.getForObject(uri, JsonNode.class);
        } catch (RestClientException e) {
            throw new ExternalSystemException(ErrorCode.METRICS_UNAVAILABLE, "prometheus",
                "Prometheus query failed: " + e.getMessage(), e);
        }
        if (body == null || !"success".equals(body.path("status").asText())) {
            throw new ExternalSystemException(ErrorCode.METRICS_UNAVAILABLE, "prometheus",
                "Prometheus query rejected: " + (body == null ? "empty body" : body.path("error").asText()));
        }
        
        JsonNode result = body.path("data").path("result");
        if (!result.isArray() || result.isEmpty()) {
            log.debug("No data for query {} in region {}", promql, region);
            return null;
        }
        // value is [timestamp, "number"]
        String value = result.get(0).path("value").path(1).asText(null);
        try {
            double parsed = value == null ? Double.NaN : Double.parseDouble(value);
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            throw new ExternalSystemException(ErrorCode.METRICS_UNAVAILABLE, "prometheus",
                "Non-numeric sample for query " + promql + ": " + value, e);
        }
    }
    
    private MetricsSample sampleFallback(String region, CallNotPermittedException e) {
        throw new ExternalSystemException(ErrorCode.METRICS_UNAVAILABLE, "prometheus",
            "Metrics circuit breaker is open", e);
    }
}
