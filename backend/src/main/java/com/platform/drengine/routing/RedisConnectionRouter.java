package com.platform.drengine.routing;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.CircuitBreakerManager;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connection router backed by Redis. Client-side routers read the route key and
 * subscribe to the change channel.
 */
@Slf4j
@Component
public class RedisConnectionRouter implements ConnectionRouter {
    
    private final MetricsRegistry metricsRegistry;
    private final DrEngineProperties.Routing config;
    private final AtomicReference<RedisClient> redisClient = new AtomicReference<>();
    private final AtomicReference<StatefulRedisConnection<String, String>> connection = new AtomicReference<>();
    
    public RedisConnectionRouter(MetricsRegistry metricsRegistry, DrEngineProperties properties) {
        this.metricsRegistry = metricsRegistry;
        this.config = properties.getRouting();
    }
    
    @Override
    @CircuitBreaker(name = CircuitBreakerManager.ROUTER, fallbackMethod = "updateTargetFallback")
    public void updateTarget(String routeKey, String region) {
        long startTime = System.currentTimeMillis();
        try {
            RedisCommands<String, String> commands = commands();
            String previous = commands.getset(config.getKeyPrefix() + routeKey, region);
            commands.publish(config.getChangeChannel(), routeKey + "=" + region);
            
            log.info("[AUDIT] Route {} moved from {} to {}", routeKey, previous, region);
            metricsRegistry.incrementCounter("drengine.routing.updates", "target", region);
        } catch (RuntimeException e) {
            throw new ExternalSystemException(ErrorCode.ROUTER_UNAVAILABLE, "redis",
                "Failed to update route " + routeKey + " to " + region + ": " + e.getMessage(), e);
        } finally {
            metricsRegistry.recordDuration("drengine.routing.latency",
                java.time.Duration.ofMillis(System.currentTimeMillis() - startTime));
        }
    }
    
    @Override
    @CircuitBreaker(name = CircuitBreakerManager.ROUTER, fallbackMethod = "currentTargetFallback")
    public Optional<String> currentTarget(String routeKey) {
        try {
            return Optional.ofNullable(commands().get(config.getKeyPrefix() + routeKey));
        } catch (RuntimeException e) {
            throw new ExternalSystemException(ErrorCode.ROUTER_UNAVAILABLE, "redis",
                "Failed to read route " + routeKey + ": " + e.getMessage(), e);
        }
    }
    
    @SuppressWarnings("unused")
    private void updateTargetFallback(String routeKey, String region, CallNotPermittedException e) {
        throw new ExternalSystemException(ErrorCode.ROUTER_UNAVAILABLE, "redis",
            "Router circuit breaker open, route " + routeKey + " not updated", e);
    }
    
    @SuppressWarnings("unused")
    private Optional<String> currentTargetFallback(String routeKey, CallNotPermittedException e) {
        throw new ExternalSystemException(ErrorCode.ROUTER_UNAVAILABLE, "redis",
            "Router circuit breaker open, route " + routeKey + " unreadable", e);
    }
    
    private synchronized RedisCommands<String, String> commands() {
        StatefulRedisConnection<String, String> conn = connection.get();
        if (conn == null || !conn.isOpen()) {
            RedisClient client = redisClient.get();
            if (client == null) {
                RedisURI uri = RedisURI.create(config.getRedisUri());
                uri.setTimeout(config.getTimeout());
                client = RedisClient.create(uri);
                redisClient.set(client);
            }
            conn = client.connect();
            connection.set(conn);
            log.info("Connected to routing store at {}", config.getRedisUri());
        }
        return conn.sync();
    }
    
    @PreDestroy
    public void disconnect() {
        StatefulRedisConnection<String, String> conn = connection.getAndSet(null);
        if (conn != null) {
            conn.close();
        }
        RedisClient client = redisClient.getAndSet(null);
        if (client != null) {
            client.shutdown();
        }
    }
}
