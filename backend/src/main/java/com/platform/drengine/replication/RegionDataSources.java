package com.platform.drengine.replication;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ValidationException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection pools for the configured regions and recovery-test environments.
 * Pools are created on first use and closed on shutdown.
 */
@Slf4j
@Component
public class RegionDataSources {
    
    private final DrEngineProperties properties;
    private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();
    
    public RegionDataSources(DrEngineProperties properties) {
        this.properties = properties;
    }
    
    public boolean isKnownRegion(String region) {
        return region != null && properties.getRegions().containsKey(region);
    }
    
    public Set<String> regions() {
        return properties.getRegions().keySet();
    }
    
    public DataSource forRegion(String region) {
        DrEngineProperties.Region config = properties.getRegions().get(region);
        if (config == null) {
            throw new ValidationException(ErrorCode.UNKNOWN_REGION, "Region is not configured: " + region);
        }
        return pools.computeIfAbsent("region:" + region, k ->
            createDataSource("region-" + region, config.getJdbcUrl(), config.getUsername(),
                config.getPassword(), config.getMaxPoolSize()));
    }
    
    public DataSource forEnvironment(String environment) {
        DrEngineProperties.Environment config = properties.getEnvironments().get(environment);
        if (config == null) {
            throw new ValidationException(ErrorCode.UNKNOWN_ENVIRONMENT, "Environment is not configured: " + environment);
        }
        return pools.computeIfAbsent("env:" + environment, k ->
            createDataSource("env-" + environment, config.getJdbcUrl(), config.getUsername(),
                config.getPassword(), 4));
    }
    
    private HikariDataSource createDataSource(String poolName, String url, String username,
                                              String password, int maxPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("DR-" + poolName);
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setMinimumIdle(1);
        config.setMaximumPoolSize(maxPoolSize);
        config.setConnectionTimeout(10000);
        config.setIdleTimeout(300000);
        config.setMaxLifetime(1200000);
        config.setConnectionTestQuery("SELECT 1");
        log.info("Creating connection pool {} for {}", poolName, url);
        return new HikariDataSource(config);
    }
    
    @PreDestroy
    public void close() {
        pools.forEach((name, pool) -> {
            log.info("Closing connection pool {}", name);
            pool.close();
        });
        pools.clear();
    }
}
