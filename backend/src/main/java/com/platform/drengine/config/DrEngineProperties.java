package com.platform.drengine.config;

import com.platform.drengine.recoverytest.EnvironmentType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the DR engine.
 * Every tunable threshold, interval and bound lives here with its default.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "drengine")
public class DrEngineProperties {
    
    private Storage storage = new Storage();
    
    private Backup backup = new Backup();
    
    private Replication replication = new Replication();
    
    private Health health = new Health();
    
    private Failover failover = new Failover();
    
    private RecoveryTest recoveryTest = new RecoveryTest();
    
    private Retry retry = new Retry();
    
    private Metrics metrics = new Metrics();
    
    private Notification notification = new Notification();
    
    private Routing routing = new Routing();
    
    private Executor executor = new Executor();
    
    private Tracing tracing = new Tracing();
    
    /**
     * Database regions by name. Production primaries and replicas.
     */
    private Map<String, Region> regions = new LinkedHashMap<>();
    
    /**
     * Isolated environments recovery tests may restore into.
     */
    private Map<String, Environment> environments = new LinkedHashMap<>();
    
    @Data
    public static class Storage {
        /**
         * Root directory of the filesystem artifact store.
         */
        private String rootDirectory = "/var/lib/drengine/artifacts";
    }
    
    @Data
    public static class Backup {
        private long schedulerTickMs = 60_000;
        
        private String retentionCron = "0 0 3 * * *";
        
        /**
         * Recovery-tested executions are kept this long past their retention.
         */
        private Duration retentionGrace = Duration.ofDays(7);
        
        /**
         * Maximum wait for the exclusive slot shared by non-parallel jobs.
         */
        private Duration exclusiveSlotWait = Duration.ofMinutes(10);
        
        private String defaultStoragePrefix = "backups";
        
        private int consecutiveFailureAlert = 3;
    }
    
    @Data
    public static class Replication {
        /**
         * ASYNC to SYNC switch requires lag strictly below this.
         */
        private Duration syncSwitchMaxLag = Duration.ofSeconds(5);
        
        private String heartbeatTable = "dr_heartbeat";
        
        private long heartbeatIntervalMs = 1_000;
        
        private long lagRefreshIntervalMs = 30_000;
        
        private Duration lagAlertThreshold = Duration.ofMinutes(1);
    }
    
    @Data
    public static class Health {
        private long intervalMs = 300_000;
        
        private Duration lagWarning = Duration.ofMinutes(1);
        
        private Duration lagCritical = Duration.ofMinutes(5);
        
        private double saturationWarningPercent = 80.0;
        
        private double saturationCriticalPercent = 90.0;
        
        private int consecutiveBackupFailuresCritical = 3;
        
        private int backupFailuresPerDayCritical = 3;
        
        /**
         * Failover is recommended when more raised indicators than this are present.
         */
        private int failoverSignalThreshold = 2;
        
        private Duration snapshotRetention = Duration.ofDays(7);
        
        private String pruneCron = "0 30 * * * *";
        
        /**
         * Primary regions evaluated on every tick, in addition to primaries of active links.
         */
        private List<String> primaryRegions = new ArrayList<>();
    }
    
    @Data
    public static class Failover {
        private Duration safetyLagBound = Duration.ofSeconds(30);
        
        private Duration safetyPollTimeout = Duration.ofSeconds(60);
        
        private Duration safetyPollInterval = Duration.ofSeconds(5);
        
        private Duration drainGrace = Duration.ofSeconds(30);
        
        private Duration drainPollInterval = Duration.ofSeconds(1);
        
        /**
         * Upper lag bound for a link to count as a healthy fallback.
         */
        private Duration fallbackMaxLag = Duration.ofMinutes(5);
    }
    
    @Data
    public static class RecoveryTest {
        private long tickMs = 300_000;
        
        private Duration defaultPointInTimeOffset = Duration.ofMinutes(10);
        
        private Duration failoverPollInterval = Duration.ofSeconds(5);
    }
    
    @Data
    public static class Retry {
        private int maxAttempts = 3;
        
        private Duration initialDelay = Duration.ofMillis(200);
        
        private double multiplier = 2.0;
        
        private Duration maxDelay = Duration.ofSeconds(5);
        
        private double jitterFactor = 0.1;
    }
    
    @Data
    public static class Metrics {
        private String prometheusUrl = "http://localhost:9090";
        
        // {region} is replaced with the evaluated region
        private String connectionsQuery = "sum(mysql_global_status_threads_connected{region=\"{region}\"})";
        
        private String cpuQuery = "100 * avg(rate(node_cpu_seconds_total{mode!=\"idle\",region=\"{region}\"}[5m]))";
        
        private String memoryQuery = "100 * (1 - avg(node_memory_MemAvailable_bytes{region=\"{region}\"} / node_memory_MemTotal_bytes{region=\"{region}\"}))";
        
        private String diskQuery = "100 * (1 - min(node_filesystem_avail_bytes{region=\"{region}\"} / node_filesystem_size_bytes{region=\"{region}\"}))";
    }
    
    @Data
    public static class Notification {
        private String topic = "dr-events";
    }
    
    @Data
    public static class Routing {
        private String redisUri = "redis://localhost:6379";
        
        private String keyPrefix = "drengine:route:";
        
        private String changeChannel = "drengine:route-changes";
        
        private Duration timeout = Duration.ofSeconds(5);
    }
    
    @Data
    public static class Executor {
        private int corePoolSize = 4;
        
        private int maxPoolSize = 16;
        
        private int queueCapacity = 100;
    }
    
    @Data
    public static class Tracing {
        private boolean enabled = false;
        
        private String serviceName = "dr-engine";
        
        private String deployment = "development";
        
        private String otlpEndpoint = "http://localhost:4317";
        
        // 1.0 samples every failover run and backup execution
        private double samplingRatio = 1.0;
    }
    
    @Data
    public static class Region {
        private String jdbcUrl;
        
        private String username;
        
        private String password;
        
        private int maxPoolSize = 5;
    }
    
    @Data
    public static class Environment {
        private EnvironmentType type = EnvironmentType.STAGING;
        
        private String jdbcUrl;
        
        private String username;
        
        private String password;
        
        /**
         * Regions of the environment's own topology, used by failover scenarios.
         */
        private String primaryRegion;
        
        private String replicaRegion;
    }
}
