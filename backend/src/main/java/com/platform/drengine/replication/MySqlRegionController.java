package com.platform.drengine.replication;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.SqlIdentifiers;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Region controller for MySQL 8 primaries and replicas.
 * 
 * Writes are fenced with {@code super_read_only}; open write transactions are found in
 * {@code information_schema.innodb_trx}; promotion stops and clears the replica channel
 * and lifts the read-only fence; sync mode maps to semi-synchronous replication.
 */
@Slf4j
@Component
public class MySqlRegionController implements RegionController {
    
    private static final String IN_FLIGHT_WRITES =
        "SELECT trx_mysql_thread_id FROM information_schema.innodb_trx "
            + "WHERE trx_is_read_only = 0 AND trx_mysql_thread_id <> CONNECTION_ID()";
    
    private final RegionDataSources dataSources;
    private final MetricsRegistry metricsRegistry;
    private final String heartbeatTable;
    
    public MySqlRegionController(RegionDataSources dataSources, MetricsRegistry metricsRegistry,
                                 DrEngineProperties properties) {
        this.dataSources = dataSources;
        this.metricsRegistry = metricsRegistry;
        this.heartbeatTable = SqlIdentifiers.require(properties.getReplication().getHeartbeatTable());
    }
    
    @Override
    public void stopWrites(String region) {
        execute(region, "stopWrites", "SET GLOBAL super_read_only = ON");
        log.info("[AUDIT] Writes stopped on {}", region);
    }
    
    @Override
    public void resumeWrites(String region) {
        execute(region, "resumeWrites", "SET GLOBAL super_read_only = OFF", "SET GLOBAL read_only = OFF");
        log.info("[AUDIT] Writes resumed on {}", region);
    }
    
    @Override
    public int inFlightWrites(String region) {
        return openWriteThreads(region).size();
    }
    
    @Override
    public int terminateInFlightWrites(String region) {
        List<Long> threads = openWriteThreads(region);
        int killed = 0;
        try (Connection conn = dataSources.forRegion(region).getConnection();
             Statement stmt = conn.createStatement()) {
            for (Long threadId : threads) {
                try {
                    stmt.execute("KILL " + threadId);
                    killed++;
                } catch (SQLException e) {
                    // thread finished between listing and kill
                    log.debug("KILL {} on {} failed: {}", threadId, region, e.getMessage());
                }
            }
        } catch (SQLException e) {
            throw unreachable(region, "terminateInFlightWrites", e);
        }
        log.warn("[AUDIT] Terminated {} in-flight write transactions on {}", killed, region);
        metricsRegistry.incrementCounter("drengine.region.terminated.transactions", "region", region);
        return killed;
    }
    
    @Override
    public void promote(String region) {
        execute(region, "promote",
            "STOP REPLICA",
            "RESET REPLICA ALL",
            "SET GLOBAL super_read_only = OFF",
            "SET GLOBAL read_only = OFF");
        log.info("[AUDIT] Region {} promoted to primary", region);
    }
    
    @Override
    public boolean healthCheck(String region) {
        String write = "INSERT INTO " + heartbeatTable + " (origin_region, ts) VALUES (?, NOW(6)) "
            + "ON DUPLICATE KEY UPDATE ts = VALUES(ts)";
        try (Connection conn = dataSources.forRegion(region).getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(write)) {
                stmt.setString(1, region);
                stmt.executeUpdate();
            }
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT @@read_only")) {
                return rs.next() && rs.getInt(1) == 0;
            }
        } catch (SQLException e) {
            log.warn("Synthetic health check failed on {}: {}", region, e.getMessage());
            return false;
        }
    }
    
    @Override
    public void applyReplicationMode(String primaryRegion, String replicaRegion, ReplicationMode mode) {
        String flag = mode == ReplicationMode.SYNC ? "ON" : "OFF";
        execute(primaryRegion, "applyReplicationMode", "SET GLOBAL rpl_semi_sync_source_enabled = " + flag);
        execute(replicaRegion, "applyReplicationMode", "SET GLOBAL rpl_semi_sync_replica_enabled = " + flag);
        log.info("[AUDIT] Replication {} -> {} set to {}", primaryRegion, replicaRegion, mode);
    }
    
    private List<Long> openWriteThreads(String region) {
        List<Long> threads = new ArrayList<>();
        try (Connection conn = dataSources.forRegion(region).getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(IN_FLIGHT_WRITES)) {
            while (rs.next()) {
                threads.add(rs.getLong(1));
            }
            return threads;
        } catch (SQLException e) {
            throw unreachable(region, "inFlightWrites", e);
        }
    }
    
    private void execute(String region, String operation, String... statements) {
        long startTime = System.currentTimeMillis();
        try (Connection conn = dataSources.forRegion(region).getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw unreachable(region, operation, e);
        } finally {
            metricsRegistry.recordDuration("drengine.region.operation.latency",
                java.time.Duration.ofMillis(System.currentTimeMillis() - startTime),
                "operation", operation);
        }
    }
    
    private ExternalSystemException unreachable(String region, String operation, SQLException e) {
        return new ExternalSystemException(ErrorCode.REGION_UNREACHABLE, region,
            operation + " failed on " + region + ": " + e.getMessage(), e);
    }
}
