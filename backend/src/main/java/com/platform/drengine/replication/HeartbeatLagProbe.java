package com.platform.drengine.replication;

import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.SqlIdentifiers;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

/**
 * Lag probe based on a replicated heartbeat table.
 * 
 * Every region stamps its own row with NOW(6) on a fixed interval. The row replicates
 * like any other change, so the difference between the primary's stamp and the replica's
 * copy of it is the replication delay, measured with the primary's clock on both sides.
 * 
 * Table layout: {@code (origin_region VARCHAR PRIMARY KEY, ts TIMESTAMP(6))}.
 */
@Slf4j
@Component
public class HeartbeatLagProbe implements LagProbe {
    
    private final RegionDataSources dataSources;
    private final String table;
    
    public HeartbeatLagProbe(RegionDataSources dataSources, DrEngineProperties properties) {
        this.dataSources = dataSources;
        this.table = SqlIdentifiers.require(properties.getReplication().getHeartbeatTable());
    }
    
    @Override
    public Duration measureLag(String primaryRegion, String replicaRegion) {
        Instant committed = readHeartbeat(primaryRegion, primaryRegion);
        Instant applied = readHeartbeat(replicaRegion, primaryRegion);
        Duration lag = Duration.between(applied, committed);
        return lag.isNegative() ? Duration.ZERO : lag;
    }
    
    private Instant readHeartbeat(String region, String originRegion) {
        String sql = "SELECT ts FROM " + table + " WHERE origin_region = ?";
        try (Connection conn = dataSources.forRegion(region).getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, originRegion);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new ExternalSystemException(ErrorCode.LAG_PROBE_FAILED, region,
                        "No heartbeat from " + originRegion + " on " + region);
                }
                Timestamp ts = rs.getTimestamp(1);
                return ts.toInstant();
            }
        } catch (SQLException e) {
            throw new ExternalSystemException(ErrorCode.REGION_UNREACHABLE, region,
                "Heartbeat read failed: " + e.getMessage(), e);
        }
    }
    
    /**
     * Stamps the heartbeat row on every configured region. Read-only replicas reject the
     * write, which is expected and only logged at debug level.
     */
    @Scheduled(fixedDelayString = "${drengine.replication.heartbeat-interval-ms:1000}")
    public void beat() {
        String sql = "INSERT INTO " + table + " (origin_region, ts) VALUES (?, NOW(6)) "
            + "ON DUPLICATE KEY UPDATE ts = VALUES(ts)";
        for (String region : dataSources.regions()) {
            try (Connection conn = dataSources.forRegion(region).getConnection();
                 PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, region);
                stmt.executeUpdate();
            } catch (SQLException e) {
                log.debug("Heartbeat not written on {}: {}", region, e.getMessage());
            }
        }
    }
}
