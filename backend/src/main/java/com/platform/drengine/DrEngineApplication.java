package com.platform.drengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Disaster Recovery Engine
 * 
 * Coordinates backups, cross-region replication, health evaluation and
 * state-machine driven failover for the operations database:
 * - Scheduled full/incremental/log-archive backups with verification and retention
 * - Replication link management with heartbeat based lag measurement
 * - Periodic health snapshots with multi-signal failover recommendation
 * - Failover orchestration with safety checks, draining and rollback
 * - Recovery tests against non-production environments
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class DrEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrEngineApplication.class, args);
    }
}
