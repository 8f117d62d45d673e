package com.platform.drengine.health;

import com.platform.drengine.backup.BackupHealthSummary;
import com.platform.drengine.backup.BackupService;
import com.platform.drengine.config.DrEngineProperties;
import com.platform.drengine.core.RetryEngine;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.observability.MetricsRegistry;
import com.platform.drengine.replication.LinkStatus;
import com.platform.drengine.replication.ReplicationLink;
import com.platform.drengine.replication.ReplicationMode;
import com.platform.drengine.replication.ReplicationTopologyManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HealthMonitorTest {

    private static final String PRIMARY = "us-east-1";
    private static final Instant NOW = Instant.parse("2026-01-10T12:00:00Z");

    private HealthSnapshotRepository repository;
    private MetricsSource metricsSource;
    private ReplicationTopologyManager topologyManager;
    private BackupService backupService;
    private ApplicationEventPublisher eventPublisher;
    private DrEngineProperties properties;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        repository = mock(HealthSnapshotRepository.class);
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        metricsSource = mock(MetricsSource.class);
        topologyManager = mock(ReplicationTopologyManager.class);
        backupService = mock(BackupService.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        properties = new DrEngineProperties();
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());

        monitor = new HealthMonitor(repository, metricsSource, topologyManager, backupService,
            new HealthClassifier(properties), new RetryEngine(metrics, properties, d -> { }), eventPublisher,
            metrics, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void snapshotCombinesLagSaturationAndBackupSignals() {
        ReplicationLink link = link("us-west-2");
        when(topologyManager.linksForPrimary(PRIMARY)).thenReturn(List.of(link));
        when(topologyManager.refreshLag(link)).thenReturn(link.toBuilder().lastLag(Duration.ofMinutes(2)).build());
        when(metricsSource.sample(PRIMARY)).thenReturn(new MetricsSample(120L, 40.0, 95.0, 60.0));
        when(backupService.backupHealth(PRIMARY, NOW)).thenReturn(new BackupHealthSummary(PRIMARY, 1, 0, 3, 4));

        HealthSnapshot snapshot = monitor.snapshot(PRIMARY);

        assertThat(snapshot.maxReplicationLag()).isEqualTo(Duration.ofMinutes(2));
        assertThat(snapshot.saturationPercent()).isEqualTo(95.0);
        assertThat(snapshot.activeConnections()).isEqualTo(120L);
        assertThat(snapshot.failedBackupsLast24h()).isEqualTo(3);
        assertThat(snapshot.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(snapshot.failoverRecommended()).isTrue();
        assertThat(snapshot.capturedAt()).isEqualTo(NOW);

        ArgumentCaptor<HealthSnapshotRecordedEvent> event = ArgumentCaptor.forClass(HealthSnapshotRecordedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().snapshot()).isSameAs(snapshot);
    }

    @Test
    void unavailableMetricsAndLagAreRecordedAsNotes() {
        ReplicationLink link = link("us-west-2");
        when(topologyManager.linksForPrimary(PRIMARY)).thenReturn(List.of(link));
        when(topologyManager.refreshLag(link))
            .thenThrow(new ExternalSystemException(ErrorCode.LAG_PROBE_FAILED, "us-west-2", "probe failed"));
        when(metricsSource.sample(PRIMARY))
            .thenThrow(new ExternalSystemException(ErrorCode.METRICS_UNAVAILABLE, "metrics", "prometheus down"));
        when(backupService.backupHealth(eq(PRIMARY), any())).thenReturn(new BackupHealthSummary(PRIMARY, 0, 0, 0, 0));

        HealthSnapshot snapshot = monitor.snapshot(PRIMARY);

        assertThat(snapshot.maxReplicationLag()).isNull();
        assertThat(snapshot.saturationPercent()).isNull();
        assertThat(snapshot.severity()).isEqualTo(Severity.WARNING);
        assertThat(snapshot.failoverRecommended()).isFalse();
        assertThat(snapshot.notes()).hasSize(2);
    }

    @Test
    void monitoredRegionsIncludeConfiguredAndLinkPrimaries() {
        properties.getHealth().setPrimaryRegions(List.of("eu-central-1"));
        ReplicationLink dropped = link("ap-south-1").toBuilder().primaryRegion("ap-east-1").status(LinkStatus.DROPPED).build();
        when(topologyManager.allLinks()).thenReturn(List.of(link("us-west-2"), dropped));

        assertThat(monitor.monitoredRegions()).containsExactly("eu-central-1", PRIMARY);
    }

    @Test
    void pruneRemovesSnapshotsOlderThanRetention() {
        monitor.prune();

        verify(repository).deleteCapturedBefore(NOW.minus(Duration.ofDays(7)));
    }

    private static ReplicationLink link(String replica) {
        return ReplicationLink.builder()
            .id(UUID.randomUUID())
            .primaryRegion(PRIMARY)
            .replicaRegion(replica)
            .mode(ReplicationMode.ASYNC)
            .status(LinkStatus.ACTIVE)
            .build();
    }
}
