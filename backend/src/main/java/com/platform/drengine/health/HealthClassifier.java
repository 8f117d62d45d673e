package com.platform.drengine.health;

import com.platform.drengine.config.DrEngineProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Turns measurements into indicators, a severity and a failover recommendation.
 * 
 * Severity is the worst indicator. Failover is recommended only when the severity is
 * critical and more than {@code failoverSignalThreshold} measured indicators are raised at
 * once. Missing measurements raise a warning but never count as a signal.
 */
@Component
public class HealthClassifier {
    
    private final DrEngineProperties.Health config;
    
    public HealthClassifier(DrEngineProperties properties) {
        this.config = properties.getHealth();
    }
    
    public Classification classify(Inputs inputs) {
        List<Indicator> indicators = List.of(
            lagIndicator(inputs),
            saturationIndicator(inputs.saturationPercent()),
            backupIndicator(inputs.consecutiveBackupFailures(), inputs.failedBackupsLast24h())
        );
        
        Severity severity = indicators.stream()
            .map(Indicator::severity)
            .reduce(Severity.HEALTHY, Severity::max);
        long signals = indicators.stream().filter(Indicator::countsAsSignal).count();
        boolean recommended = severity == Severity.CRITICAL && signals > config.getFailoverSignalThreshold();
        
        return new Classification(indicators, severity, recommended);
    }
    
    private Indicator lagIndicator(Inputs inputs) {
        Duration lag = inputs.maxReplicationLag();
        if (lag == null) {
            return inputs.lagUnknown()
                ? Indicator.unmeasured(IndicatorType.LAG, "replication lag unknown")
                : new Indicator(IndicatorType.LAG, Severity.HEALTHY, "no replication links");
        }
        if (lag.compareTo(config.getLagCritical()) > 0) {
            return new Indicator(IndicatorType.LAG, Severity.CRITICAL, "lag " + lag + " > " + config.getLagCritical());
        }
        if (lag.compareTo(config.getLagWarning()) > 0) {
            return new Indicator(IndicatorType.LAG, Severity.WARNING, "lag " + lag + " > " + config.getLagWarning());
        }
        if (inputs.lagUnknown()) {
            return Indicator.unmeasured(IndicatorType.LAG, "lag " + lag + ", some links unmeasured");
        }
        return new Indicator(IndicatorType.LAG, Severity.HEALTHY, "lag " + lag);
    }
    
    private Indicator saturationIndicator(Double saturation) {
        if (saturation == null) {
            return Indicator.unmeasured(IndicatorType.SATURATION, "saturation unknown");
        }
        if (saturation > config.getSaturationCriticalPercent()) {
            return new Indicator(IndicatorType.SATURATION, Severity.CRITICAL,
                String.format("saturation %.1f%% > %.1f%%", saturation, config.getSaturationCriticalPercent()));
        }
        if (saturation > config.getSaturationWarningPercent()) {
            return new Indicator(IndicatorType.SATURATION, Severity.WARNING,
                String.format("saturation %.1f%% > %.1f%%", saturation, config.getSaturationWarningPercent()));
        }
        return new Indicator(IndicatorType.SATURATION, Severity.HEALTHY, String.format("saturation %.1f%%", saturation));
    }
    
    private Indicator backupIndicator(int consecutiveFailures, int failuresLast24h) {
        String detail = consecutiveFailures + " consecutive failures, " + failuresLast24h + " in 24h";
        if (consecutiveFailures >= config.getConsecutiveBackupFailuresCritical()
                || failuresLast24h >= config.getBackupFailuresPerDayCritical()) {
            return new Indicator(IndicatorType.BACKUP, Severity.CRITICAL, detail);
        }
        if (failuresLast24h > 0) {
            return new Indicator(IndicatorType.BACKUP, Severity.WARNING, detail);
        }
        return new Indicator(IndicatorType.BACKUP, Severity.HEALTHY, detail);
    }
    
    /**
     * Measurements for one primary region. {@code lagUnknown} is set when a link could not be measured.
     */
    public record Inputs(
        Duration maxReplicationLag,
        boolean lagUnknown,
        Double saturationPercent,
        int consecutiveBackupFailures,
        int failedBackupsLast24h
    ) {
    }
    
    public record Classification(List<Indicator> indicators, Severity severity, boolean failoverRecommended) {
    }
}
