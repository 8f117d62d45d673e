package com.platform.drengine.health;

/**
 * Evaluation of one signal within a snapshot.
 *
 * {@code unknown} marks an indicator raised only because its measurement was missing.
 */
public record Indicator(IndicatorType type, Severity severity, String detail, boolean unknown) {
    
    public Indicator(IndicatorType type, Severity severity, String detail) {
        this(type, severity, detail, false);
    }
    
    static Indicator unmeasured(IndicatorType type, String detail) {
        return new Indicator(type, Severity.WARNING, detail, true);
    }
    
    public boolean isRaised() {
        return severity.isRaised();
    }
    
    /**
     * Whether this indicator counts as an independent signal towards a failover recommendation.
     */
    public boolean countsAsSignal() {
        return isRaised() && !unknown;
    }
}
