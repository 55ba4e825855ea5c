package app.qbank.core.analytics;

public enum TrendDirection {
    IMPROVING,
    STABLE,
    DECLINING,
    INSUFFICIENT_DATA
}
