package app.qbank.core.analytics;

/**
 * Accuracy values are percentages; {@code accuracyChange} is recent minus earlier, in points.
 */
public record PerformanceTrend(
        TrendDirection direction,
        double accuracyChange,
        double recentAccuracy,
        double averageResponseSeconds,
        int totalSessions
) {
    static PerformanceTrend insufficient(int totalSessions) {
        return new PerformanceTrend(TrendDirection.INSUFFICIENT_DATA, 0.0, 0.0, 0.0, totalSessions);
    }
}
