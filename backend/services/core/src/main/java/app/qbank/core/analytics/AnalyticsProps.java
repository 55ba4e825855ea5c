package app.qbank.core.analytics;

import org.springframework.boot.context.properties.ConfigurationProperties;

import static app.qbank.core.error.InvalidConfigurationException.require;
import static app.qbank.core.error.InvalidConfigurationException.requireFinite;

/**
 * @param trendWindow       sessions compared on each side of a performance trend
 * @param trendThreshold    accuracy change, in percentage points, that counts as a trend
 * @param weeklyImprovement assumed accuracy gain per week of regular practice, in percentage points
 * @param minRetention      floor of the forgetting-curve estimate
 */
@ConfigurationProperties(prefix = "app.analytics")
public record AnalyticsProps(
        int trendWindow,
        double trendThreshold,
        double weeklyImprovement,
        double minRetention
) {
    public AnalyticsProps {
        require(trendWindow > 0, "trendWindow must be positive, got " + trendWindow);
        require(requireFinite(trendThreshold, "trendThreshold") >= 0,
                "trendThreshold must not be negative, got " + trendThreshold);
        require(requireFinite(weeklyImprovement, "weeklyImprovement") > 0,
                "weeklyImprovement must be positive, got " + weeklyImprovement);
        require(requireFinite(minRetention, "minRetention") >= 0 && minRetention <= 1,
                "minRetention must be within [0, 1], got " + minRetention);
    }

    public static AnalyticsProps defaults() {
        return new AnalyticsProps(5, 5.0, 2.0, 0.1);
    }
}
