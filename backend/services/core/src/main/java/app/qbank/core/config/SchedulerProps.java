package app.qbank.core.config;

import app.qbank.core.review.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.review.scheduler")
public record SchedulerProps(
        double minEaseFactor,
        double maxEaseFactor,
        double initialEaseFactor,
        double easeBonus,
        double easePenalty,
        double minIntervalDays,
        double maxIntervalDays
) {
    public SchedulerSettings toSettings() {
        return new SchedulerSettings(
                minEaseFactor,
                maxEaseFactor,
                initialEaseFactor,
                easeBonus,
                easePenalty,
                minIntervalDays,
                maxIntervalDays
        );
    }
}
