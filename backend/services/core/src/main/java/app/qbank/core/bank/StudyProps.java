package app.qbank.core.bank;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

import static app.qbank.core.error.InvalidConfigurationException.require;
import static app.qbank.core.error.InvalidConfigurationException.requireFinite;

@ConfigurationProperties(prefix = "app.study")
public record StudyProps(
        double recommendedSpread,
        double targetSuccessRate,
        int targetSessionMinutes,
        double avgSecondsPerQuestion,
        int maxDailyReviews,
        int maxDeferralDays,
        int recentSessions,
        int forecastDays,
        ZoneId zone
) {
    public StudyProps {
        require(requireFinite(recommendedSpread, "recommendedSpread") >= 0,
                "recommendedSpread must not be negative, got " + recommendedSpread);
        require(targetSuccessRate > 0 && targetSuccessRate < 1,
                "targetSuccessRate must be between 0 and 1 (exclusive), got " + targetSuccessRate);
        require(targetSessionMinutes > 0, "targetSessionMinutes must be positive, got " + targetSessionMinutes);
        require(requireFinite(avgSecondsPerQuestion, "avgSecondsPerQuestion") > 0,
                "avgSecondsPerQuestion must be positive, got " + avgSecondsPerQuestion);
        require(maxDailyReviews > 0, "maxDailyReviews must be positive, got " + maxDailyReviews);
        require(maxDeferralDays > 0, "maxDeferralDays must be positive, got " + maxDeferralDays);
        require(recentSessions > 0, "recentSessions must be positive, got " + recentSessions);
        require(forecastDays >= 0, "forecastDays must not be negative, got " + forecastDays);
        zone = zone == null ? ZoneId.of("UTC") : zone;
    }

    public static StudyProps defaults() {
        return new StudyProps(200.0, 0.7, 30, 45.0, 50, 7, 10, 7, ZoneId.of("UTC"));
    }
}
