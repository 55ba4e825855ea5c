package app.qbank.core.review;

import static app.qbank.core.error.InvalidConfigurationException.require;
import static app.qbank.core.error.InvalidConfigurationException.requireFinite;

public record SchedulerSettings(
        double minEaseFactor,
        double maxEaseFactor,
        double initialEaseFactor,
        double easeBonus,
        double easePenalty,
        double minIntervalDays,
        double maxIntervalDays
) {
    public SchedulerSettings {
        requireFinite(minEaseFactor, "minEaseFactor");
        requireFinite(maxEaseFactor, "maxEaseFactor");
        requireFinite(initialEaseFactor, "initialEaseFactor");
        requireFinite(easeBonus, "easeBonus");
        requireFinite(easePenalty, "easePenalty");
        requireFinite(minIntervalDays, "minIntervalDays");
        requireFinite(maxIntervalDays, "maxIntervalDays");

        require(minEaseFactor <= maxEaseFactor,
                "minEaseFactor " + minEaseFactor + " exceeds maxEaseFactor " + maxEaseFactor);
        require(minIntervalDays <= maxIntervalDays,
                "minIntervalDays " + minIntervalDays + " exceeds maxIntervalDays " + maxIntervalDays);
        // zero is reserved for the unseen state
        require(minIntervalDays > 0, "minIntervalDays must be positive, got " + minIntervalDays);
        require(easeBonus >= 0, "easeBonus must not be negative, got " + easeBonus);
        require(easePenalty >= 0, "easePenalty must not be negative, got " + easePenalty);
        require(initialEaseFactor >= minEaseFactor && initialEaseFactor <= maxEaseFactor,
                "initialEaseFactor " + initialEaseFactor + " is outside [" + minEaseFactor + ", " + maxEaseFactor + "]");
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(1.3, 3.0, 2.5, 0.15, 0.2, 1.0, 365.0);
    }

    double clampEase(double ef) {
        return Math.max(minEaseFactor, Math.min(maxEaseFactor, ef));
    }

    double clampInterval(double days) {
        return Math.max(minIntervalDays, Math.min(maxIntervalDays, days));
    }
}
