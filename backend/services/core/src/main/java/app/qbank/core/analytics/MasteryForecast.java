package app.qbank.core.analytics;

public record MasteryForecast(
        boolean achieved,
        int weeksToTarget,
        double currentAccuracy,
        double targetAccuracy,
        int recommendedSessionsPerWeek
) {
}
