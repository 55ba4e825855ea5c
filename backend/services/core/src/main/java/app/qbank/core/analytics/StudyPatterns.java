package app.qbank.core.analytics;

/**
 * {@code preferredStudyHour} is null until at least one session was recorded.
 */
public record StudyPatterns(
        int daysStudied,
        double totalStudyMinutes,
        double averageSessionMinutes,
        Integer preferredStudyHour
) {
}
