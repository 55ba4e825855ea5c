package app.qbank.core.review;

import java.time.Instant;

/**
 * Spaced-repetition state of a single question.
 * <p>
 * The unseen seed has {@code intervalDays == 0} and no {@code nextReview}. Every other state is
 * produced by {@link ReviewScheduler}, carries a {@code nextReview} and satisfies the configured
 * interval and ease bounds. A skipped question is scheduled even though it was never answered.
 */
public record SchedulingState(
        double intervalDays,
        double easeFactor,
        Instant nextReview,
        Instant lastReviewed,
        int timesAnswered,
        int timesCorrect,
        int repetitions,
        double totalResponseSeconds
) {

    public static SchedulingState seed(double initialEaseFactor) {
        return new SchedulingState(0.0, initialEaseFactor, null, null, 0, 0, 0, 0.0);
    }

    public boolean unseen() {
        return nextReview == null;
    }

    public double accuracy() {
        if (timesAnswered == 0) return 0.0;
        return (double) timesCorrect / timesAnswered;
    }

    SchedulingState withNextReview(Instant next) {
        return new SchedulingState(intervalDays, easeFactor, next, lastReviewed,
                timesAnswered, timesCorrect, repetitions, totalResponseSeconds);
    }
}
