package app.qbank.core.review;

public record AttemptOutcome(
        boolean correct,
        double responseTimeSeconds
) {
    public static AttemptOutcome correct(double responseTimeSeconds) {
        return new AttemptOutcome(true, responseTimeSeconds);
    }

    public static AttemptOutcome incorrect(double responseTimeSeconds) {
        return new AttemptOutcome(false, responseTimeSeconds);
    }
}
