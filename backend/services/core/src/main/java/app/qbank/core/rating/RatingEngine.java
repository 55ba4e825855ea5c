package app.qbank.core.rating;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * ELO ratings for a user/question pair. Every answered question is one match: a correct answer is a
 * win for the user, an incorrect one a win for the question. The same K-factor applies to both
 * sides, so each match is zero-sum.
 */
public class RatingEngine {

    private static final double SCALE = 400.0;

    private final RatingSettings settings;

    public RatingEngine(RatingSettings settings) {
        this.settings = settings;
    }

    public RatingSettings settings() {
        return settings;
    }

    public double initialRating() {
        return settings.initialRating();
    }

    public double expectedScore(double rating, double opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - rating) / SCALE));
    }

    public double successProbability(double userRating, double questionRating) {
        return expectedScore(userRating, questionRating);
    }

    public RatingUpdate update(double userRating, double questionRating, boolean userWon) {
        double expectedUser = expectedScore(userRating, questionRating);
        double actualUser = userWon ? 1.0 : 0.0;

        double k = settings.kFactor();
        double newUser = userRating + k * (actualUser - expectedUser);
        double newQuestion = questionRating + k * ((1.0 - actualUser) - (1.0 - expectedUser));
        return new RatingUpdate(newUser, newQuestion);
    }

    public RatingRange recommendedRatingRange(double userRating, double spread) {
        if (!Double.isFinite(spread) || spread < 0) {
            throw new IllegalArgumentException("spread must be a non-negative number, got " + spread);
        }
        return new RatingRange(userRating - spread, userRating + spread);
    }

    /**
     * Orders items by how close the predicted success probability is to {@code targetSuccessRate},
     * best match first. Equal scores keep their input order.
     */
    public <T> List<T> rankForTarget(double userRating,
                                     Collection<T> items,
                                     ToDoubleFunction<T> ratingOf,
                                     double targetSuccessRate) {
        if (!(targetSuccessRate > 0 && targetSuccessRate < 1)) {
            throw new IllegalArgumentException("targetSuccessRate must be in (0, 1), got " + targetSuccessRate);
        }
        List<T> ranked = new ArrayList<>(items);
        ranked.sort(Comparator.comparingDouble(
                (T item) -> Math.abs(successProbability(userRating, ratingOf.applyAsDouble(item)) - targetSuccessRate)));
        return ranked;
    }
}
