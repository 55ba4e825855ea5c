package app.qbank.core.bank;

import app.qbank.core.rating.RatingRange;

import java.util.Set;

public record SessionFilter(
        Integer maxQuestions,
        Set<String> tags,
        RatingRange ratingRange
) {
    public SessionFilter {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static SessionFilter all() {
        return new SessionFilter(null, null, null);
    }

    public static SessionFilter limit(int maxQuestions) {
        return new SessionFilter(maxQuestions, null, null);
    }
}
