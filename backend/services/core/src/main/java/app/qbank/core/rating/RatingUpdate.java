package app.qbank.core.rating;

public record RatingUpdate(
        double userRating,
        double questionRating
) {
}
