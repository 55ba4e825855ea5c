package app.qbank.core.rating;

public record RatingRange(
        double low,
        double high
) {
    public boolean contains(double rating) {
        return rating >= low && rating <= high;
    }
}
