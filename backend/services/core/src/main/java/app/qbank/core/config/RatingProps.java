package app.qbank.core.config;

import app.qbank.core.rating.RatingSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.review.rating")
public record RatingProps(
        double kFactor,
        double initialRating
) {
    public RatingSettings toSettings() {
        return new RatingSettings(kFactor, initialRating);
    }
}
