package app.qbank.core.rating;

import static app.qbank.core.error.InvalidConfigurationException.require;
import static app.qbank.core.error.InvalidConfigurationException.requireFinite;

public record RatingSettings(
        double kFactor,
        double initialRating
) {
    public RatingSettings {
        requireFinite(kFactor, "kFactor");
        requireFinite(initialRating, "initialRating");
        require(kFactor > 0, "kFactor must be positive, got " + kFactor);
    }

    public static RatingSettings defaults() {
        return new RatingSettings(32.0, 1200.0);
    }
}
