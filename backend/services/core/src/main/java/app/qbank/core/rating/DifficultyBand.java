package app.qbank.core.rating;

public enum DifficultyBand {
    VERY_EASY(1000), EASY(1200), MEDIUM(1400), HARD(1600), VERY_HARD(1800), EXPERT(Double.POSITIVE_INFINITY);

    private final double upperBound;
    DifficultyBand(double upperBound) { this.upperBound = upperBound; }

    public static DifficultyBand of(double questionRating) {
        for (DifficultyBand band : values()) {
            if (questionRating < band.upperBound) return band;
        }
        return EXPERT;
    }
}
