package app.qbank.core.rating;

public enum SkillLevel {
    BEGINNER(1000), NOVICE(1200), INTERMEDIATE(1400), ADVANCED(1600), EXPERT(1800), MASTER(Double.POSITIVE_INFINITY);

    private final double upperBound;
    SkillLevel(double upperBound) { this.upperBound = upperBound; }

    public static SkillLevel of(double userRating) {
        for (SkillLevel level : values()) {
            if (userRating < level.upperBound) return level;
        }
        return MASTER;
    }
}
