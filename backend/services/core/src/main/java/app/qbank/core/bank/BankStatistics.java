package app.qbank.core.bank;

import app.qbank.core.rating.SkillLevel;

import java.util.List;

public record BankStatistics(
        int totalQuestions,
        int totalSessions,
        double userRating,
        SkillLevel userLevel,
        double recentAccuracy,
        int recentQuestionsAnswered,
        int questionsDue,
        double averageAccuracy,
        List<TagCount> topTags
) {
    public record TagCount(String tag, int count) {}
}
