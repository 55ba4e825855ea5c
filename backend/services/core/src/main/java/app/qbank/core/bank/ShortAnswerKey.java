package app.qbank.core.bank;

import java.util.List;

/**
 * Free-text answer accepted when it equals, or is close enough by edit distance to, any acceptable answer.
 */
public record ShortAnswerKey(List<String> acceptableAnswers, boolean caseSensitive, double fuzzyThreshold)
        implements AnswerKey {

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.8;

    public ShortAnswerKey {
        if (acceptableAnswers == null || acceptableAnswers.isEmpty()
                || acceptableAnswers.stream().anyMatch(a -> a == null || a.isBlank())) {
            throw new IllegalArgumentException("Short-answer question needs non-empty acceptable answers");
        }
        if (!(fuzzyThreshold > 0 && fuzzyThreshold <= 1)) {
            throw new IllegalArgumentException("fuzzyThreshold must be in (0, 1], got " + fuzzyThreshold);
        }
        acceptableAnswers = List.copyOf(acceptableAnswers);
    }

    public ShortAnswerKey(List<String> acceptableAnswers, boolean caseSensitive) {
        this(acceptableAnswers, caseSensitive, DEFAULT_FUZZY_THRESHOLD);
    }

    @Override
    public QuestionType type() {
        return QuestionType.SHORT_ANSWER;
    }

    @Override
    public boolean accepts(Submission submission) {
        if (submission.text() == null) return false;
        String given = TextMatching.normalize(submission.text(), caseSensitive);
        for (String acceptable : acceptableAnswers) {
            String expected = TextMatching.normalize(acceptable, caseSensitive);
            if (given.equals(expected) || TextMatching.similarity(given, expected) >= fuzzyThreshold) {
                return true;
            }
        }
        return false;
    }
}
