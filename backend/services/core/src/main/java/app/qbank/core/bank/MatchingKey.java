package app.qbank.core.bank;

import java.util.List;
import java.util.Map;

/**
 * {@code correctMatches} maps every left item index to the index of its right item.
 */
public record MatchingKey(List<String> leftItems, List<String> rightItems, Map<Integer, Integer> correctMatches)
        implements AnswerKey {

    public MatchingKey {
        if (leftItems == null || leftItems.isEmpty() || rightItems == null || rightItems.isEmpty()) {
            throw new IllegalArgumentException("Matching question needs items on both sides");
        }
        if (correctMatches == null || correctMatches.size() != leftItems.size()) {
            throw new IllegalArgumentException("Every left item needs exactly one match");
        }
        for (Map.Entry<Integer, Integer> e : correctMatches.entrySet()) {
            if (e.getKey() == null || e.getKey() < 0 || e.getKey() >= leftItems.size()
                    || e.getValue() == null || e.getValue() < 0 || e.getValue() >= rightItems.size()) {
                throw new IllegalArgumentException("Match out of range: " + e);
            }
        }
        leftItems = List.copyOf(leftItems);
        rightItems = List.copyOf(rightItems);
        correctMatches = Map.copyOf(correctMatches);
    }

    @Override
    public QuestionType type() {
        return QuestionType.MATCHING;
    }

    @Override
    public boolean accepts(Submission submission) {
        return correctMatches.equals(submission.matches());
    }
}
