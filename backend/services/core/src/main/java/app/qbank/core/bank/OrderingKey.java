package app.qbank.core.bank;

import java.util.HashSet;
import java.util.List;

/**
 * {@code correctOrder} lists item indexes in the expected order and is a permutation of all of them.
 */
public record OrderingKey(List<String> items, List<Integer> correctOrder) implements AnswerKey {

    public OrderingKey {
        if (items == null || items.size() < 2) {
            throw new IllegalArgumentException("Ordering question needs at least 2 items");
        }
        final int itemCount = items.size();
        if (correctOrder == null || correctOrder.size() != itemCount
                || correctOrder.stream().anyMatch(i -> i == null || i < 0 || i >= itemCount)
                || new HashSet<>(correctOrder).size() != items.size()) {
            throw new IllegalArgumentException("correctOrder must list every item index exactly once, got " + correctOrder);
        }
        items = List.copyOf(items);
        correctOrder = List.copyOf(correctOrder);
    }

    @Override
    public QuestionType type() {
        return QuestionType.ORDERING;
    }

    @Override
    public boolean accepts(Submission submission) {
        return correctOrder.equals(submission.order());
    }
}
