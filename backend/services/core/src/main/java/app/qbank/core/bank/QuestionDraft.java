package app.qbank.core.bank;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Input for a new question. Choice questions use {@code correctAnswer} and {@code incorrectAnswers},
 * with {@code explanations} keyed by answer text; every other type carries an {@code answerKey}.
 * Null entries are dropped and duplicate tags collapse.
 */
public record QuestionDraft(
        String text,
        QuestionType type,
        String correctAnswer,
        List<String> incorrectAnswers,
        AnswerKey answerKey,
        Set<String> tags,
        String objective,
        Map<String, String> explanations
) {
    public QuestionDraft {
        if (type == null) {
            type = answerKey == null ? QuestionType.MULTIPLE_CHOICE : answerKey.type();
        }
        incorrectAnswers = incorrectAnswers == null
                ? List.of()
                : incorrectAnswers.stream().filter(Objects::nonNull).toList();
        tags = copyTags(tags);
        Map<String, String> copy = new LinkedHashMap<>();
        if (explanations != null) {
            explanations.forEach((answer, why) -> {
                if (answer != null && why != null) copy.put(answer, why);
            });
        }
        explanations = Collections.unmodifiableMap(copy);
    }

    public QuestionDraft(String text,
                         String correctAnswer,
                         List<String> incorrectAnswers,
                         Set<String> tags,
                         String objective,
                         Map<String, String> explanations) {
        this(text, QuestionType.MULTIPLE_CHOICE, correctAnswer, incorrectAnswers, null, tags, objective, explanations);
    }

    public static QuestionDraft of(String text, String correctAnswer, List<String> incorrectAnswers, String... tags) {
        return new QuestionDraft(text, correctAnswer, incorrectAnswers, tagSet(tags), null, null);
    }

    public static QuestionDraft trueFalse(String text, boolean answer, String explanation, String... tags) {
        String right = answer ? "True" : "False";
        String wrong = answer ? "False" : "True";
        Map<String, String> explanations = new LinkedHashMap<>();
        if (explanation != null) {
            explanations.put(right, explanation);
            explanations.put(wrong, explanation);
        }
        return new QuestionDraft(text, QuestionType.TRUE_FALSE, right, List.of(wrong), null,
                tagSet(tags), null, explanations);
    }

    public static QuestionDraft fillBlank(String text, List<String> blanks, boolean caseSensitive, String... tags) {
        return keyed(text, new FillBlankKey(blanks, caseSensitive), tags);
    }

    public static QuestionDraft shortAnswer(String text, List<String> acceptableAnswers, boolean caseSensitive,
                                            String... tags) {
        return keyed(text, new ShortAnswerKey(acceptableAnswers, caseSensitive), tags);
    }

    public static QuestionDraft matching(String text, List<String> leftItems, List<String> rightItems,
                                         Map<Integer, Integer> correctMatches, String... tags) {
        return keyed(text, new MatchingKey(leftItems, rightItems, correctMatches), tags);
    }

    public static QuestionDraft ordering(String text, List<String> items, List<Integer> correctOrder,
                                         String... tags) {
        return keyed(text, new OrderingKey(items, correctOrder), tags);
    }

    public QuestionDraft withObjective(String objective) {
        return new QuestionDraft(text, type, correctAnswer, incorrectAnswers, answerKey, tags, objective, explanations);
    }

    private static QuestionDraft keyed(String text, AnswerKey key, String... tags) {
        return new QuestionDraft(text, key.type(), null, null, key, tagSet(tags), null, null);
    }

    private static Set<String> tagSet(String... tags) {
        return tags == null ? Set.of() : copyTags(Arrays.asList(tags));
    }

    private static Set<String> copyTags(Collection<String> tags) {
        if (tags == null) return Set.of();
        Set<String> copy = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) copy.add(tag);
        }
        return Collections.unmodifiableSet(copy);
    }
}
