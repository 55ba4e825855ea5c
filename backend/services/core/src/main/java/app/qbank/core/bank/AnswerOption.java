package app.qbank.core.bank;

import java.util.UUID;

public record AnswerOption(
        UUID id,
        String text,
        boolean correct,
        String explanation
) {
    public static AnswerOption of(String text, boolean correct, String explanation) {
        return new AnswerOption(UUID.randomUUID(), text, correct, explanation);
    }
}
