package app.qbank.core.bank;

import java.time.Instant;
import java.util.UUID;

public record AnswerFeedback(
        UUID questionId,
        boolean correct,
        AnswerOption correctAnswer,
        AnswerOption selectedAnswer,
        String explanation,
        double userRating,
        double questionRating,
        Instant nextReview,
        double accuracy
) {
}
