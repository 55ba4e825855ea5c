package app.qbank.core.bank;

import java.time.Instant;
import java.util.UUID;

public record SessionAnswer(
        UUID questionId,
        AnswerResult result,
        double responseTimeSeconds,
        Instant answeredAt
) {
}
