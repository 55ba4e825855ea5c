package app.qbank.core.bank;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class StudySession {

    private UUID id;
    private List<UUID> questionIds = new ArrayList<>();
    private List<SessionAnswer> answers = new ArrayList<>();
    private Instant startedAt;
    private Instant endedAt;

    public StudySession() {
    }

    public StudySession(UUID id, List<UUID> questionIds, Instant startedAt) {
        this.id = id;
        this.questionIds = new ArrayList<>(questionIds);
        this.startedAt = startedAt;
    }

    public Duration duration() {
        if (endedAt == null) return null;
        return Duration.between(startedAt, endedAt);
    }

    public int questionsCount() {
        return questionIds.size();
    }

    public long correctCount() {
        return count(AnswerResult.CORRECT);
    }

    public long incorrectCount() {
        return count(AnswerResult.INCORRECT);
    }

    public long skippedCount() {
        return count(AnswerResult.SKIPPED);
    }

    /**
     * Percentage of correct answers among answered (not skipped) items.
     */
    public double accuracy() {
        long answered = correctCount() + incorrectCount();
        if (answered == 0) return 0.0;
        return correctCount() * 100.0 / answered;
    }

    /**
     * Mean response time of answered items; skips are not timed.
     */
    public double averageResponseSeconds() {
        return answers.stream()
                .filter(a -> a.result() != AnswerResult.SKIPPED)
                .mapToDouble(SessionAnswer::responseTimeSeconds)
                .average()
                .orElse(0.0);
    }

    void record(SessionAnswer answer) {
        if (!questionIds.contains(answer.questionId())) {
            questionIds.add(answer.questionId());
        }
        answers.add(answer);
    }

    private long count(AnswerResult result) {
        return answers.stream().filter(a -> a.result() == result).count();
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public List<UUID> getQuestionIds() {
        return questionIds;
    }

    public void setQuestionIds(List<UUID> questionIds) {
        this.questionIds = questionIds == null ? new ArrayList<>() : new ArrayList<>(questionIds);
    }

    public List<SessionAnswer> getAnswers() {
        return answers;
    }

    public void setAnswers(List<SessionAnswer> answers) {
        this.answers = answers == null ? new ArrayList<>() : new ArrayList<>(answers);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(Instant endedAt) {
        this.endedAt = endedAt;
    }
}
