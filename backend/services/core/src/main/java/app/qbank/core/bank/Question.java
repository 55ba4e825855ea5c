package app.qbank.core.bank;

import app.qbank.core.review.SchedulingState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public class Question {

    private UUID id;
    private String text;
    private QuestionType type = QuestionType.MULTIPLE_CHOICE;
    private List<AnswerOption> answers = new ArrayList<>();
    private AnswerKey answerKey;
    private String objective;
    private Set<String> tags = new LinkedHashSet<>();
    private Instant createdAt;
    private double rating;
    private SchedulingState schedule;

    public Question() {
    }

    public Question(UUID id,
                    String text,
                    List<AnswerOption> answers,
                    String objective,
                    Instant createdAt,
                    double rating,
                    SchedulingState schedule) {
        this.id = id;
        this.text = text;
        this.answers = new ArrayList<>(answers);
        this.objective = objective;
        this.createdAt = createdAt;
        this.rating = rating;
        this.schedule = schedule;
    }

    public Question(UUID id,
                    String text,
                    QuestionType type,
                    List<AnswerOption> answers,
                    AnswerKey answerKey,
                    String objective,
                    Instant createdAt,
                    double rating,
                    SchedulingState schedule) {
        this(id, text, answers, objective, createdAt, rating, schedule);
        this.type = type;
        this.answerKey = answerKey;
    }

    public Optional<AnswerOption> correctAnswer() {
        return answers.stream().filter(AnswerOption::correct).findFirst();
    }

    public List<AnswerOption> incorrectAnswers() {
        return answers.stream().filter(a -> !a.correct()).toList();
    }

    public Optional<AnswerOption> answer(UUID answerId) {
        return answers.stream().filter(a -> a.id().equals(answerId)).findFirst();
    }

    /**
     * Percentage of correct answers, 0 when never answered.
     */
    public double accuracy() {
        return schedule == null ? 0.0 : schedule.accuracy() * 100.0;
    }

    public int timesAnswered() {
        return schedule == null ? 0 : schedule.timesAnswered();
    }

    public double averageResponseSeconds() {
        if (timesAnswered() == 0) return 0.0;
        return schedule.totalResponseSeconds() / schedule.timesAnswered();
    }

    public void addTag(String tag) {
        tags.add(normalizeTag(tag));
    }

    public void removeTag(String tag) {
        tags.remove(normalizeTag(tag));
    }

    public boolean hasTag(String tag) {
        return tags.contains(normalizeTag(tag));
    }

    static String normalizeTag(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT);
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public QuestionType getType() {
        return type;
    }

    public void setType(QuestionType type) {
        this.type = type == null ? QuestionType.MULTIPLE_CHOICE : type;
    }

    public AnswerKey getAnswerKey() {
        return answerKey;
    }

    public void setAnswerKey(AnswerKey answerKey) {
        this.answerKey = answerKey;
    }

    public List<AnswerOption> getAnswers() {
        return answers;
    }

    public void setAnswers(List<AnswerOption> answers) {
        this.answers = answers == null ? new ArrayList<>() : new ArrayList<>(answers);
    }

    public String getObjective() {
        return objective;
    }

    public void setObjective(String objective) {
        this.objective = objective;
    }

    public Set<String> getTags() {
        return tags;
    }

    public void setTags(Set<String> tags) {
        this.tags = new LinkedHashSet<>();
        if (tags != null) tags.forEach(this::addTag);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public double getRating() {
        return rating;
    }

    public void setRating(double rating) {
        this.rating = rating;
    }

    public SchedulingState getSchedule() {
        return schedule;
    }

    public void setSchedule(SchedulingState schedule) {
        this.schedule = schedule;
    }
}
