package app.qbank.core.bank;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * All questions, the session history and the single user rating. This is the context object every
 * {@link StudyService} operation works on; the service itself keeps no per-bank state.
 */
public class QuestionBank {

    private String name;
    private Instant createdAt;
    private double userRating;
    private Map<UUID, Question> questions = new LinkedHashMap<>();
    private List<StudySession> sessions = new ArrayList<>();

    @JsonIgnore
    private StudySession activeSession;

    public QuestionBank() {
    }

    public QuestionBank(String name, Instant createdAt, double userRating) {
        this.name = name;
        this.createdAt = createdAt;
        this.userRating = userRating;
    }

    public void add(Question question) {
        questions.put(question.getId(), question);
    }

    public boolean remove(UUID questionId) {
        return questions.remove(questionId) != null;
    }

    public Optional<Question> find(UUID questionId) {
        return Optional.ofNullable(questions.get(questionId));
    }

    public Question require(UUID questionId) {
        return find(questionId)
                .orElseThrow(() -> new IllegalArgumentException("Question not found: " + questionId));
    }

    public Collection<Question> all() {
        return questions.values();
    }

    public int size() {
        return questions.size();
    }

    public List<Question> byTag(String tag) {
        return questions.values().stream().filter(q -> q.hasTag(tag)).toList();
    }

    public Set<String> allTags() {
        Set<String> out = new TreeSet<>();
        questions.values().forEach(q -> out.addAll(q.getTags()));
        return out;
    }

    /**
     * Case-insensitive substring match over question text and answer texts.
     */
    public List<Question> search(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return questions.values().stream()
                .filter(q -> contains(q.getText(), needle)
                        || q.getAnswers().stream().anyMatch(a -> contains(a.text(), needle)))
                .toList();
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public double getUserRating() {
        return userRating;
    }

    public void setUserRating(double userRating) {
        this.userRating = userRating;
    }

    public Map<UUID, Question> getQuestions() {
        return questions;
    }

    public void setQuestions(Map<UUID, Question> questions) {
        this.questions = questions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(questions);
    }

    public List<StudySession> getSessions() {
        return sessions;
    }

    public void setSessions(List<StudySession> sessions) {
        this.sessions = sessions == null ? new ArrayList<>() : new ArrayList<>(sessions);
    }

    @JsonIgnore
    public Optional<StudySession> getActiveSession() {
        return Optional.ofNullable(activeSession);
    }

    @JsonIgnore
    void setActiveSession(StudySession activeSession) {
        this.activeSession = activeSession;
    }
}
