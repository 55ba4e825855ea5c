package app.qbank.core.bank;

import app.qbank.core.rating.RatingEngine;
import app.qbank.core.rating.RatingRange;
import app.qbank.core.rating.RatingUpdate;
import app.qbank.core.rating.SkillLevel;
import app.qbank.core.review.AttemptOutcome;
import app.qbank.core.review.ReviewScheduler;
import app.qbank.core.review.SchedulingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

@Service
public class StudyService {
    private static final Logger log = LoggerFactory.getLogger(StudyService.class);

    private static final int TOP_TAGS = 10;

    private final ReviewScheduler scheduler;
    private final RatingEngine ratingEngine;
    private final StudyProps props;

    public StudyService(ReviewScheduler scheduler, RatingEngine ratingEngine, StudyProps props) {
        this.scheduler = scheduler;
        this.ratingEngine = ratingEngine;
        this.props = props;
    }

    public QuestionBank newBank(String name, Instant now) {
        return new QuestionBank(name, now, ratingEngine.initialRating());
    }

    public Question addQuestion(QuestionBank bank, QuestionDraft draft, Instant now) {
        if (draft.text() == null || draft.text().isBlank()) {
            throw new IllegalArgumentException("Question text is required");
        }

        List<AnswerOption> answers = new ArrayList<>();
        AnswerKey key = null;
        if (draft.type().isChoice()) {
            if (draft.correctAnswer() == null || draft.correctAnswer().isBlank()) {
                throw new IllegalArgumentException("Correct answer is required");
            }
            answers.add(AnswerOption.of(draft.correctAnswer(), true, draft.explanations().get(draft.correctAnswer())));
            for (String wrong : draft.incorrectAnswers()) {
                answers.add(AnswerOption.of(wrong, false, draft.explanations().get(wrong)));
            }
        } else {
            key = draft.answerKey();
            if (key == null || key.type() != draft.type()) {
                throw new IllegalArgumentException("A " + draft.type() + " question needs a matching answer key");
            }
        }

        Question question = new Question(
                UUID.randomUUID(),
                draft.text(),
                draft.type(),
                answers,
                key,
                draft.objective(),
                now,
                ratingEngine.initialRating(),
                scheduler.initialState()
        );
        question.setTags(draft.tags());
        bank.add(question);
        return question;
    }

    public List<Question> addQuestions(QuestionBank bank, List<QuestionDraft> drafts, Instant now) {
        return drafts.stream().map(d -> addQuestion(bank, d, now)).toList();
    }

    public List<Question> startSession(QuestionBank bank, SessionFilter filter, Instant now) {
        if (bank.getActiveSession().isPresent()) {
            throw new IllegalStateException("A study session is already in progress");
        }

        Stream<Question> due = dueQuestions(bank, now).stream();
        if (!filter.tags().isEmpty()) {
            due = due.filter(q -> filter.tags().stream().anyMatch(q::hasTag));
        }
        RatingRange range = filter.ratingRange();
        if (range != null) {
            due = due.filter(q -> range.contains(q.getRating()));
        }

        List<Question> picked = ratingEngine.rankForTarget(
                bank.getUserRating(), due.toList(), Question::getRating, props.targetSuccessRate());
        if (filter.maxQuestions() != null && picked.size() > filter.maxQuestions()) {
            picked = picked.subList(0, Math.max(0, filter.maxQuestions()));
        }

        StudySession session = new StudySession(
                UUID.randomUUID(),
                picked.stream().map(Question::getId).toList(),
                now
        );
        bank.setActiveSession(session);
        log.info("Session {} started with {} question(s)", session.getId(), picked.size());
        return List.copyOf(picked);
    }

    public List<Question> startRecommendedSession(QuestionBank bank, Integer maxQuestions, Instant now) {
        RatingRange range = ratingEngine.recommendedRatingRange(bank.getUserRating(), props.recommendedSpread());
        return startSession(bank, new SessionFilter(maxQuestions, null, range), now);
    }

    public AnswerFeedback answer(QuestionBank bank,
                                 UUID questionId,
                                 UUID answerId,
                                 double responseSeconds,
                                 Instant now) {
        return submit(bank, questionId, Submission.choice(answerId), responseSeconds, now);
    }

    /**
     * Grades a submission of any question type, then moves the schedule and both ratings.
     */
    public AnswerFeedback submit(QuestionBank bank,
                                 UUID questionId,
                                 Submission submission,
                                 double responseSeconds,
                                 Instant now) {
        StudySession session = requireActive(bank);
        Question question = bank.require(questionId);

        AnswerOption selected = null;
        boolean correct;
        if (question.getAnswerKey() == null) {
            UUID answerId = submission.answerId();
            selected = question.answer(answerId)
                    .orElseThrow(() -> new IllegalArgumentException("Answer not found: " + answerId));
            correct = selected.correct();
        } else {
            correct = question.getAnswerKey().accepts(submission);
        }
        if (!Double.isFinite(responseSeconds) || responseSeconds < 0) {
            throw new IllegalArgumentException("Response time must be a non-negative number, got " + responseSeconds);
        }

        AttemptOutcome outcome = new AttemptOutcome(correct, responseSeconds);
        SchedulingState before = question.getSchedule();
        SchedulingState after = scheduler.advance(before, outcome, now);
        RatingUpdate ratings = ratingEngine.update(bank.getUserRating(), question.getRating(), outcome.correct());

        question.setSchedule(after);
        question.setRating(ratings.questionRating());
        bank.setUserRating(ratings.userRating());

        AnswerResult result = outcome.correct() ? AnswerResult.CORRECT : AnswerResult.INCORRECT;
        session.record(new SessionAnswer(questionId, result, responseSeconds, now));

        log.debug("{} question {} {}: interval {} -> {} days, ease {} -> {}, rating {} / user {}",
                question.getType(), questionId, result, before.intervalDays(), after.intervalDays(),
                before.easeFactor(), after.easeFactor(), ratings.questionRating(), ratings.userRating());

        return new AnswerFeedback(
                questionId,
                outcome.correct(),
                question.correctAnswer().orElse(null),
                selected,
                selected == null ? null : selected.explanation(),
                ratings.userRating(),
                ratings.questionRating(),
                after.nextReview(),
                question.accuracy()
        );
    }

    public SchedulingState skip(QuestionBank bank, UUID questionId, Instant now) {
        StudySession session = requireActive(bank);
        Question question = bank.require(questionId);

        SchedulingState next = scheduler.postpone(question.getSchedule(), now);
        question.setSchedule(next);
        session.record(new SessionAnswer(questionId, AnswerResult.SKIPPED, 0.0, now));
        return next;
    }

    public StudySession endSession(QuestionBank bank, Instant now) {
        StudySession session = requireActive(bank);
        session.setEndedAt(now);
        bank.getSessions().add(session);
        bank.setActiveSession(null);
        log.info("Session {} ended: {} correct, {} incorrect, {} skipped",
                session.getId(), session.correctCount(), session.incorrectCount(), session.skippedCount());
        return session;
    }

    public List<Question> dueQuestions(QuestionBank bank, Instant now) {
        Comparator<SchedulingState> priority = scheduler.duePriority(now);
        return bank.all().stream()
                .filter(q -> scheduler.isDue(q.getSchedule(), now))
                .sorted(Comparator.comparing(Question::getSchedule, priority))
                .toList();
    }

    public Map<LocalDate, Integer> forecast(QuestionBank bank, Instant now) {
        return forecast(bank, now, props.forecastDays());
    }

    public Map<LocalDate, Integer> forecast(QuestionBank bank, Instant now, int days) {
        List<SchedulingState> states = bank.all().stream().map(Question::getSchedule).toList();
        return scheduler.forecast(states, now, days, props.zone());
    }

    public int suggestSessionSize(QuestionBank bank, Instant now) {
        return scheduler.suggestSessionSize(
                dueQuestions(bank, now).size(), props.targetSessionMinutes(), props.avgSecondsPerQuestion());
    }

    public List<Question> difficultQuestions(QuestionBank bank, int limit) {
        return bank.all().stream()
                .filter(q -> q.timesAnswered() > 0)
                .sorted(Comparator.comparingDouble(Question::accuracy)
                        .thenComparing(Comparator.comparingDouble(Question::getRating).reversed()))
                .limit(limit)
                .toList();
    }

    public BankStatistics statistics(QuestionBank bank, Instant now) {
        List<StudySession> sessions = bank.getSessions();
        List<StudySession> recent = sessions.subList(Math.max(0, sessions.size() - props.recentSessions()), sessions.size());
        double recentAccuracy = recent.stream().mapToDouble(StudySession::accuracy).average().orElse(0.0);
        int recentQuestions = recent.stream().mapToInt(StudySession::questionsCount).sum();

        double averageAccuracy = bank.all().stream()
                .filter(q -> q.timesAnswered() > 0)
                .mapToDouble(Question::accuracy)
                .average()
                .orElse(0.0);

        Map<String, Integer> tagCounts = new HashMap<>();
        bank.all().forEach(q -> q.getTags().forEach(t -> tagCounts.merge(t, 1, Integer::sum)));
        List<BankStatistics.TagCount> topTags = tagCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_TAGS)
                .map(e -> new BankStatistics.TagCount(e.getKey(), e.getValue()))
                .toList();

        return new BankStatistics(
                bank.size(),
                sessions.size(),
                bank.getUserRating(),
                SkillLevel.of(bank.getUserRating()),
                recentAccuracy,
                recentQuestions,
                dueQuestions(bank, now).size(),
                averageAccuracy,
                topTags
        );
    }

    /**
     * Spreads scheduled reviews so no day exceeds the configured cap. Returns how many questions moved.
     */
    public int rebalance(QuestionBank bank) {
        List<Question> questions = new ArrayList<>(bank.all());
        List<SchedulingState> states = questions.stream().map(Question::getSchedule).toList();
        List<SchedulingState> spread = scheduler.spreadLoad(
                states, props.maxDailyReviews(), props.maxDeferralDays(), props.zone());

        int moved = 0;
        for (int i = 0; i < questions.size(); i++) {
            if (spread.get(i) != states.get(i)) {
                questions.get(i).setSchedule(spread.get(i));
                moved++;
            }
        }
        if (moved > 0) {
            log.info("Rebalanced {} review(s) to stay within {} per day", moved, props.maxDailyReviews());
        }
        return moved;
    }

    private static StudySession requireActive(QuestionBank bank) {
        return bank.getActiveSession()
                .orElseThrow(() -> new IllegalStateException("No study session in progress"));
    }
}
