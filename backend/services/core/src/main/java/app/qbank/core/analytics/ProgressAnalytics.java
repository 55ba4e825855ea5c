package app.qbank.core.analytics;

import app.qbank.core.bank.Question;
import app.qbank.core.bank.QuestionBank;
import app.qbank.core.bank.StudySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Read-only insights over a bank's finished sessions and per-question answer history.
 */
@Service
public class ProgressAnalytics {
    private static final Logger log = LoggerFactory.getLogger(ProgressAnalytics.class);

    private static final int MIN_SESSIONS_PER_WEEK = 3;
    private static final int INTENSIVE_SESSIONS_PER_WEEK = 7;
    private static final double INFREQUENT_PRACTICE_FACTOR = 1.5;
    private static final double INTENSIVE_PRACTICE_FACTOR = 0.8;

    private final AnalyticsProps props;

    public ProgressAnalytics(AnalyticsProps props) {
        this.props = props;
    }

    /**
     * Compares the accuracy of the latest {@code trendWindow} sessions with the window before them.
     */
    public PerformanceTrend trend(QuestionBank bank) {
        List<StudySession> sessions = bank.getSessions().stream()
                .sorted(Comparator.comparing(StudySession::getStartedAt))
                .toList();
        int total = sessions.size();
        if (total < 2) {
            return PerformanceTrend.insufficient(total);
        }

        int window = props.trendWindow();
        List<StudySession> recent = sessions.subList(Math.max(0, total - window), total);
        List<StudySession> earlier = total >= 2 * window
                ? sessions.subList(total - 2 * window, total - window)
                : sessions.subList(0, Math.max(0, total - window));

        double recentAccuracy = mean(recent, StudySession::accuracy);
        double change = earlier.isEmpty() ? 0.0 : recentAccuracy - mean(earlier, StudySession::accuracy);

        TrendDirection direction;
        if (change > props.trendThreshold()) {
            direction = TrendDirection.IMPROVING;
        } else if (change < -props.trendThreshold()) {
            direction = TrendDirection.DECLINING;
        } else {
            direction = TrendDirection.STABLE;
        }

        log.debug("Bank '{}' trend {} ({} points over {} sessions)", bank.getName(), direction, change, total);
        return new PerformanceTrend(direction, change, recentAccuracy,
                mean(recent, StudySession::averageResponseSeconds), total);
    }

    public StudyPatterns patterns(QuestionBank bank, ZoneId zone) {
        List<StudySession> sessions = bank.getSessions();
        if (sessions.isEmpty()) {
            return new StudyPatterns(0, 0.0, 0.0, null);
        }

        int days = (int) sessions.stream()
                .map(s -> LocalDate.ofInstant(s.getStartedAt(), zone))
                .distinct()
                .count();
        double totalMinutes = sessions.stream().mapToDouble(ProgressAnalytics::minutes).sum();

        Map<Integer, Long> byHour = sessions.stream()
                .collect(Collectors.groupingBy(s -> s.getStartedAt().atZone(zone).getHour(),
                        TreeMap::new, Collectors.counting()));
        // earliest hour wins a tie
        Integer preferredHour = byHour.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);

        return new StudyPatterns(days, totalMinutes, totalMinutes / sessions.size(), preferredHour);
    }

    /**
     * Answered questions, slowest average response first.
     */
    public List<Question> slowestQuestions(QuestionBank bank, int limit) {
        return bank.all().stream()
                .filter(q -> q.timesAnswered() > 0)
                .sorted(Comparator.comparingDouble(Question::averageResponseSeconds).reversed())
                .limit(limit)
                .toList();
    }

    /**
     * Linear estimate of the weeks needed to go from {@code currentAccuracy} to {@code targetAccuracy}
     * (both percentages). Fewer than 3 sessions a week slows progress, more than 7 speeds it up.
     */
    public MasteryForecast predictMastery(double currentAccuracy, double targetAccuracy, int sessionsPerWeek) {
        requirePercentage(currentAccuracy, "currentAccuracy");
        requirePercentage(targetAccuracy, "targetAccuracy");
        if (sessionsPerWeek < 0) {
            throw new IllegalArgumentException("sessionsPerWeek must not be negative, got " + sessionsPerWeek);
        }
        int recommended = Math.max(MIN_SESSIONS_PER_WEEK, sessionsPerWeek);
        if (currentAccuracy >= targetAccuracy) {
            return new MasteryForecast(true, 0, currentAccuracy, targetAccuracy, recommended);
        }

        double weeks = (targetAccuracy - currentAccuracy) / props.weeklyImprovement();
        if (sessionsPerWeek < MIN_SESSIONS_PER_WEEK) {
            weeks *= INFREQUENT_PRACTICE_FACTOR;
        } else if (sessionsPerWeek > INTENSIVE_SESSIONS_PER_WEEK) {
            weeks *= INTENSIVE_PRACTICE_FACTOR;
        }
        return new MasteryForecast(false, (int) Math.ceil(weeks), currentAccuracy, targetAccuracy, recommended);
    }

    /**
     * Forgetting curve {@code e^(-t/S)} with stability {@code S = accuracy / 10}, floored at
     * {@code minRetention}. On the day of study it is the accuracy itself.
     */
    public double retentionProbability(long daysSinceLastStudy, double accuracy) {
        requirePercentage(accuracy, "accuracy");
        if (daysSinceLastStudy <= 0) {
            return accuracy / 100.0;
        }
        double stability = accuracy / 10.0;
        return Math.max(props.minRetention(), Math.exp(-daysSinceLastStudy / stability));
    }

    /**
     * 0 for a question that was never answered.
     */
    public double retentionProbability(Question question, Instant now) {
        if (question.timesAnswered() == 0 || question.getSchedule().lastReviewed() == null) {
            return 0.0;
        }
        long days = Duration.between(question.getSchedule().lastReviewed(), now).toDays();
        return retentionProbability(days, question.accuracy());
    }

    private static double minutes(StudySession session) {
        Duration duration = session.duration();
        return duration == null ? 0.0 : duration.toSeconds() / 60.0;
    }

    private static double mean(List<StudySession> sessions, ToDoubleFunction<StudySession> metric) {
        return sessions.stream().mapToDouble(metric).average().orElse(0.0);
    }

    private static void requirePercentage(double value, String name) {
        if (!Double.isFinite(value) || value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " must be a percentage in [0, 100], got " + value);
        }
    }
}
