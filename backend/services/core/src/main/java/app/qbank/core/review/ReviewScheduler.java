package app.qbank.core.review;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * SM-2 style scheduler. Stateless apart from its settings, so one instance serves every question.
 * All timestamps come from the caller.
 */
public class ReviewScheduler {

    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double SKIP_INTERVAL_FACTOR = 0.5;
    private static final double UNANSWERED_RETENTION = 0.5;
    private static final double RETENTION_ACCURACY_WEIGHT = 0.7;
    private static final double RETENTION_EASE_WEIGHT = 0.3;

    private final SchedulerSettings settings;

    public ReviewScheduler(SchedulerSettings settings) {
        this.settings = settings;
    }

    public SchedulerSettings settings() {
        return settings;
    }

    public SchedulingState initialState() {
        return SchedulingState.seed(settings.initialEaseFactor());
    }

    /**
     * Computes the state that follows one answered attempt. Ease is updated first, and the new ease
     * scales the interval of the same step.
     */
    public SchedulingState advance(SchedulingState state, AttemptOutcome outcome, Instant now) {
        requireValid(state);
        double responseSeconds = outcome.responseTimeSeconds();
        if (!Double.isFinite(responseSeconds) || responseSeconds < 0) {
            throw new InvalidSchedulingStateException("responseTimeSeconds must be a non-negative number, got " + responseSeconds);
        }

        double ef;
        double interval;
        int repetitions;

        if (outcome.correct()) {
            ef = settings.clampEase(state.easeFactor() + settings.easeBonus());
            interval = state.intervalDays() == 0.0
                    ? settings.minIntervalDays()
                    : settings.clampInterval(state.intervalDays() * ef);
            repetitions = state.repetitions() + 1;
        } else {
            ef = settings.clampEase(state.easeFactor() - settings.easePenalty());
            interval = settings.minIntervalDays();
            repetitions = 0;
        }

        return new SchedulingState(
                interval,
                ef,
                plusDays(now, interval),
                now,
                state.timesAnswered() + 1,
                state.timesCorrect() + (outcome.correct() ? 1 : 0),
                repetitions,
                state.totalResponseSeconds() + responseSeconds
        );
    }

    /**
     * Reschedules a skipped question at half its interval. Ease and answer counters do not move.
     */
    public SchedulingState postpone(SchedulingState state, Instant now) {
        requireValid(state);
        double interval = Math.max(settings.minIntervalDays(),
                Math.min(settings.maxIntervalDays(), state.intervalDays() * SKIP_INTERVAL_FACTOR));

        return new SchedulingState(
                interval,
                state.easeFactor(),
                plusDays(now, interval),
                now,
                state.timesAnswered(),
                state.timesCorrect(),
                state.repetitions(),
                state.totalResponseSeconds()
        );
    }

    public boolean isDue(SchedulingState state, Instant now) {
        return state.unseen() || !state.nextReview().isAfter(now);
    }

    public Map<LocalDate, Integer> forecast(Collection<SchedulingState> states, Instant now, int horizonDays) {
        return forecast(states, now, horizonDays, DEFAULT_ZONE);
    }

    /**
     * Counts reviews per calendar day for the next {@code horizonDays} days, today included.
     * Days without reviews are present with a zero count.
     */
    public Map<LocalDate, Integer> forecast(Collection<SchedulingState> states,
                                            Instant now,
                                            int horizonDays,
                                            ZoneId zone) {
        if (horizonDays < 0) {
            throw new IllegalArgumentException("horizonDays must not be negative, got " + horizonDays);
        }
        LocalDate today = LocalDate.ofInstant(now, zone);

        Map<LocalDate, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < horizonDays; i++) {
            out.put(today.plusDays(i), 0);
        }
        for (SchedulingState s : states) {
            if (s.nextReview() == null) continue;
            LocalDate day = LocalDate.ofInstant(s.nextReview(), zone);
            out.computeIfPresent(day, (d, count) -> count + 1);
        }
        return out;
    }

    /**
     * Most overdue first; unseen states count as due right now. Ties go to the higher ease factor.
     */
    public Comparator<SchedulingState> duePriority(Instant now) {
        Comparator<SchedulingState> byOverdue = Comparator.comparingDouble(s -> -overdueHours(s, now));
        return byOverdue.thenComparing(Comparator.comparingDouble(SchedulingState::easeFactor).reversed());
    }

    public double retentionEstimate(SchedulingState state) {
        if (state.timesAnswered() == 0) {
            return UNANSWERED_RETENTION;
        }
        double span = settings.maxEaseFactor() - settings.minEaseFactor();
        double easeContribution = span == 0.0 ? 0.0 : (state.easeFactor() - settings.minEaseFactor()) / span;

        double retention = state.accuracy() * RETENTION_ACCURACY_WEIGHT + easeContribution * RETENTION_EASE_WEIGHT;
        return Math.max(0.0, Math.min(1.0, retention));
    }

    public int suggestSessionSize(int dueCount, int targetMinutes, double avgSecondsPerQuestion) {
        if (!(avgSecondsPerQuestion > 0)) {
            throw new IllegalArgumentException("avgSecondsPerQuestion must be positive, got " + avgSecondsPerQuestion);
        }
        int fits = (int) Math.floor(Math.max(0, targetMinutes) * 60 / avgSecondsPerQuestion);
        return Math.max(0, Math.min(fits, dueCount));
    }

    /**
     * Caps the number of reviews per calendar day by pushing overflow to the next day with room,
     * at most {@code maxDeferralDays - 1} days later. Time of day is kept. The result is index-aligned
     * with {@code states}.
     */
    public List<SchedulingState> spreadLoad(List<SchedulingState> states,
                                            int maxPerDay,
                                            int maxDeferralDays,
                                            ZoneId zone) {
        if (maxPerDay <= 0 || maxDeferralDays <= 0) {
            throw new IllegalArgumentException("maxPerDay and maxDeferralDays must be positive");
        }

        List<SchedulingState> out = new ArrayList<>(states);
        int[] order = IntStream.range(0, states.size())
                .filter(i -> states.get(i).nextReview() != null)
                .boxed()
                .sorted(Comparator.comparing(i -> states.get(i).nextReview()))
                .mapToInt(Integer::intValue)
                .toArray();

        Map<LocalDate, Integer> placed = new HashMap<>();
        for (int i : order) {
            SchedulingState s = states.get(i);
            ZonedDateTime due = s.nextReview().atZone(zone);
            for (int offset = 0; offset < maxDeferralDays; offset++) {
                LocalDate day = due.toLocalDate().plusDays(offset);
                int count = placed.getOrDefault(day, 0);
                if (count < maxPerDay) {
                    placed.put(day, count + 1);
                    if (offset > 0) {
                        out.set(i, s.withNextReview(due.plusDays(offset).toInstant()));
                    }
                    break;
                }
            }
        }
        return out;
    }

    private void requireValid(SchedulingState state) {
        if (state == null) {
            throw new InvalidSchedulingStateException("state is required");
        }
        if (state.timesAnswered() < 0 || state.timesCorrect() < 0 || state.repetitions() < 0) {
            throw new InvalidSchedulingStateException("counters must not be negative: " + state);
        }
        if (state.timesCorrect() > state.timesAnswered()) {
            throw new InvalidSchedulingStateException("timesCorrect exceeds timesAnswered: " + state);
        }
        if (!Double.isFinite(state.intervalDays()) || state.intervalDays() < 0) {
            throw new InvalidSchedulingStateException("intervalDays must be a non-negative number: " + state);
        }
        if (!Double.isFinite(state.easeFactor()) || state.easeFactor() <= 0) {
            throw new InvalidSchedulingStateException("easeFactor must be a positive number: " + state);
        }
        if (!Double.isFinite(state.totalResponseSeconds()) || state.totalResponseSeconds() < 0) {
            throw new InvalidSchedulingStateException("totalResponseSeconds must be a non-negative number: " + state);
        }
    }

    private static Instant plusDays(Instant from, double days) {
        return from.plus(Duration.ofSeconds(Math.round(days * SECONDS_PER_DAY)));
    }

    private static double overdueHours(SchedulingState s, Instant now) {
        if (s.nextReview() == null) return 0.0;
        return Duration.between(s.nextReview(), now).toSeconds() / 3600.0;
    }
}
