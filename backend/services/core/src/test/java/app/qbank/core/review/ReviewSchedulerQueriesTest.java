package app.qbank.core.review;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReviewSchedulerQueriesTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final ReviewScheduler scheduler = new ReviewScheduler(SchedulerSettings.defaults());

    private static SchedulingState dueAt(Instant next, double ef) {
        return new SchedulingState(3.0, ef, next, next.minus(Duration.ofDays(3)), 2, 1, 1, 0.0);
    }

    @Test
    void isDue_unseenStateIsAlwaysDue() {
        assertThat(scheduler.isDue(scheduler.initialState(), NOW)).isTrue();
    }

    @Test
    void isDue_skippedUnseenStateWaitsForItsNextReview() {
        SchedulingState skipped = scheduler.postpone(scheduler.initialState(), NOW);

        assertThat(skipped.unseen()).isFalse();
        assertThat(skipped.timesAnswered()).isZero();
        assertThat(scheduler.isDue(skipped, NOW.plus(Duration.ofHours(1)))).isFalse();
        assertThat(scheduler.isDue(skipped, NOW.plus(Duration.ofDays(1)))).isTrue();
    }

    @Test
    void isDue_comparesNextReviewInclusively() {
        assertThat(scheduler.isDue(dueAt(NOW, 2.5), NOW)).isTrue();
        assertThat(scheduler.isDue(dueAt(NOW.minusSeconds(1), 2.5), NOW)).isTrue();
        assertThat(scheduler.isDue(dueAt(NOW.plusSeconds(1), 2.5), NOW)).isFalse();
    }

    @Test
    void forecast_returnsOneEntryPerDayEvenWhenEmpty() {
        Map<LocalDate, Integer> forecast = scheduler.forecast(List.of(), NOW, 7);

        assertThat(forecast).hasSize(7);
        assertThat(forecast.values()).containsOnly(0);
        assertThat(forecast.keySet()).first().isEqualTo(LocalDate.of(2024, 3, 10));
        assertThat(new ArrayList<>(forecast.keySet()).get(6)).isEqualTo(LocalDate.of(2024, 3, 16));
    }

    @Test
    void forecast_countsReviewsByCalendarDay() {
        List<SchedulingState> states = List.of(
                dueAt(Instant.parse("2024-03-10T23:00:00Z"), 2.5),
                dueAt(Instant.parse("2024-03-12T01:00:00Z"), 2.5),
                dueAt(Instant.parse("2024-03-12T22:00:00Z"), 2.5),
                dueAt(Instant.parse("2024-04-30T10:00:00Z"), 2.5),
                scheduler.initialState()
        );

        Map<LocalDate, Integer> forecast = scheduler.forecast(states, NOW, 3);

        assertThat(forecast).containsExactly(
                Map.entry(LocalDate.of(2024, 3, 10), 1),
                Map.entry(LocalDate.of(2024, 3, 11), 0),
                Map.entry(LocalDate.of(2024, 3, 12), 2)
        );
    }

    @Test
    void forecast_usesGivenZoneForDayBoundaries() {
        List<SchedulingState> states = List.of(dueAt(Instant.parse("2024-03-10T23:00:00Z"), 2.5));

        Map<LocalDate, Integer> forecast = scheduler.forecast(states, NOW, 2, ZoneId.of("Asia/Tokyo"));

        assertThat(forecast).containsEntry(LocalDate.of(2024, 3, 11), 1);
    }

    @Test
    void forecast_rejectsNegativeHorizon() {
        assertThatThrownBy(() -> scheduler.forecast(List.of(), NOW, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duePriority_putsMostOverdueFirstThenHigherEase() {
        SchedulingState weekLate = dueAt(NOW.minus(Duration.ofDays(7)), 1.9);
        SchedulingState dayLate = dueAt(NOW.minus(Duration.ofDays(1)), 2.8);
        SchedulingState unseen = scheduler.initialState();
        SchedulingState dueNowEasy = dueAt(NOW, 2.9);

        List<SchedulingState> sorted = new ArrayList<>(List.of(unseen, dayLate, dueNowEasy, weekLate));
        sorted.sort(scheduler.duePriority(NOW));

        assertThat(sorted).containsExactly(weekLate, dayLate, dueNowEasy, unseen);
    }

    @Test
    void retentionEstimate_combinesAccuracyAndEase() {
        SchedulingState state = new SchedulingState(5.0, 3.0, NOW, NOW, 4, 3, 2, 0.0);

        assertThat(scheduler.retentionEstimate(scheduler.initialState())).isEqualTo(0.5);
        assertThat(scheduler.retentionEstimate(state)).isCloseTo(0.75 * 0.7 + 1.0 * 0.3, within(1e-9));
    }

    @Test
    void suggestSessionSize_isBoundedByTimeAndDueCount() {
        assertThat(scheduler.suggestSessionSize(100, 30, 45.0)).isEqualTo(40);
        assertThat(scheduler.suggestSessionSize(12, 30, 45.0)).isEqualTo(12);
        assertThat(scheduler.suggestSessionSize(12, 0, 45.0)).isZero();
        assertThatThrownBy(() -> scheduler.suggestSessionSize(12, 30, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void spreadLoad_defersOverflowToNextDayKeepingTimeOfDay() {
        Instant morning = Instant.parse("2024-03-11T09:00:00Z");
        List<SchedulingState> states = List.of(
                dueAt(morning, 2.5),
                dueAt(morning.plusSeconds(60), 2.5),
                dueAt(morning.plusSeconds(120), 2.5),
                scheduler.initialState()
        );

        List<SchedulingState> out = scheduler.spreadLoad(states, 2, 7, ZoneId.of("UTC"));

        assertThat(out).hasSize(4);
        assertThat(out.get(0)).isSameAs(states.get(0));
        assertThat(out.get(1)).isSameAs(states.get(1));
        assertThat(out.get(2).nextReview()).isEqualTo(morning.plusSeconds(120).plus(Duration.ofDays(1)));
        assertThat(out.get(2).intervalDays()).isEqualTo(states.get(2).intervalDays());
        assertThat(out.get(3)).isSameAs(states.get(3));
    }

    @Test
    void spreadLoad_leavesStateWhenDeferralWindowIsFull() {
        Instant day = Instant.parse("2024-03-11T09:00:00Z");
        List<SchedulingState> states = List.of(
                dueAt(day, 2.5),
                dueAt(day.plusSeconds(30), 2.5),
                dueAt(day.plusSeconds(60), 2.5)
        );

        List<SchedulingState> out = scheduler.spreadLoad(states, 1, 2, ZoneId.of("UTC"));

        assertThat(out.get(0)).isSameAs(states.get(0));
        assertThat(out.get(1).nextReview()).isEqualTo(day.plusSeconds(30).plus(Duration.ofDays(1)));
        assertThat(out.get(2)).isSameAs(states.get(2));
    }
}
