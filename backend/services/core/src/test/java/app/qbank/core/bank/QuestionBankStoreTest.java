package app.qbank.core.bank;

import app.qbank.core.rating.RatingEngine;
import app.qbank.core.rating.RatingSettings;
import app.qbank.core.review.ReviewScheduler;
import app.qbank.core.review.SchedulerSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class QuestionBankStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2024-02-29T17:45:12.345Z");

    private final StudyService service = new StudyService(
            new ReviewScheduler(SchedulerSettings.defaults()),
            new RatingEngine(RatingSettings.defaults()),
            StudyProps.defaults()
    );
    private final QuestionBankStore store = new QuestionBankStore(MAPPER);

    @TempDir
    Path tmp;

    private QuestionBank studiedBank() {
        QuestionBank bank = service.newBank("Export test", NOW);
        Question q = service.addQuestion(bank, new QuestionDraft("Export?", "Yes", List.of("No"),
                Set.of("io"), "persistence", Map.of("Yes", "It round-trips.")), NOW);
        service.addQuestion(bank, QuestionDraft.of("Untouched?", "Yes", List.of("No")), NOW);

        service.startSession(bank, SessionFilter.all(), NOW);
        service.answer(bank, q.getId(), q.correctAnswer().orElseThrow().id(), 7.25, NOW);
        service.endSession(bank, NOW.plusSeconds(30));
        return bank;
    }

    @Test
    void saveThenLoad_preservesSchedulingStateAndRatings() {
        QuestionBank original = studiedBank();
        Path file = tmp.resolve("banks/geo.json");

        store.save(original, file);
        QuestionBank loaded = store.load(file);

        assertThat(loaded.getName()).isEqualTo("Export test");
        assertThat(loaded.getCreatedAt()).isEqualTo(NOW);
        assertThat(loaded.getUserRating()).isEqualTo(original.getUserRating());
        assertThat(loaded.size()).isEqualTo(2);
        for (Question q : original.all()) {
            Question copy = loaded.require(q.getId());
            assertThat(copy.getSchedule()).isEqualTo(q.getSchedule());
            assertThat(copy.getRating()).isEqualTo(q.getRating());
            assertThat(copy.getAnswers()).isEqualTo(q.getAnswers());
            assertThat(copy.getTags()).isEqualTo(q.getTags());
            assertThat(copy.getObjective()).isEqualTo(q.getObjective());
        }
        assertThat(loaded.getSessions()).hasSize(1);
        StudySession session = loaded.getSessions().get(0);
        assertThat(session.correctCount()).isEqualTo(1);
        assertThat(session.getEndedAt()).isEqualTo(NOW.plusSeconds(30));
        assertThat(loaded.getActiveSession()).isEmpty();
    }

    @Test
    void write_usesSnakeCaseFieldsAndIsoInstants() throws Exception {
        QuestionBank bank = studiedBank();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        store.write(bank, out);
        JsonNode root = MAPPER.readTree(out.toByteArray());

        assertThat(root.has("user_rating")).isTrue();
        assertThat(root.has("active_session")).isFalse();
        JsonNode schedule = root.path("questions").elements().next().path("schedule");
        assertThat(schedule.path("interval_days").asDouble()).isEqualTo(1.0);
        assertThat(schedule.path("ease_factor").asDouble()).isCloseTo(2.65, within(1e-9));
        assertThat(schedule.path("times_answered").asInt()).isEqualTo(1);
        assertThat(schedule.path("times_correct").asInt()).isEqualTo(1);
        assertThat(schedule.path("next_review").asText()).isEqualTo("2024-03-01T17:45:12.345Z");
    }

    @Test
    void saveThenLoad_keepsQuestionTypesAndAnswerKeys() throws Exception {
        QuestionBank bank = service.newBank("Mixed", NOW);
        Question fill = service.addQuestion(bank, QuestionDraft.fillBlank("H2O is ___.", List.of("water"), false), NOW);
        Question shortAnswer = service.addQuestion(bank,
                QuestionDraft.shortAnswer("Author of Dune?", List.of("Frank Herbert"), true, "books"), NOW);
        Question matching = service.addQuestion(bank, QuestionDraft.matching("Match",
                List.of("Kenya", "Peru"), List.of("Lima", "Nairobi"), Map.of(0, 1, 1, 0)), NOW);
        Question ordering = service.addQuestion(bank,
                QuestionDraft.ordering("Order", List.of("b", "a"), List.of(1, 0)), NOW);
        Question trueFalse = service.addQuestion(bank, QuestionDraft.trueFalse("Sky is blue?", true, null), NOW);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        store.write(bank, out);
        JsonNode key = MAPPER.readTree(out.toByteArray()).path("questions").path(matching.getId().toString()).path("answer_key");
        QuestionBank loaded = store.read(new ByteArrayInputStream(out.toByteArray()));

        assertThat(key.path("kind").asText()).isEqualTo("matching");
        assertThat(key.has("correct_matches")).isTrue();
        for (Question q : List.of(fill, shortAnswer, matching, ordering, trueFalse)) {
            Question copy = loaded.require(q.getId());
            assertThat(copy.getType()).isEqualTo(q.getType());
            assertThat(copy.getAnswerKey()).isEqualTo(q.getAnswerKey());
        }
        assertThat(loaded.require(matching.getId()).getAnswerKey().accepts(Submission.matches(Map.of(0, 1, 1, 0)))).isTrue();
        assertThat(loaded.require(trueFalse.getId()).getAnswerKey()).isNull();
    }

    @Test
    void load_missingFileSurfacesAsUncheckedIo() {
        Path missing = tmp.resolve("nope.json");

        assertThatThrownBy(() -> store.load(missing))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("nope.json");
    }

    @Test
    void load_rejectsMalformedJson() throws Exception {
        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{\"name\": ");

        assertThatThrownBy(() -> store.load(broken))
                .isInstanceOf(UncheckedIOException.class);
    }
}
