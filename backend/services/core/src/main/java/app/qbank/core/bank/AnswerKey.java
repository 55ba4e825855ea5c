package app.qbank.core.bank;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Expected answer of a question that is not graded by picking an option.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FillBlankKey.class, name = "fill_blank"),
        @JsonSubTypes.Type(value = ShortAnswerKey.class, name = "short_answer"),
        @JsonSubTypes.Type(value = MatchingKey.class, name = "matching"),
        @JsonSubTypes.Type(value = OrderingKey.class, name = "ordering")
})
public interface AnswerKey {

    QuestionType type();

    boolean accepts(Submission submission);
}
