package app.qbank.core.bank;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * What the learner handed in. Only the part matching the question type is read.
 */
public record Submission(
        UUID answerId,
        String text,
        List<String> blanks,
        Map<Integer, Integer> matches,
        List<Integer> order
) {
    public static Submission choice(UUID answerId) {
        return new Submission(answerId, null, null, null, null);
    }

    public static Submission text(String text) {
        return new Submission(null, text, null, null, null);
    }

    public static Submission blanks(String... blanks) {
        return new Submission(null, null, Arrays.asList(blanks), null, null);
    }

    public static Submission matches(Map<Integer, Integer> matches) {
        return new Submission(null, null, null, matches, null);
    }

    public static Submission order(Integer... order) {
        return new Submission(null, null, null, null, Arrays.asList(order));
    }
}
