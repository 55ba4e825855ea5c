package app.qbank.core.bank;

import java.util.List;

public record FillBlankKey(List<String> blanks, boolean caseSensitive) implements AnswerKey {

    public FillBlankKey {
        if (blanks == null || blanks.isEmpty()) {
            throw new IllegalArgumentException("Fill-in-the-blank question needs at least one blank");
        }
        if (blanks.stream().anyMatch(b -> b == null || b.isBlank())) {
            throw new IllegalArgumentException("Blank answers must not be empty");
        }
        blanks = List.copyOf(blanks);
    }

    @Override
    public QuestionType type() {
        return QuestionType.FILL_BLANK;
    }

    @Override
    public boolean accepts(Submission submission) {
        List<String> given = submission.blanks();
        if (given == null || given.size() != blanks.size()) return false;
        for (int i = 0; i < blanks.size(); i++) {
            String answer = given.get(i);
            if (answer == null) return false;
            if (!TextMatching.normalize(answer, caseSensitive).equals(TextMatching.normalize(blanks.get(i), caseSensitive))) {
                return false;
            }
        }
        return true;
    }
}
