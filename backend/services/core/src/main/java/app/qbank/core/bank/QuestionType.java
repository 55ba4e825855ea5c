package app.qbank.core.bank;

public enum QuestionType {
    MULTIPLE_CHOICE,
    TRUE_FALSE,
    FILL_BLANK,
    SHORT_ANSWER,
    MATCHING,
    ORDERING;

    /**
     * Choice questions are graded by the selected {@link AnswerOption}; the rest carry an {@link AnswerKey}.
     */
    public boolean isChoice() {
        return this == MULTIPLE_CHOICE || this == TRUE_FALSE;
    }
}
