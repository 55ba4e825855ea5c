package app.qbank.core.bank;

public enum AnswerResult {
    CORRECT, INCORRECT, SKIPPED
}
