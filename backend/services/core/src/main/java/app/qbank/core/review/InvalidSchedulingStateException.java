package app.qbank.core.review;

public class InvalidSchedulingStateException extends IllegalArgumentException {

    public InvalidSchedulingStateException(String message) {
        super(message);
    }
}
