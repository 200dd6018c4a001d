package io.github.drompincen.worktrack.runtime.session;

public class SessionTransitionException extends RuntimeException {

    public enum Failure {
        ALREADY_CHECKED_IN("Already checked in"),
        NO_ACTIVE_SESSION("No active session"),
        NO_OPEN_BREAK("No open break"),
        CHANGED_ELSEWHERE("Session was changed elsewhere, try again");

        private final String message;

        Failure(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Failure failure;

    public SessionTransitionException(Failure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public SessionTransitionException(Failure failure, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }
}
