package smpc.session;

import smpc.result.ComputationResult;

/**
 * What a caller gets when asking for the result of a session: the result, a pending marker, or the
 * recorded failure.
 */
public class SessionOutcome {
    private final SessionStatus status;
    private final ComputationResult result;
    private final String errorType;
    private final String errorMessage;

    private SessionOutcome(SessionStatus status, ComputationResult result, String errorType, String errorMessage) {
        this.status = status;
        this.result = result;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
    }

    static SessionOutcome computed(ComputationResult result) {
        return new SessionOutcome(SessionStatus.COMPUTED, result, null, null);
    }

    static SessionOutcome pending(SessionStatus status) {
        return new SessionOutcome(status, null, null, null);
    }

    static SessionOutcome failed(String errorType, String errorMessage) {
        return new SessionOutcome(SessionStatus.FAILED, null, errorType, errorMessage);
    }

    public SessionStatus getStatus() {
        return status;
    }

    public boolean isPending() {
        return !status.isTerminal();
    }

    public boolean isComputed() {
        return status == SessionStatus.COMPUTED;
    }

    public boolean isFailed() {
        return status == SessionStatus.FAILED;
    }

    /**
     * @return Result if the session is computed, null otherwise
     */
    public ComputationResult getResult() {
        return result;
    }

    /**
     * @return Simple name of the exception that failed the session, null unless failed
     */
    public String getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        switch (status) {
            case COMPUTED:
                return "computed: " + result;
            case FAILED:
                return "failed: " + errorType + ": " + errorMessage;
            default:
                return "pending (" + status + ")";
        }
    }
}
