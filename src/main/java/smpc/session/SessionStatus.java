package smpc.session;

public enum SessionStatus {
    PENDING,
    COLLECTING,
    READY,
    COMPUTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPUTED || this == FAILED;
    }
}
