package smpc.session;

import smpc.result.ComputationType;

public class SessionSummary {
    private final String id;
    private final ComputationType type;
    private final SessionStatus status;
    private final long createdAt;
    private final int participantsTotal;
    private final int participantsSubmitted;

    public SessionSummary(String id, ComputationType type, SessionStatus status, long createdAt,
                          int participantsTotal, int participantsSubmitted) {
        this.id = id;
        this.type = type;
        this.status = status;
        this.createdAt = createdAt;
        this.participantsTotal = participantsTotal;
        this.participantsSubmitted = participantsSubmitted;
    }

    public String getId() {
        return id;
    }

    public ComputationType getType() {
        return type;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public int getParticipantsTotal() {
        return participantsTotal;
    }

    public int getParticipantsSubmitted() {
        return participantsSubmitted;
    }

    @Override
    public String toString() {
        return "SessionSummary{id=" + id + ", type=" + type + ", status=" + status + ", submitted="
                + participantsSubmitted + "/" + participantsTotal + "}";
    }
}
