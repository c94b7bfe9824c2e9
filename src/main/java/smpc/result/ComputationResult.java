package smpc.result;

import java.math.BigDecimal;

/**
 * Outcome of a successful aggregation. Each computation type has its own subclass with explicit fields.
 */
public abstract class ComputationResult {
    private final ComputationType type;
    private final int participantCount;
    private final String securityMethod;
    private final long computedAt;

    protected ComputationResult(ComputationType type, int participantCount, String securityMethod,
                                long computedAt) {
        this.type = type;
        this.participantCount = participantCount;
        this.securityMethod = securityMethod;
        this.computedAt = computedAt;
    }

    public ComputationType getType() {
        return type;
    }

    /**
     * @return The statistic this result was requested for
     */
    public abstract BigDecimal getValue();

    public int getParticipantCount() {
        return participantCount;
    }

    /**
     * @return Tag naming the scheme and version used, kept for audit
     */
    public String getSecurityMethod() {
        return securityMethod;
    }

    /**
     * @return Epoch milliseconds at which the result was produced
     */
    public long getComputedAt() {
        return computedAt;
    }

    @Override
    public String toString() {
        return type + "[value=" + getValue().toPlainString() + ", participants=" + participantCount
                + ", securityMethod=" + securityMethod + ", computedAt=" + computedAt + "]";
    }
}
