package smpc.store;

import shamir.secretsharing.Share;
import smpc.result.ComputationResult;
import smpc.result.ComputationType;
import smpc.result.MeanResult;
import smpc.result.SumResult;
import smpc.result.VarianceResult;
import smpc.session.ComputationSession;
import smpc.session.ParticipantContribution;
import smpc.session.SessionStatus;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Flat, serializable snapshot of a {@link ComputationSession}. Field names are the persisted format.
 */
class SessionRecord {
    private String id;
    private String computationType;
    private List<String> participatingOrgIds;
    private int threshold;
    private String securityMethod;
    private long createdAt;
    private String status;
    private List<ContributionRecord> contributions;
    private ResultRecord result;
    private String failureType;
    private String failureMessage;
    private long completedAt;

    SessionRecord() {}

    static SessionRecord from(ComputationSession session) {
        SessionRecord record = new SessionRecord();
        record.id = session.getId();
        record.computationType = session.getComputationType().name();
        record.participatingOrgIds = new ArrayList<>(session.getParticipatingOrgIds());
        record.threshold = session.getThreshold();
        record.securityMethod = session.getSecurityMethod();
        record.createdAt = session.getCreatedAt();
        record.status = session.getStatus().name();
        record.contributions = new ArrayList<>(session.getSubmittedCount());
        for (ParticipantContribution contribution : session.getContributions())
            record.contributions.add(ContributionRecord.from(contribution));
        record.result = session.getComputationResult() == null ? null
                : ResultRecord.from(session.getComputationResult());
        record.failureType = session.getFailureType();
        record.failureMessage = session.getFailureMessage();
        record.completedAt = session.getCompletedAt();
        return record;
    }

    ComputationSession toSession() {
        List<ParticipantContribution> restored = new ArrayList<>();
        if (contributions != null) {
            for (ContributionRecord contribution : contributions)
                restored.add(contribution.toContribution());
        }
        return ComputationSession.restore(id, ComputationType.valueOf(computationType), participatingOrgIds,
                threshold, securityMethod, createdAt, SessionStatus.valueOf(status), restored,
                result == null ? null : result.toResult(), failureType, failureMessage, completedAt);
    }

    String getId() {
        return id;
    }

    long getCreatedAt() {
        return createdAt;
    }

    long getCompletedAt() {
        return completedAt;
    }

    boolean isTerminal() {
        return SessionStatus.valueOf(status).isTerminal();
    }

    private static class ContributionRecord {
        private String orgId;
        private Share[] shares;
        private BigInteger retainedInput;
        private long submittedAt;

        static ContributionRecord from(ParticipantContribution contribution) {
            ContributionRecord record = new ContributionRecord();
            record.orgId = contribution.getOrgId();
            Share[] shares = contribution.getInputShares();
            record.shares = Arrays.copyOf(shares, shares.length);
            record.retainedInput = contribution.getRetainedInput();
            record.submittedAt = contribution.getSubmittedAt();
            return record;
        }

        ParticipantContribution toContribution() {
            Share[] restored = shares == null ? new Share[0] : Arrays.copyOf(shares, shares.length);
            return new ParticipantContribution(orgId, restored, retainedInput, submittedAt);
        }
    }

    private static class ResultRecord {
        private String type;
        private BigDecimal value;
        private BigDecimal mean;
        private int participantCount;
        private String securityMethod;
        private long computedAt;

        static ResultRecord from(ComputationResult result) {
            ResultRecord record = new ResultRecord();
            record.type = result.getType().name();
            record.value = result.getValue();
            if (result instanceof VarianceResult)
                record.mean = ((VarianceResult) result).getMean();
            record.participantCount = result.getParticipantCount();
            record.securityMethod = result.getSecurityMethod();
            record.computedAt = result.getComputedAt();
            return record;
        }

        ComputationResult toResult() {
            switch (ComputationType.valueOf(type)) {
                case SUM:
                    return new SumResult(value, participantCount, securityMethod, computedAt);
                case MEAN:
                    return new MeanResult(value, participantCount, securityMethod, computedAt);
                case VARIANCE:
                    return new VarianceResult(mean, value, participantCount, securityMethod, computedAt);
                default:
                    throw new IllegalStateException("Unknown result type " + type);
            }
        }
    }
}
