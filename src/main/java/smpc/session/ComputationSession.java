package smpc.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.facade.InsufficientSharesException;
import shamir.facade.SecretSharingException;
import shamir.facade.ValidationException;
import shamir.secretsharing.Share;
import smpc.aggregation.SecureAggregator;
import smpc.aggregation.VarianceStatistic;
import smpc.result.ComputationResult;
import smpc.result.ComputationType;
import smpc.result.MeanResult;
import smpc.result.SumResult;
import smpc.result.VarianceResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * State of one joint computation. Status only moves forward:
 * PENDING -> COLLECTING -> READY -> COMPUTED, with FAILED reachable from any non-terminal status.
 * Once COMPUTED or FAILED the session no longer changes.
 * <p>
 * Instances are not thread-safe; {@link smpc.engine.ComputationEngine} serializes access per session.
 */
public class ComputationSession {
    private final Logger logger = LoggerFactory.getLogger("smpc");
    private final String id;
    private final ComputationType computationType;
    private final List<String> participatingOrgIds;
    private final int threshold;
    private final String securityMethod;
    private final long createdAt;
    private final Map<String, ParticipantContribution> contributions;
    private SessionStatus status;
    private ComputationResult result;
    private String failureType;
    private String failureMessage;
    private long completedAt;

    /**
     * Creates a new session in PENDING status
     * @param id Session id
     * @param computationType Statistic to compute
     * @param participatingOrgIds Roster; each organization holds the share at its 1-based position
     * @param threshold Number of contributions needed before computing
     * @param securityMethod Tag of the scheme used
     * @throws ValidationException If the roster is empty or repeats an id, or threshold is not in [1, |roster|]
     */
    public ComputationSession(String id, ComputationType computationType, Collection<String> participatingOrgIds,
                              int threshold, String securityMethod) throws ValidationException {
        this(id, computationType, validateRoster(participatingOrgIds, threshold), threshold, securityMethod,
                System.currentTimeMillis(), SessionStatus.PENDING, Collections.emptyList(), null, null, null, 0);
    }

    private ComputationSession(String id, ComputationType computationType, List<String> participatingOrgIds,
                               int threshold, String securityMethod, long createdAt, SessionStatus status,
                               Collection<ParticipantContribution> contributions, ComputationResult result,
                               String failureType, String failureMessage, long completedAt) {
        if (computationType == null)
            throw new IllegalArgumentException("Computation type cannot be null!");
        this.id = id;
        this.computationType = computationType;
        this.participatingOrgIds = Collections.unmodifiableList(new ArrayList<>(participatingOrgIds));
        this.threshold = threshold;
        this.securityMethod = securityMethod;
        this.createdAt = createdAt;
        this.contributions = new LinkedHashMap<>();
        for (ParticipantContribution contribution : contributions)
            this.contributions.put(contribution.getOrgId(), contribution);
        this.status = status;
        this.result = result;
        this.failureType = failureType;
        this.failureMessage = failureMessage;
        this.completedAt = completedAt;
    }

    /**
     * Creates a new session with a random id
     */
    public static ComputationSession create(ComputationType computationType, Collection<String> participatingOrgIds,
                                            int threshold, String securityMethod) throws ValidationException {
        return new ComputationSession(UUID.randomUUID().toString(), computationType, participatingOrgIds, threshold,
                securityMethod);
    }

    /**
     * Rebuilds a session from its persisted form without re-validating transitions
     */
    public static ComputationSession restore(String id, ComputationType computationType,
                                             List<String> participatingOrgIds, int threshold,
                                             String securityMethod, long createdAt, SessionStatus status,
                                             Collection<ParticipantContribution> contributions,
                                             ComputationResult result, String failureType,
                                             String failureMessage, long completedAt) {
        return new ComputationSession(id, computationType, participatingOrgIds, threshold, securityMethod, createdAt,
                status, contributions, result, failureType, failureMessage, completedAt);
    }

    /**
     * Checks that orgId may submit now, without changing anything
     * @throws SessionNotFoundException If orgId is not on the roster
     * @throws SessionStateException If the session is terminal or orgId already submitted
     */
    public void ensureAcceptsSubmission(String orgId) throws SessionNotFoundException, SessionStateException {
        if (status.isTerminal())
            throw new SessionStateException("Session " + id + " is " + status + " and accepts no more submissions");
        if (!participatingOrgIds.contains(orgId))
            throw new SessionNotFoundException("Organization " + orgId + " does not participate in session " + id);
        if (contributions.containsKey(orgId))
            throw new SessionStateException("Organization " + orgId + " already submitted to session " + id);
    }

    /**
     * Records a contribution. Moves PENDING to COLLECTING on the first one and COLLECTING to READY once
     * threshold organizations have contributed; later submissions keep the session READY.
     */
    public void submitShare(ParticipantContribution contribution)
            throws SessionNotFoundException, SessionStateException {
        ensureAcceptsSubmission(contribution.getOrgId());
        contributions.put(contribution.getOrgId(), contribution);
        SessionStatus previous = status;
        if (contributions.size() >= threshold)
            status = SessionStatus.READY;
        else
            status = SessionStatus.COLLECTING;
        if (previous != status)
            logger.debug("Session {} moved from {} to {}", id, previous, status);
    }

    /**
     * Computes the statistic. Returns the cached result when already computed. Any failure leaves the
     * session FAILED with the error recorded, and is rethrown.
     * @param aggregator Aggregator to combine the contributions with
     * @return Result of the computation
     * @throws InsufficientSharesException If fewer than threshold organizations contributed
     * @throws SessionStateException If the session already failed
     */
    public ComputationResult compute(SecureAggregator aggregator) throws SecretSharingException,
            SessionStateException {
        switch (status) {
            case COMPUTED:
                return result;
            case FAILED:
                throw new SessionStateException("Session " + id + " failed and cannot be computed");
            case PENDING:
            case COLLECTING:
                InsufficientSharesException e = new InsufficientSharesException("Session " + id + " has "
                        + contributions.size() + " of the " + threshold + " required contributions");
                markFailed(e);
                throw e;
            default:
                break;
        }
        try {
            ComputationResult computed = aggregate(aggregator);
            result = computed;
            status = SessionStatus.COMPUTED;
            completedAt = computed.getComputedAt();
            clearPrivateState();
            logger.info("Session {} computed {} over {} contributions", id, computationType, contributions.size());
            return computed;
        } catch (SecretSharingException | RuntimeException e) {
            markFailed(e);
            throw e;
        }
    }

    /**
     * Drives a non-terminal session to FAILED, e.g. when the orchestrator gives up waiting for submissions
     * @throws SessionStateException If the session is already terminal
     */
    public void fail(String errorType, String errorMessage) throws SessionStateException {
        if (status.isTerminal())
            throw new SessionStateException("Session " + id + " is already " + status);
        recordFailure(errorType, errorMessage);
    }

    public SessionOutcome getResult() {
        switch (status) {
            case COMPUTED:
                return SessionOutcome.computed(result);
            case FAILED:
                return SessionOutcome.failed(failureType, failureMessage);
            default:
                return SessionOutcome.pending(status);
        }
    }

    public SessionSummary toSummary() {
        return new SessionSummary(id, computationType, status, createdAt, participatingOrgIds.size(),
                contributions.size());
    }

    private ComputationResult aggregate(SecureAggregator aggregator) throws SecretSharingException {
        Map<String, Share[]> sharesByParty = new LinkedHashMap<>(contributions.size());
        for (ParticipantContribution contribution : contributions.values())
            sharesByParty.put(contribution.getOrgId(), contribution.getInputShares());
        int count = contributions.size();
        long now = System.currentTimeMillis();
        switch (computationType) {
            case SUM:
                return new SumResult(aggregator.secureSum(sharesByParty, threshold), count, securityMethod, now);
            case MEAN:
                return new MeanResult(aggregator.secureMean(sharesByParty, threshold), count, securityMethod, now);
            case VARIANCE:
                VarianceStatistic statistic = aggregator.secureVariance(contributions.values(),
                        participatingOrgIds.size(), threshold);
                return new VarianceResult(statistic.getMean(), statistic.getVariance(), count, securityMethod, now);
            default:
                throw new IllegalStateException("Unsupported computation type " + computationType);
        }
    }

    private void markFailed(Exception e) {
        recordFailure(e.getClass().getSimpleName(), e.getMessage());
    }

    private void recordFailure(String errorType, String errorMessage) {
        status = SessionStatus.FAILED;
        failureType = errorType;
        failureMessage = errorMessage;
        completedAt = System.currentTimeMillis();
        clearPrivateState();
        logger.warn("Session {} failed: {}: {}", id, errorType, errorMessage);
    }

    private void clearPrivateState() {
        for (ParticipantContribution contribution : contributions.values())
            contribution.clearPrivateState();
    }

    private static List<String> validateRoster(Collection<String> participatingOrgIds, int threshold)
            throws ValidationException {
        if (participatingOrgIds == null || participatingOrgIds.isEmpty())
            throw new ValidationException("At least one participating organization is required");
        Set<String> roster = new LinkedHashSet<>(participatingOrgIds.size());
        for (String orgId : participatingOrgIds) {
            if (orgId == null || orgId.trim().isEmpty())
                throw new ValidationException("Organization ids cannot be blank");
            if (!roster.add(orgId))
                throw new ValidationException("Organization " + orgId + " is listed twice");
        }
        if (threshold < 1 || threshold > roster.size())
            throw new ValidationException("Threshold must be between 1 and " + roster.size() + ", got " + threshold);
        return new ArrayList<>(roster);
    }

    public String getId() {
        return id;
    }

    public ComputationType getComputationType() {
        return computationType;
    }

    public List<String> getParticipatingOrgIds() {
        return participatingOrgIds;
    }

    public boolean isParticipant(String orgId) {
        return participatingOrgIds.contains(orgId);
    }

    public int getThreshold() {
        return threshold;
    }

    public String getSecurityMethod() {
        return securityMethod;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Collection<ParticipantContribution> getContributions() {
        return Collections.unmodifiableCollection(contributions.values());
    }

    public int getSubmittedCount() {
        return contributions.size();
    }

    /**
     * @return Cached result, or null unless COMPUTED
     */
    public ComputationResult getComputationResult() {
        return result;
    }

    public String getFailureType() {
        return failureType;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public long getCompletedAt() {
        return completedAt;
    }
}
