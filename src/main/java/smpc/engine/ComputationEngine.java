package smpc.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.facade.SecretSharingException;
import shamir.facade.ValidationException;
import shamir.secretsharing.ShamirSecretSharing;
import smpc.ComputationException;
import smpc.Configuration;
import smpc.aggregation.SecureAggregator;
import smpc.result.ComputationResult;
import smpc.result.ComputationType;
import smpc.session.ComputationSession;
import smpc.session.ParticipantContribution;
import smpc.session.SessionNotFoundException;
import smpc.session.SessionOutcome;
import smpc.session.SessionStateException;
import smpc.session.SessionSummary;
import smpc.store.ComputationStore;
import smpc.store.SessionFilter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Operations offered to the orchestration layer. Every operation that changes a session loads it,
 * changes it and saves it while holding that session's lock, so concurrent submissions are never lost
 * or counted twice and a session is computed at most once. Sessions do not share locks, and a lock is
 * dropped when its session turns out not to exist or is expired.
 * <p>
 * This engine plays the single trusted aggregator: it shares inputs on behalf of the parties and holds
 * every party's shares.
 */
public class ComputationEngine {
    private final Logger logger = LoggerFactory.getLogger("smpc");
    private final ComputationStore store;
    private final ShamirSecretSharing scheme;
    private final SecureAggregator aggregator;
    private final String securityMethod;
    private final Map<String, ReentrantLock> sessionLocks;

    public ComputationEngine(ComputationStore store, Configuration configuration) throws SecretSharingException {
        this(store, new ShamirSecretSharing(configuration.getSchemeProperties()), configuration.getSecurityMethod());
    }

    public ComputationEngine(ComputationStore store, ShamirSecretSharing scheme, String securityMethod) {
        this.store = store;
        this.scheme = scheme;
        this.aggregator = new SecureAggregator(scheme);
        this.securityMethod = securityMethod;
        this.sessionLocks = new ConcurrentHashMap<>();
    }

    /**
     * Opens a new session
     * @param type Statistic to compute
     * @param participatingOrgIds Organizations allowed to submit
     * @param threshold Number of submissions required before computing
     * @return Id of the new session
     * @throws ValidationException If threshold is not in [1, |participatingOrgIds|] or the roster is malformed
     * @throws ComputationException If the session could not be stored
     */
    public String create(ComputationType type, Collection<String> participatingOrgIds, int threshold)
            throws ValidationException, ComputationException {
        ComputationSession session = ComputationSession.create(type, participatingOrgIds, threshold, securityMethod);
        store.save(session);
        logger.info("Created {} session {} for {} organizations with threshold {}", type, session.getId(),
                session.getParticipatingOrgIds().size(), threshold);
        return session.getId();
    }

    /**
     * Shares value on behalf of orgId and records the shares in the session
     * @throws SessionNotFoundException If the session is unknown or orgId is not on its roster
     * @throws SessionStateException If orgId already submitted or the session is terminal
     * @throws shamir.facade.PrecisionLossException If value is outside the supported range
     */
    public void submit(String sessionId, String orgId, BigDecimal value)
            throws SecretSharingException, ComputationException {
        if (value == null)
            throw new ValidationException("Submitted value cannot be null");
        ReentrantLock lock = lockOf(sessionId);
        lock.lock();
        try {
            ComputationSession session = loadLocked(sessionId, lock);
            session.ensureAcceptsSubmission(orgId);
            ParticipantContribution contribution = ParticipantContribution.share(orgId, value, scheme,
                    session.getParticipatingOrgIds().size(), session.getThreshold());
            session.submitShare(contribution);
            store.save(session);
            logger.debug("Organization {} submitted to session {} ({}/{})", orgId, sessionId,
                    session.getSubmittedCount(), session.getParticipatingOrgIds().size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Computes the session's statistic, or returns the cached result if it was already computed. A failed
     * computation leaves the session FAILED; the failure is persisted before being rethrown.
     * @throws shamir.facade.InsufficientSharesException If fewer than threshold organizations submitted
     * @throws SessionStateException If the session already failed
     */
    public ComputationResult compute(String sessionId) throws SecretSharingException, ComputationException {
        ReentrantLock lock = lockOf(sessionId);
        lock.lock();
        try {
            ComputationSession session = loadLocked(sessionId, lock);
            boolean alreadyComputed = session.getComputationResult() != null;
            ComputationResult result;
            try {
                result = session.compute(aggregator);
            } catch (SecretSharingException | RuntimeException e) {
                store.save(session);
                throw e;
            }
            if (!alreadyComputed)
                store.save(session);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The result if computed, a pending marker while collecting, or the recorded failure
     * @throws SessionNotFoundException If the session is unknown
     */
    public SessionOutcome getResult(String sessionId) throws ComputationException {
        return store.load(sessionId).getResult();
    }

    /**
     * @param orgIdFilter Only list sessions this organization participates in; null lists all sessions
     * @return Summaries, oldest first
     */
    public List<SessionSummary> list(String orgIdFilter) throws ComputationException {
        SessionFilter filter = orgIdFilter == null || orgIdFilter.isEmpty() ? SessionFilter.all()
                : SessionFilter.forOrg(orgIdFilter);
        List<ComputationSession> sessions = store.list(filter);
        List<SessionSummary> summaries = new ArrayList<>(sessions.size());
        for (ComputationSession session : sessions)
            summaries.add(session.toSummary());
        return summaries;
    }

    /**
     * Fails a session that is still collecting, e.g. after an orchestration timeout
     * @throws SessionStateException If the session is already terminal
     */
    public void fail(String sessionId, String reason) throws ComputationException {
        ReentrantLock lock = lockOf(sessionId);
        lock.lock();
        try {
            ComputationSession session = loadLocked(sessionId, lock);
            session.fail("Aborted", reason);
            store.save(session);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes terminal sessions older than maxAgeMillis from the store and forgets their locks
     * @return Number of expired sessions
     */
    public int expireTerminalSessions(long maxAgeMillis) throws ComputationException {
        List<String> expired = store.expireTerminalSessions(maxAgeMillis);
        for (String sessionId : expired)
            sessionLocks.remove(sessionId);
        return expired.size();
    }

    public ShamirSecretSharing getScheme() {
        return scheme;
    }

    private ReentrantLock lockOf(String sessionId) throws SessionNotFoundException {
        if (sessionId == null)
            throw new SessionNotFoundException("Session id cannot be null");
        return sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
    }

    // unknown ids must not leave a lock behind
    private ComputationSession loadLocked(String sessionId, ReentrantLock lock) throws ComputationException {
        try {
            return store.load(sessionId);
        } catch (SessionNotFoundException e) {
            sessionLocks.remove(sessionId, lock);
            throw e;
        }
    }

    int lockCount() {
        return sessionLocks.size();
    }
}
