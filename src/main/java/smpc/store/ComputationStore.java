package smpc.store;

import smpc.ComputationException;
import smpc.session.ComputationSession;
import smpc.session.SessionNotFoundException;

import java.util.List;

/**
 * Persistence boundary for sessions, owned by the orchestration layer. Implementations hand out
 * independent copies: mutating a loaded session has no effect until it is saved again.
 */
public interface ComputationStore {

    /**
     * Stores the current state of the session, replacing any previous state. Once this returns for a
     * COMPUTED session its result must survive a restart of a durable store.
     * @param session Session to store
     * @throws ComputationException If the session could not be stored
     */
    void save(ComputationSession session) throws ComputationException;

    /**
     * @param id Session id
     * @return A copy of the stored session
     * @throws SessionNotFoundException If no session has this id
     * @throws ComputationException If the session could not be read
     */
    ComputationSession load(String id) throws ComputationException;

    /**
     * @param filter Sessions to keep
     * @return Copies of the matching sessions, oldest first
     * @throws ComputationException If the sessions could not be read
     */
    List<ComputationSession> list(SessionFilter filter) throws ComputationException;

    /**
     * Removes COMPUTED and FAILED sessions that completed more than maxAgeMillis ago
     * @param maxAgeMillis Retention period of terminal sessions
     * @return Ids of the removed sessions
     * @throws ComputationException If the store could not be cleaned up
     */
    List<String> expireTerminalSessions(long maxAgeMillis) throws ComputationException;
}
