package smpc.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smpc.session.ComputationSession;
import smpc.session.SessionNotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps snapshots of sessions in memory. Nothing survives a restart; terminal sessions are kept until
 * {@link #expireTerminalSessions(long)} removes them.
 */
public class InMemoryComputationStore implements ComputationStore {
    private final Logger logger = LoggerFactory.getLogger("smpc");
    private final Map<String, SessionRecord> records;

    public InMemoryComputationStore() {
        this.records = new ConcurrentHashMap<>();
    }

    @Override
    public void save(ComputationSession session) {
        records.put(session.getId(), SessionRecord.from(session));
    }

    @Override
    public ComputationSession load(String id) throws SessionNotFoundException {
        SessionRecord record = id == null ? null : records.get(id);
        if (record == null)
            throw new SessionNotFoundException("Unknown session " + id);
        return record.toSession();
    }

    @Override
    public List<ComputationSession> list(SessionFilter filter) {
        List<SessionRecord> snapshot = new ArrayList<>(records.values());
        snapshot.sort(Comparator.comparingLong(SessionRecord::getCreatedAt));
        List<ComputationSession> sessions = new ArrayList<>(snapshot.size());
        for (SessionRecord record : snapshot) {
            ComputationSession session = record.toSession();
            if (filter.matches(session))
                sessions.add(session);
        }
        return sessions;
    }

    @Override
    public List<String> expireTerminalSessions(long maxAgeMillis) {
        long cutoff = System.currentTimeMillis() - maxAgeMillis;
        List<String> removed = new ArrayList<>();
        Iterator<SessionRecord> it = records.values().iterator();
        while (it.hasNext()) {
            SessionRecord record = it.next();
            if (record.isTerminal() && record.getCompletedAt() < cutoff) {
                it.remove();
                removed.add(record.getId());
            }
        }
        if (!removed.isEmpty())
            logger.info("Expired {} terminal sessions", removed.size());
        return removed;
    }

    public int size() {
        return records.size();
    }
}
