package smpc.store;

import smpc.session.ComputationSession;
import smpc.session.SessionStatus;

/**
 * Selects sessions by participating organization and/or status. Null criteria match everything.
 */
public class SessionFilter {
    private static final SessionFilter ALL = new SessionFilter(null, null);

    private final String orgId;
    private final SessionStatus status;

    public SessionFilter(String orgId, SessionStatus status) {
        this.orgId = orgId;
        this.status = status;
    }

    public static SessionFilter all() {
        return ALL;
    }

    public static SessionFilter forOrg(String orgId) {
        return new SessionFilter(orgId, null);
    }

    public boolean matches(ComputationSession session) {
        if (orgId != null && !session.isParticipant(orgId))
            return false;
        return status == null || session.getStatus() == status;
    }

    public String getOrgId() {
        return orgId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
