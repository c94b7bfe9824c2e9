package smpc.session;

import smpc.ComputationException;

/**
 * Raised for an unknown session id, or an organization that is not on a session's roster.
 */
public class SessionNotFoundException extends ComputationException {
	private static final long serialVersionUID = 1L;

	public SessionNotFoundException(String msg) {
		super(msg);
	}
}
