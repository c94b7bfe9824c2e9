package smpc.session;

import smpc.ComputationException;

/**
 * Raised when an operation is not valid for the current status of a session.
 */
public class SessionStateException extends ComputationException {
	private static final long serialVersionUID = 1L;

	public SessionStateException(String msg) {
		super(msg);
	}
}
