package smpc;

/**
 * Root of the failures raised by the session layer and its store, as opposed to the
 * cryptographic failures rooted at {@link shamir.facade.SecretSharingException}.
 */
public class ComputationException extends Exception {
	private static final long serialVersionUID = 1L;

	public ComputationException(String msg) {
		super(msg);
	}

	public ComputationException(String msg, Throwable throwable) {
		super(msg, throwable);
	}
}
