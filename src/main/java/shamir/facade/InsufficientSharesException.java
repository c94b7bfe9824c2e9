package shamir.facade;

/**
 * Raised when fewer distinct shares than the threshold are available.
 */
public class InsufficientSharesException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public InsufficientSharesException(String msg) {
		super(msg);
	}
}
