package shamir.facade;

/**
 * Raised when a threshold, share count or party index is malformed.
 */
public class ValidationException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public ValidationException(String msg) {
		super(msg);
	}
}
