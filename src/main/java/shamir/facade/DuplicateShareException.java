package shamir.facade;

/**
 * Raised when two shares claim the same party index with different values.
 */
public class DuplicateShareException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public DuplicateShareException(String msg) {
		super(msg);
	}
}
