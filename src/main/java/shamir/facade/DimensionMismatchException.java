package shamir.facade;

/**
 * Raised when share sets of a multi-round protocol do not line up, or when there is nothing to divide by.
 */
public class DimensionMismatchException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public DimensionMismatchException(String msg) {
		super(msg);
	}
}
