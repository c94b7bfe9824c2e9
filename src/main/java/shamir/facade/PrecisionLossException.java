package shamir.facade;

/**
 * Raised when a value cannot be represented in the fixed-point domain of the field.
 */
public class PrecisionLossException extends SecretSharingException {
	private static final long serialVersionUID = 1L;

	public PrecisionLossException(String msg) {
		super(msg);
	}
}
