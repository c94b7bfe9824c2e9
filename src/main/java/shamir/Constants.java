package shamir;

/**
 * Property tags understood by {@link shamir.secretsharing.ShamirSecretSharing} and their defaults.
 */
public class Constants {
    public final static String TAG_PRIME_FIELD = "p";
    public final static String TAG_SCALE_DIGITS = "scaleDigits";
    public final static String TAG_MAX_MAGNITUDE = "maxMagnitude";

    // 2^255 - 19
    public final static String DEFAULT_PRIME_FIELD =
            "7fffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffed";
    public final static int DEFAULT_SCALE_DIGITS = 6;
    public final static int MIN_SCALE_DIGITS = 4;
    public final static String DEFAULT_MAX_MAGNITUDE = "1000000000000000";
}
