package shamir.secretsharing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.Constants;
import shamir.encoding.FixedPointEncoder;
import shamir.facade.DuplicateShareException;
import shamir.facade.InsufficientSharesException;
import shamir.facade.PrecisionLossException;
import shamir.facade.SecretSharingException;
import shamir.facade.ValidationException;
import shamir.interpolation.InterpolationStrategy;
import shamir.interpolation.LagrangeInterpolation;
import shamir.polynomial.Polynomial;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Implements Shamir's threshold Secret Sharing scheme over a prime field.
 * Decimal secrets are scaled to fixed-point integers before being shared.
 */
public class ShamirSecretSharing {
    private final Logger logger = LoggerFactory.getLogger("shamir");
    private final BigInteger field;
    private final SecureRandom rndGenerator;
    private final InterpolationStrategy interpolationStrategy;
    private final FixedPointEncoder encoder;

    /**
     * Creates the scheme with the default field, scale and magnitude
     * @throws SecretSharingException When the defaults are inconsistent
     */
    public ShamirSecretSharing() throws SecretSharingException {
        this(new Properties());
    }

    /**
     * Creates the scheme from properties
     * @param properties Properties containing values for tags in the {@link Constants} class. Missing tags
     *                   fall back to the defaults declared there.
     * @throws SecretSharingException When the field is not prime, the scale is too coarse or the field
     * cannot hold a single input of the largest magnitude
     */
    public ShamirSecretSharing(Properties properties) throws SecretSharingException {
        if (properties == null)
            throw new IllegalArgumentException("Properties cannot be null!");
        try {
            this.field = new BigInteger(properties.getProperty(Constants.TAG_PRIME_FIELD,
                    Constants.DEFAULT_PRIME_FIELD), 16);
            int scaleDigits = Integer.parseInt(properties.getProperty(Constants.TAG_SCALE_DIGITS,
                    String.valueOf(Constants.DEFAULT_SCALE_DIGITS)));
            BigDecimal maxMagnitude = new BigDecimal(properties.getProperty(Constants.TAG_MAX_MAGNITUDE,
                    Constants.DEFAULT_MAX_MAGNITUDE));
            if (scaleDigits < Constants.MIN_SCALE_DIGITS)
                throw new SecretSharingException("Fixed-point scale must keep at least "
                        + Constants.MIN_SCALE_DIGITS + " decimal digits, got " + scaleDigits);
            if (!field.isProbablePrime(64))
                throw new SecretSharingException("Field order must be prime");
            this.encoder = new FixedPointEncoder(field, scaleDigits, maxMagnitude);
            encoder.ensureSumFits(1, maxMagnitude);
        } catch (NumberFormatException e) {
            throw new SecretSharingException("Invalid secret sharing property.", e);
        }
        this.rndGenerator = new SecureRandom();
        this.interpolationStrategy = new LagrangeInterpolation(field);
        logger.debug("Shamir secret sharing over a {}-bit field with {} decimal digits", field.bitLength(),
                encoder.getScaleDigits());
    }

    public BigInteger getField() {
        return field;
    }

    public FixedPointEncoder getEncoder() {
        return encoder;
    }

    /**
     * Computes n shares of a decimal secret, any threshold of which reconstruct it
     * @param secret Secret value
     * @param n Number of shares, one per party index 1..n
     * @param threshold Number of shares needed to reconstruct
     * @return Shares ordered by party index
     * @throws ValidationException If threshold is not in [1, n]
     * @throws PrecisionLossException If the secret is outside the supported magnitude
     */
    public Share[] generateShares(BigDecimal secret, int n, int threshold) throws SecretSharingException {
        checkThreshold(n, threshold);
        return shareFieldElement(encoder.encodeInput(secret), n, threshold);
    }

    /**
     * Computes n shares of a value already encoded in the field
     * @param secret Encoded secret
     * @param n Number of shares
     * @param threshold Number of shares needed to reconstruct
     * @return Shares ordered by party index
     * @throws ValidationException If threshold is not in [1, n]
     */
    public Share[] shareFieldElement(BigInteger secret, int n, int threshold) throws ValidationException {
        checkThreshold(n, threshold);
        Polynomial polynomial = new Polynomial(field, threshold - 1, secret, rndGenerator);

        Share[] shares = new Share[n];
        for (int i = 0; i < n; i++) {
            int partyIndex = i + 1;
            shares[i] = new Share(partyIndex, polynomial.evaluateAt(BigInteger.valueOf(partyIndex)));
        }
        return shares;
    }

    /**
     * Reconstructs a decimal secret by interpolating at x = 0
     * @param shares Shares of the secret, at least threshold distinct party indices
     * @param threshold Number of shares needed to reconstruct
     * @return Reconstructed secret
     * @throws InsufficientSharesException If fewer than threshold distinct party indices are present
     * @throws DuplicateShareException If a party index repeats with a different value
     */
    public BigDecimal reconstructSecret(Share[] shares, int threshold) throws SecretSharingException {
        return encoder.decode(reconstructFieldElement(shares, threshold));
    }

    /**
     * Same as {@link #reconstructSecret(Share[], int)} but returns the raw field element
     */
    public BigInteger reconstructFieldElement(Share[] shares, int threshold) throws SecretSharingException {
        if (threshold < 1)
            throw new ValidationException("Threshold must be at least 1, got " + threshold);
        Share[] distinct = distinctShares(shares);
        if (distinct.length < threshold)
            throw new InsufficientSharesException("Need " + threshold + " distinct shares to reconstruct, got "
                    + distinct.length);
        Share[] minimumShares = Arrays.copyOf(distinct, threshold);
        return interpolationStrategy.interpolateAt(BigInteger.ZERO, minimumShares);
    }

    /**
     * Adds shares of two secrets held at the same party indices. The result is a sharing of the sum of
     * both secrets with the same threshold.
     * @param first Shares of the first secret
     * @param second Shares of the second secret
     * @return Pointwise sum ordered by party index
     * @throws ValidationException If both share vectors do not cover the same party indices
     */
    public Share[] addShares(Share[] first, Share[] second) throws ValidationException {
        if (first.length != second.length)
            throw new ValidationException("Cannot add " + first.length + " shares to " + second.length
                    + " shares");
        Share[] a = sortedByParty(first);
        Share[] b = sortedByParty(second);
        Share[] result = new Share[a.length];
        for (int i = 0; i < a.length; i++) {
            if (a[i].getPartyIndex() != b[i].getPartyIndex())
                throw new ValidationException("Party index " + a[i].getPartyIndex() + " has no counterpart");
            result[i] = new Share(a[i].getPartyIndex(), a[i].getValue().add(b[i].getValue()).mod(field));
        }
        return result;
    }

    private Share[] distinctShares(Share[] shares) throws SecretSharingException {
        if (shares == null)
            return new Share[0];
        Map<Integer, Share> byParty = new LinkedHashMap<>(shares.length);
        for (Share share : shares) {
            if (share.getPartyIndex() < 1)
                throw new ValidationException("Party index must be positive, got " + share.getPartyIndex());
            Share previous = byParty.putIfAbsent(share.getPartyIndex(), share);
            if (previous != null && !previous.getValue().equals(share.getValue()))
                throw new DuplicateShareException("Conflicting shares for party index " + share.getPartyIndex());
        }
        return byParty.values().toArray(new Share[0]);
    }

    private static Share[] sortedByParty(Share[] shares) {
        Share[] sorted = Arrays.copyOf(shares, shares.length);
        Arrays.sort(sorted, Comparator.comparingInt(Share::getPartyIndex));
        return sorted;
    }

    private static void checkThreshold(int n, int threshold) throws ValidationException {
        if (threshold < 1 || threshold > n)
            throw new ValidationException("Threshold must be between 1 and " + n + ", got " + threshold);
    }
}
