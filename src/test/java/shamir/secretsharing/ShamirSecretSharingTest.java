package shamir.secretsharing;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import shamir.Constants;
import shamir.facade.DuplicateShareException;
import shamir.facade.InsufficientSharesException;
import shamir.facade.PrecisionLossException;
import shamir.facade.SecretSharingException;
import shamir.facade.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.Random;

/** Test of {@link ShamirSecretSharing}. */
public final class ShamirSecretSharingTest {

    private static final BigDecimal PRECISION = new BigDecimal("0.000001");

    private ShamirSecretSharing scheme;

    @BeforeEach
    public void setUp() throws SecretSharingException {
        scheme = new ShamirSecretSharing();
    }

    /** Any threshold-sized subset of the shares reconstructs the secret. */
    @Test
    public void reconstructsFromAnyQuorum() throws SecretSharingException {
        Random random = new Random(42);
        for (int n = 1; n <= 6; n++) {
            for (int threshold = 1; threshold <= n; threshold++) {
                BigDecimal secret = BigDecimal.valueOf(random.nextInt(2_000_000) - 1_000_000, 4);
                Share[] shares = scheme.generateShares(secret, n, threshold);
                Assertions.assertThat(shares).hasSize(n);

                for (int attempt = 0; attempt < 5; attempt++) {
                    List<Share> subset = new ArrayList<>(Arrays.asList(shares));
                    Collections.shuffle(subset, random);
                    Share[] quorum = subset.subList(0, threshold).toArray(new Share[0]);
                    Assertions.assertThat(scheme.reconstructSecret(quorum, threshold))
                            .as("n=%d threshold=%d", n, threshold)
                            .isCloseTo(secret, Assertions.within(PRECISION));
                }
                Assertions.assertThat(scheme.reconstructSecret(shares, threshold))
                        .isCloseTo(secret, Assertions.within(PRECISION));
            }
        }
    }

    /** Health metrics with four or more decimals survive the fixed-point round trip. */
    @Test
    public void keepsDeclaredPrecision() throws SecretSharingException {
        BigDecimal secret = new BigDecimal("98.6125");
        Share[] shares = scheme.generateShares(secret, 5, 3);
        Assertions.assertThat(scheme.reconstructSecret(shares, 3)).isEqualByComparingTo(secret);
    }

    /** Negative values and values at the edge of the supported range round-trip. */
    @Test
    public void reconstructsNegativeAndLargeValues() throws SecretSharingException {
        for (String value : new String[] {"-42.125", "0", "-1000000000000000", "1000000000000000"}) {
            BigDecimal secret = new BigDecimal(value);
            Share[] shares = scheme.generateShares(secret, 4, 2);
            Assertions.assertThat(scheme.reconstructSecret(Arrays.copyOfRange(shares, 2, 4), 2))
                    .isEqualByComparingTo(secret);
        }
    }

    /** Fewer shares than the threshold are rejected instead of yielding a wrong value. */
    @Test
    public void belowThresholdFails() throws SecretSharingException {
        Share[] shares = scheme.generateShares(new BigDecimal("12.5"), 5, 3);
        Assertions.assertThatThrownBy(() -> scheme.reconstructSecret(Arrays.copyOf(shares, 2), 3))
                .isInstanceOf(InsufficientSharesException.class);
        Assertions.assertThatThrownBy(() -> scheme.reconstructSecret(new Share[0], 1))
                .isInstanceOf(InsufficientSharesException.class);
    }

    /** Repeating a share does not count twice towards the threshold. */
    @Test
    public void identicalDuplicatesCountOnce() throws SecretSharingException {
        Share[] shares = scheme.generateShares(new BigDecimal("7"), 3, 2);
        Share[] repeated = {shares[0], shares[0]};
        Assertions.assertThatThrownBy(() -> scheme.reconstructSecret(repeated, 2))
                .isInstanceOf(InsufficientSharesException.class);
    }

    /** Two different values at the same party index are rejected. */
    @Test
    public void conflictingDuplicatesFail() throws SecretSharingException {
        Share[] shares = scheme.generateShares(new BigDecimal("7"), 3, 2);
        Share forged = new Share(1, shares[0].getValue().add(BigInteger.ONE).mod(scheme.getField()));
        Share[] conflicting = {shares[0], forged, shares[1]};
        Assertions.assertThatThrownBy(() -> scheme.reconstructSecret(conflicting, 2))
                .isInstanceOf(DuplicateShareException.class);
    }

    /** Threshold must lie between one and the number of shares. */
    @Test
    public void invalidThresholdFails() {
        Assertions.assertThatThrownBy(() -> scheme.generateShares(BigDecimal.ONE, 3, 0))
                .isInstanceOf(ValidationException.class);
        Assertions.assertThatThrownBy(() -> scheme.generateShares(BigDecimal.ONE, 3, 4))
                .isInstanceOf(ValidationException.class);
    }

    /** Values beyond the supported magnitude are rejected. */
    @Test
    public void outOfRangeValueFails() {
        Assertions.assertThatThrownBy(() -> scheme.generateShares(new BigDecimal("1000000000000000.5"), 3, 2))
                .isInstanceOf(PrecisionLossException.class);
        Assertions.assertThatThrownBy(() -> scheme.generateShares(new BigDecimal("-1e20"), 3, 2))
                .isInstanceOf(PrecisionLossException.class);
    }

    /** Adding shares pointwise yields a sharing of the sum. */
    @Test
    public void addedSharesReconstructSum() throws SecretSharingException {
        Share[] a = scheme.generateShares(new BigDecimal("1.25"), 4, 3);
        Share[] b = scheme.generateShares(new BigDecimal("-3.5"), 4, 3);
        Share[] sum = scheme.addShares(a, b);
        Assertions.assertThat(scheme.reconstructSecret(sum, 3)).isEqualByComparingTo("-2.25");
    }

    /** Shares of different party sets cannot be added. */
    @Test
    public void addingMisalignedSharesFails() throws SecretSharingException {
        Share[] a = scheme.generateShares(BigDecimal.ONE, 4, 2);
        Share[] b = scheme.generateShares(BigDecimal.ONE, 3, 2);
        Assertions.assertThatThrownBy(() -> scheme.addShares(a, b)).isInstanceOf(ValidationException.class);
    }

    /** A scale coarser than four decimals or a composite field is refused. */
    @Test
    public void rejectsUnsafeParameters() {
        Properties coarse = new Properties();
        coarse.setProperty(Constants.TAG_SCALE_DIGITS, "2");
        Assertions.assertThatThrownBy(() -> new ShamirSecretSharing(coarse))
                .isInstanceOf(SecretSharingException.class);

        Properties composite = new Properties();
        composite.setProperty(Constants.TAG_PRIME_FIELD, "100");
        Assertions.assertThatThrownBy(() -> new ShamirSecretSharing(composite))
                .isInstanceOf(SecretSharingException.class);
    }

    /** A field too small to hold one input of the largest magnitude is refused. */
    @Test
    public void rejectsFieldSmallerThanMagnitude() {
        Properties properties = new Properties();
        properties.setProperty(Constants.TAG_PRIME_FIELD, BigInteger.TWO.pow(61).subtract(BigInteger.ONE).toString(16));
        Assertions.assertThatThrownBy(() -> new ShamirSecretSharing(properties))
                .isInstanceOf(PrecisionLossException.class);
    }

    /** A smaller prime field can be configured. */
    @Test
    public void usesConfiguredField() throws SecretSharingException {
        Properties properties = new Properties();
        properties.setProperty(Constants.TAG_PRIME_FIELD, BigInteger.TWO.pow(127).subtract(BigInteger.ONE).toString(16));
        properties.setProperty(Constants.TAG_MAX_MAGNITUDE, "1000000");
        ShamirSecretSharing small = new ShamirSecretSharing(properties);
        Assertions.assertThat(small.getField().bitLength()).isEqualTo(127);

        Share[] shares = small.generateShares(new BigDecimal("-999999.999999"), 3, 3);
        Assertions.assertThat(small.reconstructSecret(shares, 3)).isEqualByComparingTo("-999999.999999");
    }
}
