package shamir.interpolation;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import shamir.secretsharing.Share;

import java.math.BigInteger;

/** Test of {@link LagrangeInterpolation}. */
public final class LagrangeInterpolationTest {

    private static final BigInteger FIELD = BigInteger.valueOf(97);

    // f(x) = 5 + 3x + 2x^2 mod 97
    private static final Share[] POINTS = {
        new Share(1, BigInteger.valueOf(10)),
        new Share(2, BigInteger.valueOf(19)),
        new Share(3, BigInteger.valueOf(32)),
    };

    /** Interpolation at zero recovers the constant term. */
    @Test
    public void recoversConstantTerm() {
        InterpolationStrategy interpolation = new LagrangeInterpolation(FIELD);
        Assertions.assertThat(interpolation.interpolateAt(BigInteger.ZERO, POINTS)).isEqualTo(BigInteger.valueOf(5));
    }

    /** Interpolation evaluates the polynomial at points not in the input. */
    @Test
    public void evaluatesOtherPoints() {
        InterpolationStrategy interpolation = new LagrangeInterpolation(FIELD);
        Assertions.assertThat(interpolation.interpolateAt(BigInteger.valueOf(4), POINTS))
                .isEqualTo(BigInteger.valueOf(49));
        // f(10) = 235 = 41 mod 97
        Assertions.assertThat(interpolation.interpolateAt(BigInteger.TEN, POINTS)).isEqualTo(BigInteger.valueOf(41));
    }

    /** Order of the points does not matter. */
    @Test
    public void ignoresPointOrder() {
        Share[] reversed = {POINTS[2], POINTS[0], POINTS[1]};
        Assertions.assertThat(new LagrangeInterpolation(FIELD).interpolateAt(BigInteger.ZERO, reversed))
                .isEqualTo(BigInteger.valueOf(5));
    }
}
