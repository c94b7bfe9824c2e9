package shamir.interpolation;

import shamir.secretsharing.Share;

import java.math.BigInteger;

/**
 * Exposes methods that can be invoked to interpolate polynomial and compute point on it
 */
public interface InterpolationStrategy {

    /**
     * This method interpolates polynomial of degree shares.length - 1 and returns value evaluated at x.
     * Party indices of the shares must be pairwise distinct.
     * @param x Value of x
     * @param shares Shares used to interpolate polynomial
     * @return Value of y
     */
    BigInteger interpolateAt(BigInteger x, Share[] shares);
}
