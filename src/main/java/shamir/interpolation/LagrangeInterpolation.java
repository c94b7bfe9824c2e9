package shamir.interpolation;

import shamir.secretsharing.Share;

import java.math.BigInteger;

/**
 * This class implements Lagrange Interpolation equations.
 * All the computations are done on a finite field
 */
public class LagrangeInterpolation implements InterpolationStrategy {
    private final BigInteger field;

    /**
     * Instantiates object to allow computation of points on interpolated polynomials in finite field field
     * @param field Finite field
     */
    public LagrangeInterpolation(BigInteger field) {
        this.field = field;
    }

    /**
     * Interpolated a polynomial F and returns value y of point (x,y) on F
     * @param x Value of x
     * @param shares Shares used to interpolate polynomial
     * @return Value y
     */
    @Override
    public BigInteger interpolateAt(BigInteger x, Share[] shares) {
        BigInteger result = BigInteger.ZERO;

        for (Share i : shares) {
            BigInteger xi = BigInteger.valueOf(i.getPartyIndex());
            BigInteger numerator = BigInteger.ONE;
            BigInteger denominator = BigInteger.ONE;
            for (Share j : shares) {
                if (i.getPartyIndex() == j.getPartyIndex())
                    continue;
                BigInteger xj = BigInteger.valueOf(j.getPartyIndex());
                numerator = numerator.multiply(x.subtract(xj)).mod(field);
                denominator = denominator.multiply(xi.subtract(xj)).mod(field);
            }
            denominator = denominator.modInverse(field);
            result = result.add(numerator.multiply(denominator).multiply(i.getValue())).mod(field);
        }

        return result;
    }
}
