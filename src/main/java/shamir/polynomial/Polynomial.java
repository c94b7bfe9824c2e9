package shamir.polynomial;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Random sharing polynomial f(x) = secret + c_1*x + ... + c_degree*x^degree over a prime field.
 * Coefficients are kept in ascending order, so coefficients[0] is the secret.
 */
public class Polynomial {
    private final BigInteger field;
    private final BigInteger[] coefficients;

    /**
     * @param field Prime field
     * @param degree Degree of the polynomial, threshold - 1
     * @param secret Value of f(0)
     * @param rndGenerator Source of the non-constant coefficients
     */
    public Polynomial(BigInteger field, int degree, BigInteger secret, SecureRandom rndGenerator) {
        if (degree < 0)
            throw new IllegalArgumentException("Degree cannot be negative");
        this.field = field;
        this.coefficients = new BigInteger[degree + 1];
        this.coefficients[0] = secret.mod(field);
        for (int k = 1; k < degree; k++)
            this.coefficients[k] = fieldElement(rndGenerator);
        if (degree > 0)
            this.coefficients[degree] = nonZeroElement(rndGenerator);
    }

    /**
     * Evaluates f at x with Horner's rule, highest coefficient first
     */
    public BigInteger evaluateAt(BigInteger x) {
        BigInteger y = BigInteger.ZERO;
        for (int k = coefficients.length - 1; k >= 0; k--)
            y = y.multiply(x).add(coefficients[k]).mod(field);
        return y;
    }

    public int getDegree() {
        return coefficients.length - 1;
    }

    public BigInteger getCoefficient(int k) {
        return coefficients[k];
    }

    // uniform in [0, field)
    private BigInteger fieldElement(SecureRandom rndGenerator) {
        BigInteger element;
        do {
            element = new BigInteger(field.bitLength(), rndGenerator);
        } while (element.compareTo(field) >= 0);
        return element;
    }

    // leading coefficient must be non-zero or the degree, and with it the threshold, drops
    private BigInteger nonZeroElement(SecureRandom rndGenerator) {
        BigInteger element;
        do {
            element = fieldElement(rndGenerator);
        } while (element.signum() == 0);
        return element;
    }
}
