package shamir.encoding;

import shamir.facade.PrecisionLossException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Maps decimal quantities to field elements by scaling them by 10^scaleDigits.
 * Negative values are encoded as field - |value|, so elements above (field - 1) / 2
 * decode to negative numbers.
 */
public class FixedPointEncoder {
    private final BigInteger field;
    private final BigInteger halfField;
    private final int scaleDigits;
    private final BigDecimal maxMagnitude;

    /**
     * @param field Prime field the encoded values live in
     * @param scaleDigits Number of decimal digits kept after the point
     * @param maxMagnitude Largest absolute input accepted by {@link #encodeInput(BigDecimal)}
     */
    public FixedPointEncoder(BigInteger field, int scaleDigits, BigDecimal maxMagnitude) {
        this.field = field;
        this.halfField = field.subtract(BigInteger.ONE).shiftRight(1);
        this.scaleDigits = scaleDigits;
        this.maxMagnitude = maxMagnitude;
    }

    /**
     * Encodes a party's raw input. Inputs larger than the supported magnitude are rejected
     * so that sums and squared deviations of many inputs still fit in the field.
     * @param value Raw input
     * @return Field element representing value
     * @throws PrecisionLossException If |value| exceeds the supported magnitude
     */
    public BigInteger encodeInput(BigDecimal value) throws PrecisionLossException {
        if (value.abs().compareTo(maxMagnitude) > 0)
            throw new PrecisionLossException("Value " + value.toPlainString()
                    + " is outside the supported range [-" + maxMagnitude.toPlainString()
                    + ", " + maxMagnitude.toPlainString() + "]");
        return encode(value);
    }

    /**
     * Encodes an intermediate value, such as a squared deviation, which is only bounded by the field.
     * @param value Value to encode
     * @return Field element representing value rounded to scaleDigits decimals
     * @throws PrecisionLossException If the scaled value does not fit in half of the field
     */
    public BigInteger encode(BigDecimal value) throws PrecisionLossException {
        BigInteger scaled = value.setScale(scaleDigits, RoundingMode.HALF_EVEN).unscaledValue();
        if (scaled.abs().compareTo(halfField) > 0)
            throw new PrecisionLossException("Value " + value.toPlainString()
                    + " does not fit in the fixed-point domain of the field");
        return scaled.mod(field);
    }

    /**
     * Checks that adding up terms values, each at most maxTerm in magnitude, cannot wrap around the field.
     * Must hold before an aggregate is reconstructed, since a wrapped sum decodes to a plausible wrong value.
     * @param terms Number of values added
     * @param maxTerm Largest magnitude of a single value
     * @throws PrecisionLossException If the worst-case sum does not fit in half of the field
     */
    public void ensureSumFits(int terms, BigDecimal maxTerm) throws PrecisionLossException {
        BigInteger scaledTerm = maxTerm.abs().movePointRight(scaleDigits).setScale(0, RoundingMode.CEILING)
                .toBigInteger();
        BigInteger worstCase = scaledTerm.multiply(BigInteger.valueOf(terms));
        if (worstCase.compareTo(halfField) > 0)
            throw new PrecisionLossException("A sum of " + terms + " values of magnitude up to "
                    + maxTerm.toPlainString() + " does not fit in a " + field.bitLength() + "-bit field");
    }

    public BigDecimal decode(BigInteger element) {
        BigInteger reduced = element.mod(field);
        if (reduced.compareTo(halfField) > 0)
            reduced = reduced.subtract(field);
        return new BigDecimal(reduced, scaleDigits);
    }

    public int getScaleDigits() {
        return scaleDigits;
    }

    public BigDecimal getMaxMagnitude() {
        return maxMagnitude;
    }
}
