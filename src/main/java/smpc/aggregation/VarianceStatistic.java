package smpc.aggregation;

import java.math.BigDecimal;

/**
 * Outputs of the two-round variance protocol.
 */
public class VarianceStatistic {
    private final BigDecimal mean;
    private final BigDecimal variance;

    public VarianceStatistic(BigDecimal mean, BigDecimal variance) {
        this.mean = mean;
        this.variance = variance;
    }

    public BigDecimal getMean() {
        return mean;
    }

    public BigDecimal getVariance() {
        return variance;
    }

    @Override
    public String toString() {
        return "VarianceStatistic{mean=" + mean + ", variance=" + variance + "}";
    }
}
