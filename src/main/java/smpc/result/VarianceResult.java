package smpc.result;

import java.math.BigDecimal;

/**
 * Population variance together with the mean opened in the first round of the protocol.
 */
public class VarianceResult extends ComputationResult {
    private final BigDecimal mean;
    private final BigDecimal variance;

    public VarianceResult(BigDecimal mean, BigDecimal variance, int participantCount, String securityMethod,
                          long computedAt) {
        super(ComputationType.VARIANCE, participantCount, securityMethod, computedAt);
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
    public BigDecimal getValue() {
        return variance;
    }
}
