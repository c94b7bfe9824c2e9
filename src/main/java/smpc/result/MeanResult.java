package smpc.result;

import java.math.BigDecimal;

public class MeanResult extends ComputationResult {
    private final BigDecimal mean;

    public MeanResult(BigDecimal mean, int participantCount, String securityMethod, long computedAt) {
        super(ComputationType.MEAN, participantCount, securityMethod, computedAt);
        this.mean = mean;
    }

    public BigDecimal getMean() {
        return mean;
    }

    @Override
    public BigDecimal getValue() {
        return mean;
    }
}
