package smpc.result;

import java.math.BigDecimal;

public class SumResult extends ComputationResult {
    private final BigDecimal sum;

    public SumResult(BigDecimal sum, int participantCount, String securityMethod, long computedAt) {
        super(ComputationType.SUM, participantCount, securityMethod, computedAt);
        this.sum = sum;
    }

    public BigDecimal getSum() {
        return sum;
    }

    @Override
    public BigDecimal getValue() {
        return sum;
    }
}
