package smpc.session;

import shamir.encoding.FixedPointEncoder;
import shamir.facade.SecretSharingException;
import shamir.secretsharing.ShamirSecretSharing;
import shamir.secretsharing.Share;
import smpc.aggregation.LocalParty;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * One organization's submission to a session: the shares of its input plus the encoded input itself,
 * which stands in for the party's local state and is only read by the party-side variance step.
 * Both are dropped once the session is terminal, leaving only who submitted and when.
 */
public class ParticipantContribution implements LocalParty {
    private final String orgId;
    private Share[] inputShares;
    private final long submittedAt;
    private BigInteger retainedInput;

    public ParticipantContribution(String orgId, Share[] inputShares, BigInteger retainedInput, long submittedAt) {
        this.orgId = orgId;
        this.inputShares = inputShares;
        this.retainedInput = retainedInput;
        this.submittedAt = submittedAt;
    }

    /**
     * Encodes and shares a value on behalf of an organization
     * @param orgId Submitting organization
     * @param value Raw input
     * @param scheme Scheme used to share the input
     * @param shareholders Number of shares to produce
     * @param threshold Threshold of the session
     * @return New contribution
     * @throws SecretSharingException If the value is out of range or the threshold is invalid
     */
    public static ParticipantContribution share(String orgId, BigDecimal value, ShamirSecretSharing scheme,
                                                int shareholders, int threshold) throws SecretSharingException {
        BigInteger encoded = scheme.getEncoder().encodeInput(value);
        Share[] shares = scheme.shareFieldElement(encoded, shareholders, threshold);
        return new ParticipantContribution(orgId, shares, encoded, System.currentTimeMillis());
    }

    @Override
    public String getPartyId() {
        return orgId;
    }

    /**
     * @return Shares of the input, empty once the session reached a terminal state
     */
    @Override
    public Share[] getInputShares() {
        return inputShares;
    }

    @Override
    public Share[] shareSquaredDeviation(BigDecimal mean, ShamirSecretSharing scheme, int shareholders,
                                         int threshold) throws SecretSharingException {
        if (retainedInput == null)
            throw new SecretSharingException("Input of " + orgId + " is no longer available");
        FixedPointEncoder encoder = scheme.getEncoder();
        BigDecimal deviation = encoder.decode(retainedInput).subtract(mean);
        return scheme.shareFieldElement(encoder.encode(deviation.multiply(deviation)), shareholders, threshold);
    }

    public String getOrgId() {
        return orgId;
    }

    /**
     * @return Encoded input, or null once the session reached a terminal state
     */
    public BigInteger getRetainedInput() {
        return retainedInput;
    }

    public long getSubmittedAt() {
        return submittedAt;
    }

    void clearPrivateState() {
        retainedInput = null;
        inputShares = new Share[0];
    }
}
