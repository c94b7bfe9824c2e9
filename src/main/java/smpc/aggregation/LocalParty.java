package smpc.aggregation;

import shamir.facade.SecretSharingException;
import shamir.secretsharing.ShamirSecretSharing;
import shamir.secretsharing.Share;

import java.math.BigDecimal;

/**
 * Party-side view of a contributor. The aggregator only ever sees the shares a party hands out,
 * never the value behind them.
 */
public interface LocalParty {

    String getPartyId();

    /**
     * @return Round-1 shares of the party's input, one per shareholder
     */
    Share[] getInputShares();

    /**
     * Computes (input - mean)^2 locally and shares it with a fresh polynomial
     * @param mean Mean published after round 1
     * @param scheme Scheme used for the fresh sharing
     * @param shareholders Number of shares to produce
     * @param threshold Threshold of the fresh sharing
     * @return Round-2 shares, one per shareholder
     * @throws SecretSharingException If the party no longer holds its input or the deviation does not fit
     */
    Share[] shareSquaredDeviation(BigDecimal mean, ShamirSecretSharing scheme, int shareholders, int threshold)
            throws SecretSharingException;
}
