package smpc.aggregation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.facade.DimensionMismatchException;
import shamir.facade.SecretSharingException;
import shamir.secretsharing.ShamirSecretSharing;
import shamir.secretsharing.Share;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes statistics over shared inputs. Shares held at the same party index are added locally and
 * only the combined sharing is reconstructed, so no individual input is ever opened.
 */
public class SecureAggregator {
    private final Logger logger = LoggerFactory.getLogger("smpc");
    private final ShamirSecretSharing scheme;

    public SecureAggregator(ShamirSecretSharing scheme) {
        this.scheme = scheme;
    }

    public ShamirSecretSharing getScheme() {
        return scheme;
    }

    /**
     * Sum of the secrets behind the given sharings
     * @param sharesByParty Shares of each party's secret, keyed by party id
     * @param threshold Threshold all sharings were created with
     * @return Reconstructed sum
     * @throws DimensionMismatchException If there is nothing to add or the sharings cover different party indices
     * @throws shamir.facade.PrecisionLossException If the sum of that many inputs could wrap around the field
     * @throws shamir.facade.InsufficientSharesException If the combined sharing has fewer than threshold shares
     */
    public BigDecimal secureSum(Map<String, Share[]> sharesByParty, int threshold) throws SecretSharingException {
        return sumOf(sharesByParty, threshold, scheme.getEncoder().getMaxMagnitude());
    }

    /**
     * Mean of the secrets behind the given sharings
     * @throws DimensionMismatchException If there are no sharings
     */
    public BigDecimal secureMean(Map<String, Share[]> sharesByParty, int threshold) throws SecretSharingException {
        if (sharesByParty.isEmpty())
            throw new DimensionMismatchException("Cannot compute a mean over zero participants");
        BigDecimal sum = secureSum(sharesByParty, threshold);
        return sum.divide(BigDecimal.valueOf(sharesByParty.size()), MathContext.DECIMAL128);
    }

    /**
     * Population variance in two rounds. Round 1 opens only the mean. In round 2 every party shares its
     * squared deviation from that mean with a fresh polynomial, and only the sum of those is opened.
     * @param parties Contributing parties
     * @param shareholders Number of shares each party produces per round
     * @param threshold Threshold used in both rounds
     * @return Mean and variance
     * @throws DimensionMismatchException If the two rounds do not produce matching share sets
     * @throws shamir.facade.PrecisionLossException If the sum of squared deviations could wrap around the field;
     * checked before anything is opened
     */
    public VarianceStatistic secureVariance(Collection<? extends LocalParty> parties, int shareholders,
                                            int threshold) throws SecretSharingException {
        if (parties.isEmpty())
            throw new DimensionMismatchException("Cannot compute a variance over zero participants");
        BigDecimal maxDeviation = scheme.getEncoder().getMaxMagnitude().multiply(BigDecimal.valueOf(2));
        BigDecimal maxSquaredDeviation = maxDeviation.multiply(maxDeviation);
        scheme.getEncoder().ensureSumFits(parties.size(), maxSquaredDeviation);

        Map<String, Share[]> firstRound = new LinkedHashMap<>(parties.size());
        for (LocalParty party : parties)
            firstRound.put(party.getPartyId(), party.getInputShares());
        BigDecimal mean = secureMean(firstRound, threshold);

        Map<String, Share[]> secondRound = new LinkedHashMap<>(parties.size());
        for (LocalParty party : parties) {
            Share[] deviationShares = party.shareSquaredDeviation(mean, scheme, shareholders, threshold);
            Share[] inputShares = firstRound.get(party.getPartyId());
            if (deviationShares == inputShares)
                throw new SecretSharingException("Party " + party.getPartyId()
                        + " reused its round-1 shares in round 2");
            if (!samePartyIndices(inputShares, deviationShares))
                throw new DimensionMismatchException("Party " + party.getPartyId() + " produced "
                        + deviationShares.length + " round-2 shares for " + inputShares.length
                        + " round-1 shares");
            secondRound.put(party.getPartyId(), deviationShares);
        }
        if (secondRound.size() != firstRound.size())
            throw new DimensionMismatchException("Round 2 has " + secondRound.size()
                    + " participants, round 1 had " + firstRound.size());

        BigDecimal squaredDeviations = sumOf(secondRound, threshold, maxSquaredDeviation);
        BigDecimal variance = squaredDeviations.divide(BigDecimal.valueOf(secondRound.size()),
                MathContext.DECIMAL128);
        logger.debug("Two-round variance completed over {} participants", parties.size());
        return new VarianceStatistic(mean, variance);
    }

    private BigDecimal sumOf(Map<String, Share[]> sharesByParty, int threshold, BigDecimal maxTerm)
            throws SecretSharingException {
        Share[] combined = combine(sharesByParty);
        scheme.getEncoder().ensureSumFits(sharesByParty.size(), maxTerm);
        BigDecimal sum = scheme.reconstructSecret(combined, threshold);
        logger.debug("Reconstructed combined sum of {} sharings", sharesByParty.size());
        return sum;
    }

    private Share[] combine(Map<String, Share[]> sharesByParty) throws SecretSharingException {
        if (sharesByParty.isEmpty())
            throw new DimensionMismatchException("No sharings to combine");
        Share[] combined = null;
        for (Map.Entry<String, Share[]> entry : sharesByParty.entrySet()) {
            Share[] shares = entry.getValue();
            if (combined == null) {
                combined = shares;
                continue;
            }
            if (!samePartyIndices(combined, shares))
                throw new DimensionMismatchException("Shares of " + entry.getKey()
                        + " are held by a different set of parties");
            combined = scheme.addShares(combined, shares);
        }
        return combined;
    }

    private static boolean samePartyIndices(Share[] a, Share[] b) {
        if (a == null || b == null || a.length != b.length)
            return false;
        return Arrays.equals(partyIndices(a), partyIndices(b));
    }

    private static int[] partyIndices(Share[] shares) {
        int[] indices = new int[shares.length];
        for (int i = 0; i < shares.length; i++)
            indices[i] = shares[i].getPartyIndex();
        Arrays.sort(indices);
        return indices;
    }
}
