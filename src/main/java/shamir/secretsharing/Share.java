package shamir.secretsharing;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Stores the party index and the field element it holds for one secret
 */
public class Share {
    private int partyIndex;
    private BigInteger value;

    public Share() {}

    public Share(int partyIndex, BigInteger value) {
        this.partyIndex = partyIndex;
        this.value = value;
    }

    public int getPartyIndex() {
        return partyIndex;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Share share = (Share) o;
        return partyIndex == share.partyIndex &&
                Objects.equals(value, share.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partyIndex, value);
    }

    @Override
    public String toString() {
        return "(" + partyIndex + ", " + value + ")";
    }
}
