package smpc.result;

import java.util.Locale;

public enum ComputationType {
    SUM,
    MEAN,
    VARIANCE;

    /**
     * Parses names such as "sum" or "Variance"
     * @throws IllegalArgumentException If name is not a supported computation
     */
    public static ComputationType fromName(String name) {
        if (name == null)
            throw new IllegalArgumentException("Computation type cannot be null");
        return ComputationType.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
