package smpc;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import shamir.Constants;
import shamir.secretsharing.ShamirSecretSharing;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;

/** Test of {@link Configuration}. */
public final class ConfigurationTest {

    /** Configured values override the defaults and reach the sharing scheme. */
    @Test
    public void readsConfigurationFile(@TempDir Path directory) throws Exception {
        String prime = BigInteger.TWO.pow(127).subtract(BigInteger.ONE).toString(16);
        Path file = write(directory,
                "# smaller field for tests",
                "smpc.field.prime = " + prime,
                "smpc.fixed_point.scale_digits = 5",
                "smpc.fixed_point.max_magnitude = 1000000",
                "smpc.security_method = shamir-threshold/test",
                "",
                "smpc.store.directory = " + directory.resolve("sessions"));

        Configuration configuration = new Configuration(file.toString());
        Assertions.assertThat(configuration.getScaleDigits()).isEqualTo(5);
        Assertions.assertThat(configuration.getSecurityMethod()).isEqualTo("shamir-threshold/test");
        Assertions.assertThat(configuration.getStoreDirectory()).isEqualTo(directory.resolve("sessions").toString());

        Properties properties = configuration.getSchemeProperties();
        Assertions.assertThat(properties.getProperty(Constants.TAG_PRIME_FIELD)).isEqualTo(prime);
        Assertions.assertThat(properties.getProperty(Constants.TAG_MAX_MAGNITUDE)).isEqualTo("1000000");

        ShamirSecretSharing scheme = new ShamirSecretSharing(properties);
        Assertions.assertThat(scheme.getField().bitLength()).isEqualTo(127);
        Assertions.assertThat(scheme.getEncoder().getScaleDigits()).isEqualTo(5);
    }

    /** Missing keys keep their defaults. */
    @Test
    public void keepsDefaults(@TempDir Path directory) throws Exception {
        Configuration configuration = new Configuration(write(directory, "# nothing").toString());
        Assertions.assertThat(configuration.getPrimeField()).isEqualTo(Constants.DEFAULT_PRIME_FIELD);
        Assertions.assertThat(configuration.getScaleDigits()).isEqualTo(Constants.DEFAULT_SCALE_DIGITS);
        Assertions.assertThat(configuration.getMaxMagnitude()).isEqualTo(Constants.DEFAULT_MAX_MAGNITUDE);
    }

    /** Misspelled keys are reported instead of silently ignored. */
    @Test
    public void unknownPropertyFails(@TempDir Path directory) throws Exception {
        Path file = write(directory, "smpc.field.prim = 7");
        Assertions.assertThatThrownBy(() -> new Configuration(file.toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("smpc.field.prim");
    }

    /** A missing file falls back to the defaults. */
    @Test
    public void missingFileUsesDefaults(@TempDir Path directory) {
        Configuration.setConfigurationFilePath(directory.resolve("absent.config").toString());
        try {
            Assertions.assertThat(Configuration.getInstance().getSecurityMethod()).isEqualTo("shamir-threshold/v1");
        } finally {
            Configuration.setConfigurationFilePath("config/smpc.config");
        }
    }

    private static Path write(Path directory, String... lines) throws Exception {
        Path file = directory.resolve("smpc.config");
        Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }
}
