package smpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shamir.Constants;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.util.Properties;

public final class Configuration {
	private static final Logger logger = LoggerFactory.getLogger("smpc");
	private static String configurationFilePath =
			"config" + File.separator + "smpc.config";
	private String primeField = Constants.DEFAULT_PRIME_FIELD;
	private int scaleDigits = Constants.DEFAULT_SCALE_DIGITS;
	private String maxMagnitude = Constants.DEFAULT_MAX_MAGNITUDE;
	private String securityMethod = "shamir-threshold/v1";
	private String storeDirectory = "data" + File.separator + "sessions";

	private static Configuration INSTANT;

	public static synchronized void setConfigurationFilePath(String configurationFilePath) {
		Configuration.configurationFilePath = configurationFilePath;
		INSTANT = null;
	}

	public static synchronized Configuration getInstance() {
		if (INSTANT == null) {
			try {
				INSTANT = new Configuration(configurationFilePath);
			} catch (FileNotFoundException e) {
				logger.warn("Configuration file {} not found, using defaults", configurationFilePath);
				INSTANT = new Configuration();
			} catch (IOException e) {
				throw new IllegalStateException("Failed to read configuration file " + configurationFilePath, e);
			}
		}
		return INSTANT;
	}

	private Configuration() {}

	Configuration(String configurationFilePath) throws IOException {
		try (BufferedReader in = new BufferedReader(new FileReader(configurationFilePath))) {
			String line;
			while ((line = in.readLine()) != null) {
				if (line.startsWith("#")) {
					continue;
				}
				String[] tokens = line.split("=");
				if (tokens.length != 2)
					continue;
				String propertyName = tokens[0].trim();
				String value = tokens[1].trim();
				switch (propertyName) {
					case "smpc.field.prime":
						primeField = value;
						break;
					case "smpc.fixed_point.scale_digits":
						scaleDigits = Integer.parseInt(value);
						break;
					case "smpc.fixed_point.max_magnitude":
						maxMagnitude = value;
						break;
					case "smpc.security_method":
						securityMethod = value;
						break;
					case "smpc.store.directory":
						storeDirectory = value;
						break;
					default:
						throw new IllegalArgumentException("Unknown property name " + propertyName);
				}
			}
		}
	}

	/**
	 * @return Properties for {@link shamir.secretsharing.ShamirSecretSharing}
	 */
	public Properties getSchemeProperties() {
		Properties properties = new Properties();
		properties.setProperty(Constants.TAG_PRIME_FIELD, primeField);
		properties.setProperty(Constants.TAG_SCALE_DIGITS, String.valueOf(scaleDigits));
		properties.setProperty(Constants.TAG_MAX_MAGNITUDE, maxMagnitude);
		return properties;
	}

	public String getPrimeField() {
		return primeField;
	}

	public int getScaleDigits() {
		return scaleDigits;
	}

	public String getMaxMagnitude() {
		return maxMagnitude;
	}

	public String getSecurityMethod() {
		return securityMethod;
	}

	public String getStoreDirectory() {
		return storeDirectory;
	}
}
