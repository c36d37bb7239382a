package edu.tum.cs.piohmm.util;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Properties;

import edu.tum.cs.piohmm.ConfigurationException;

/**
 * Properties read from "/piohmm.properties" on the class path, or from the file named by the system property
 * {@value #CONFIG_PROPERTY}. Keys are looked up both globally and under a class-specific prefix.
 */
public class PiohmmConfiguration extends Properties {

	private static final long serialVersionUID = -4189650712260830714L;

	public static final String CONFIG_PROPERTY = "edu.tum.cs.piohmm.config";
	private static final String resourceName = "/piohmm.properties";

	// well-known global properties
	public static final String PROP_NUM_THREADS = "numThreads";
	public static final String PROP_SEED = "seed";

	public static final String PROP_MAX_ITERATIONS = "EM.maxIterations";
	public static final String PROP_TOLERANCE = "EM.tolerance";
	public static final String PROP_NUM_RESTARTS = "EM.numRestarts";
	public static final String PROP_MONOTONICITY_TOLERANCE = "EM.monotonicityTolerance";
	public static final String PROP_NEWTON_ITERATIONS = "MStep.newtonIterations";
	public static final String PROP_REGULARIZATION = "MStep.regularization";
	public static final String PROP_MIN_VARIANCE = "MStep.minVariance";
	public static final String PROP_INITIAL_VARIANCE = "Personalization.initialVariance";
	public static final String PROP_COVARIANCE_SHRINKAGE = "Personalization.covarianceShrinkage";
	public static final String PROP_COVARIANCE_PRIOR_WEIGHT = "Personalization.covariancePriorWeight";
	public static final String PROP_PERSONALIZATION_MAX_ITERATIONS = "Personalization.maxIterations";
	public static final String PROP_PERSONALIZATION_TOLERANCE = "Personalization.tolerance";

	private final String root;

	public PiohmmConfiguration(Class<?> cls) {
		String configFileName = System.getProperty(CONFIG_PROPERTY);
		try {
			if (configFileName != null) {
				Reader reader = new FileReader(configFileName);
				try {
					load(reader);
				} finally {
					reader.close();
				}
			} else {
				InputStream is = PiohmmConfiguration.class.getResourceAsStream(resourceName);
				if (is != null) {
					try {
						load(is);
					} finally {
						is.close();
					}
				}
			}
		} catch (IOException ex) {
			throw new ConfigurationException("error reading configuration: " + ex.getMessage());
		}
		root = cls.getSimpleName();
	}

	private String makeLocal(String key) {
		return root + "." + key;
	}

	/** Local keys take precedence over global ones. */
	@Override
	public String getProperty(String key, String defaultValue) {
		String value = super.getProperty(makeLocal(key));
		if (value == null)
			value = super.getProperty(key);
		if (value == null) {
			value = defaultValue;
			if (value == null)
				throw new ConfigurationException("required property '" + key + "' not specified");
		}
		return value.trim();
	}

	@Override
	public String getProperty(String key) {
		return getProperty(key, null);
	}

	public int getIntProperty(String key, Integer defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		try {
			return Integer.parseInt(rawValue);
		} catch (NumberFormatException ex) {
			throw new ConfigurationException("invalid integer '" + rawValue + "' for key '" + key + "'");
		}
	}

	public long getLongProperty(String key, Long defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		try {
			return Long.parseLong(rawValue);
		} catch (NumberFormatException ex) {
			throw new ConfigurationException("invalid integer '" + rawValue + "' for key '" + key + "'");
		}
	}

	public double getDoubleProperty(String key, Double defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		try {
			return Double.parseDouble(rawValue);
		} catch (NumberFormatException ex) {
			throw new ConfigurationException("invalid number '" + rawValue + "' for key '" + key + "'");
		}
	}

	public boolean getBooleanProperty(String key, Boolean defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		return Boolean.parseBoolean(rawValue);
	}

}
