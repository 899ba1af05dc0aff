package com.travelagent.poi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Loads configuration properties and exposes typed accessors for them. Subclasses read every option they need in
 * their constructor and then call {@link #throwIfErrors()}, so a broken configuration reports all of its problems at
 * once instead of failing on the first one.
 */
public abstract class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "poi-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to read config from the given properties, overriding them from the given environment and system
     * properties. In those two sources keys may be upper or lower case and use dashes, underscores or dots as
     * separators, and must carry the "poi" prefix: POI_DEDUPE_PRECISION=8 or java -Dpoi.dedupe.precision=8.
     * Precedence is system properties > environment variables > properties.
     */
    protected ConfigBase (Properties properties, Map<String, String> environment, Properties systemProperties) {
        this.properties = properties;
        setPropertiesFromMap(environment, "environment variable");
        setPropertiesFromMap(systemProperties, "system properties");
    }

    protected ConfigBase (Properties properties) {
        this(properties, System.getenv(), System.getProperties());
    }

    /** Load a properties file, wrapping any failure in a ConfigurationException. */
    protected static Properties propsFromFile (String filename, Properties defaults) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.putAll(defaults);
            properties.load(propsReader);
            return properties;
        } catch (IOException e) {
            throw new ConfigurationException("Could not load configuration properties from " + filename, e);
        }
    }

    /** Load a properties resource from the classpath. A missing resource yields empty properties. */
    protected static Properties propsFromResource (String resourceName) {
        Properties properties = new Properties();
        try (InputStream stream = ConfigBase.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (stream == null) {
                LOG.warn("Configuration resource {} not found on classpath.", resourceName);
            } else {
                properties.load(stream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Could not load configuration resource " + resourceName, e);
        }
        return properties;
    }

    // Always use the following *Prop methods to read properties. They log and record missing keys and parse errors,
    // allowing loading to continue so that all problems are reported together.

    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
            return null;
        }
        return value.trim();
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected double doubleProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Double.parseDouble(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected boolean boolProp (String key) {
        String val = strProp(key);
        if (val != null) {
            // Boolean.parseBoolean would return false for anything but "true", we want to be stricter.
            if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val)) {
                return true;
            } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val)) {
                return false;
            } else {
                LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return false;
    }

    /** Record a key whose value parsed but is not acceptable. */
    protected void invalid (String key, Object value, String reason) {
        LOG.error("Value of configuration option '{}' is invalid ({}): {}", key, reason, value);
        keysWithErrors.add(key);
    }

    /** Call this after reading all properties. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw ConfigurationException.forKeys(keysWithErrors);
        }
    }

    /**
     * Overwrite configuration options with those from environment variables or system properties. Keys are
     * normalized to lower case with dash separators before checking for the prefix.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = (String) entry.getValue();
            if (key.startsWith(PROPERTY_PREFIX)) {
                key = key.substring(PROPERTY_PREFIX.length());
                if (properties.getProperty(key) != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
