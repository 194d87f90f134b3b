package com.conveyal.catchment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties and expose them through the Config interfaces of Components.
 * All parameters are required, so a config file always shows an exhaustive list of them.
 *
 * Values from the properties file may be overridden by environment variables and system properties whose keys start
 * with "conveyal", e.g. CONVEYAL_WORKER_THREADS=4 or -Dconveyal.worker.threads=4. Precedence is: system properties >
 * environment variables > config file.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String CONVEYAL_PROPERTY_PREFIX = "conveyal-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    protected ConfigBase (Properties properties) {
        this.properties = properties;
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load configuration properties from " + filename, e);
        }
    }

    // The *Prop methods log and record missing or unparseable values instead of failing, so that all problems in a
    // config file are reported at once.

    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val.trim());
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
                return Double.parseDouble(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    /** Record a value that was present and parsed but is out of range. */
    protected void invalidProp (String key, Object value, String constraint) {
        LOG.error("Value of configuration option '{}' must be {}, was {}", key, constraint, value);
        keysWithErrors.add(key);
    }

    /** Call this after reading all properties. Embedded use throws rather than exiting the JVM. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new IllegalStateException("Missing or invalid configuration properties: " +
                    String.join(", ", keysWithErrors));
        }
    }

    public Set<String> getKeysWithErrors () {
        return Set.copyOf(keysWithErrors);
    }

    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String) || !(entry.getValue() instanceof String)) continue;
            // Normalize to all lower case with dash separators.
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = (String) entry.getValue();
            if (key.startsWith(CONVEYAL_PROPERTY_PREFIX)) {
                key = key.substring(CONVEYAL_PROPERTY_PREFIX.length());
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
