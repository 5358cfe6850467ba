package org.dice.proplogic.config;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Limits applied while parsing and enumerating. Values are read from
 * {@value #CONFIG_RESOURCE} on the classpath; a system property with the same key
 * takes precedence over the file.
 */
public class ProplogicConfig {

    private static final Logger log = LoggerFactory.getLogger( ProplogicConfig.class );

    public static final String CONFIG_RESOURCE = "proplogic.properties";

    // maximum nesting of parentheses, negations and implications
    public static final String MAX_DEPTH = "parser.maxDepth";
    public static final int DEFAULT_MAX_DEPTH = 256;

    // a table over n variables has 2^n rows
    public static final String MAX_VARIABLES = "truthtable.maxVariables";
    public static final int DEFAULT_MAX_VARIABLES = 20;

    private static ProplogicConfig instance = null;

    private final int maxDepth;
    private final int maxVariables;

    public ProplogicConfig(int maxDepth, int maxVariables) {
        this.maxDepth = maxDepth;
        this.maxVariables = maxVariables;
    }

    public static synchronized ProplogicConfig getInstance() {
        if (instance == null) {
            instance = load();
        }
        return instance;
    }

    public static ProplogicConfig load() {
        return load(CONFIG_RESOURCE);
    }

    public static ProplogicConfig load(String resource) {
        Properties properties = new Properties();
        InputStream in = ProplogicConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.warn(String.format("%s not found on the classpath, using defaults", resource));
        }
        else {
            try {
                properties.load(in);
            } catch (IOException e) {
                log.warn(String.format("Failed to read %s, using defaults", resource), e);
            } finally {
                try {
                    in.close();
                } catch (IOException e) {
                    log.debug("Failed to close " + resource, e);
                }
            }
        }

        return new ProplogicConfig(
                readPositiveInt(properties, MAX_DEPTH, DEFAULT_MAX_DEPTH),
                readPositiveInt(properties, MAX_VARIABLES, DEFAULT_MAX_VARIABLES));
    }

    static int readPositiveInt(Properties properties, String key, int defaultValue) {
        String value = System.getProperty(key, properties.getProperty(key));
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        value = value.trim();
        int parsed = NumberUtils.isDigits(value) ? NumberUtils.toInt(value, 0) : 0;
        if (parsed <= 0) {
            log.error(String.format("Invalid value for %s: %s. Defaulting to %d", key, value, defaultValue));
            return defaultValue;
        }
        return parsed;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    @Override
    public String toString() {
        return String.format("%s=%d, %s=%d", MAX_DEPTH, maxDepth, MAX_VARIABLES, maxVariables);
    }
}
