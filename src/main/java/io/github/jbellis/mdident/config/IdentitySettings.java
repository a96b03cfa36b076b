package io.github.jbellis.mdident.config;

import io.github.jbellis.mdident.identity.Canonicalizer;
import io.github.jbellis.mdident.resolve.ResolverMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Tunables of the identity layer.
 *
 * @param maxDepth deepest nesting accepted by the parser adapter and the canonicalizer
 * @param resolverMode mode documents use for identifier lookups unless a call overrides it
 * @param driftPolicy reaction to persisted ids that no longer match their content
 */
public record IdentitySettings(int maxDepth, ResolverMode resolverMode, DriftPolicy driftPolicy) {
    private static final Logger logger = LogManager.getLogger(IdentitySettings.class);

    public static final String RESOURCE = "mdident.properties";
    public static final String MAX_DEPTH_KEY = "mdident.maxDepth";
    public static final String RESOLVER_MODE_KEY = "mdident.resolverMode";
    public static final String DRIFT_POLICY_KEY = "mdident.driftPolicy";

    private static final IdentitySettings DEFAULTS =
            new IdentitySettings(Canonicalizer.DEFAULT_MAX_DEPTH, ResolverMode.STRICT, DriftPolicy.WARN);

    public IdentitySettings {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        Objects.requireNonNull(resolverMode, "resolverMode");
        Objects.requireNonNull(driftPolicy, "driftPolicy");
    }

    public static IdentitySettings defaults() {
        return DEFAULTS;
    }

    public IdentitySettings withMaxDepth(int newMaxDepth) {
        return new IdentitySettings(newMaxDepth, resolverMode, driftPolicy);
    }

    public IdentitySettings withResolverMode(ResolverMode newMode) {
        return new IdentitySettings(maxDepth, newMode, driftPolicy);
    }

    public IdentitySettings withDriftPolicy(DriftPolicy newPolicy) {
        return new IdentitySettings(maxDepth, resolverMode, newPolicy);
    }

    /**
     * Reads settings from properties. Absent keys take their default; a present but invalid value
     * is logged and replaced by the default for that key.
     */
    public static IdentitySettings fromProperties(Properties props) {
        int maxDepth = DEFAULTS.maxDepth;
        String rawDepth = props.getProperty(MAX_DEPTH_KEY);
        if (rawDepth != null) {
            try {
                maxDepth = Integer.parseInt(rawDepth.trim());
                if (maxDepth < 1) {
                    logger.warn("Ignoring non-positive {}={}, using {}", MAX_DEPTH_KEY, rawDepth, DEFAULTS.maxDepth);
                    maxDepth = DEFAULTS.maxDepth;
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid {}={}, using {}", MAX_DEPTH_KEY, rawDepth, DEFAULTS.maxDepth);
            }
        }

        ResolverMode mode = DEFAULTS.resolverMode;
        String rawMode = props.getProperty(RESOLVER_MODE_KEY);
        if (rawMode != null) {
            mode = ResolverMode.fromString(rawMode).orElseGet(() -> {
                logger.warn("Ignoring unknown {}={}, using {}", RESOLVER_MODE_KEY, rawMode, DEFAULTS.resolverMode);
                return DEFAULTS.resolverMode;
            });
        }

        DriftPolicy policy = DEFAULTS.driftPolicy;
        String rawPolicy = props.getProperty(DRIFT_POLICY_KEY);
        if (rawPolicy != null) {
            try {
                policy = DriftPolicy.valueOf(rawPolicy.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring unknown {}={}, using {}", DRIFT_POLICY_KEY, rawPolicy, DEFAULTS.driftPolicy);
            }
        }
        return new IdentitySettings(maxDepth, mode, policy);
    }

    /**
     * Loads {@value #RESOURCE} from the classpath, or returns the defaults when there is none or
     * it cannot be read.
     */
    public static IdentitySettings load() {
        return load(IdentitySettings.class.getClassLoader(), RESOURCE);
    }

    static IdentitySettings load(ClassLoader loader, String resource) {
        try (InputStream is = loader.getResourceAsStream(resource)) {
            if (is == null) {
                logger.debug("No {} on classpath, using default identity settings", resource);
                return DEFAULTS;
            }
            try (var reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                var props = new Properties();
                props.load(reader);
                var settings = fromProperties(props);
                logger.debug("Loaded identity settings from {}: {}", resource, settings);
                return settings;
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Could not read {}, using default identity settings: {}", resource, e.getMessage());
            return DEFAULTS;
        }
    }
}
