package org.typeset.lite.pretty;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Settings for {@link PrettyPrinter}, read from the {@code typeset.pretty}
 * section of the configuration. Defaults live in {@code reference.conf}.
 *
 * @param maxDepth The deepest node nesting the printer accepts before giving up,
 *                 or {@link #UNLIMITED}
 */
public record PrettyConfig(int maxDepth) {

    public static final String CONFIG_PATH = "typeset.pretty";

    /**
     * A {@code max-depth} of zero turns the nesting check off.
     */
    public static final int UNLIMITED = 0;

    public PrettyConfig {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("max-depth must not be negative: " + maxDepth);
        }
    }

    public static PrettyConfig unlimited() {
        return new PrettyConfig(UNLIMITED);
    }

    /**
     * Loads the settings from the application configuration (system
     * properties, {@code application.conf}, then {@code reference.conf}).
     */
    public static PrettyConfig load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * The settings from {@code reference.conf} alone.
     */
    public static PrettyConfig defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    public static PrettyConfig fromConfig(Config config) {
        Config pretty = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
        return new PrettyConfig(pretty.getInt("max-depth"));
    }

    public boolean isLimited() {
        return maxDepth != UNLIMITED;
    }

    public PrettyConfig withMaxDepth(int maxDepth) {
        return new PrettyConfig(maxDepth);
    }
}
