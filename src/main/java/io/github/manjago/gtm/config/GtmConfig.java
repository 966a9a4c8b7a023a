package io.github.manjago.gtm.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

/**
 * Configuration for GTM.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record GtmConfig(
    // Batch runs
    long maxSteps,

    // Specialization
    int maxNestingDepth,

    // Debugger
    int tapeWindow,           // cells shown each side of the head
    long maxContinueSteps,

    // Export
    String machineName
) {

    public GtmConfig {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("run.max-steps must not be negative: " + maxSteps);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("resolver.max-nesting-depth must be positive: " + maxNestingDepth);
        }
        if (tapeWindow < 0) {
            throw new IllegalArgumentException("debugger.tape-window must not be negative: " + tapeWindow);
        }
        if (maxContinueSteps < 1) {
            throw new IllegalArgumentException("debugger.max-continue-steps must be positive: " + maxContinueSteps);
        }
    }

    /**
     * Load default configuration.
     */
    public static GtmConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static GtmConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static GtmConfig fromConfig(Config config) {
        Config c = config.getConfig("gtm");

        return new GtmConfig(
            c.getLong("run.max-steps"),
            c.getInt("resolver.max-nesting-depth"),
            c.getInt("debugger.tape-window"),
            c.getLong("debugger.max-continue-steps"),
            c.getString("export.machine-name")
        );
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled from an existing configuration.
     */
    public static Builder builder(GtmConfig base) {
        return new Builder()
                .maxSteps(base.maxSteps)
                .maxNestingDepth(base.maxNestingDepth)
                .tapeWindow(base.tapeWindow)
                .maxContinueSteps(base.maxContinueSteps)
                .machineName(base.machineName);
    }

    public static class Builder {
        private long maxSteps = 1_000_000;
        private int maxNestingDepth = 64;
        private int tapeWindow = 5;
        private long maxContinueSteps = 1_000_000;
        private String machineName = "generated turing machine";

        public Builder maxSteps(long max) { this.maxSteps = max; return this; }
        public Builder maxNestingDepth(int depth) { this.maxNestingDepth = depth; return this; }
        public Builder tapeWindow(int cells) { this.tapeWindow = cells; return this; }
        public Builder maxContinueSteps(long max) { this.maxContinueSteps = max; return this; }
        public Builder machineName(String name) { this.machineName = name; return this; }

        public GtmConfig build() {
            return new GtmConfig(maxSteps, maxNestingDepth, tapeWindow, maxContinueSteps, machineName);
        }
    }

    @Override
    public String toString() {
        return String.format("""
            GtmConfig:
              run.max-steps:               %,d
              resolver.max-nesting-depth:  %d
              debugger.tape-window:        %d
              debugger.max-continue-steps: %,d
              export.machine-name:         %s
            """,
            maxSteps,
            maxNestingDepth,
            tapeWindow,
            maxContinueSteps,
            machineName
        );
    }
}
