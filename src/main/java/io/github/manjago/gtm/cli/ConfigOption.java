package io.github.manjago.gtm.cli;

import io.github.manjago.gtm.config.GtmConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * {@code -f/--config} option shared by all commands.
 */
public class ConfigOption {

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    /**
     * Configuration from the file if given, defaults otherwise.
     */
    public GtmConfig.Builder builder() {
        GtmConfig base = configFile != null ? GtmConfig.fromFile(configFile) : GtmConfig.defaults();
        return GtmConfig.builder(base);
    }
}
