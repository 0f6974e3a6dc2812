package io.mnemo.cli;

import io.mnemo.core.MnemoRuntime;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.MnemoConfig;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, MnemoRuntime::open);
    }

    public MnemoConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public MnemoRuntime openRuntime() throws IOException {
        return runtimeFactory.open(loadConfig());
    }

    @FunctionalInterface
    public interface RuntimeFactory {
        MnemoRuntime open(MnemoConfig config) throws IOException;
    }
}
