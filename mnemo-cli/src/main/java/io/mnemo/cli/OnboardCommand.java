package io.mnemo.cli;

import io.mnemo.core.config.OnboardResult;
import io.mnemo.core.config.model.MnemoConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the config file and create the memory database")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            String action = result.createdConfig()
                ? "Created config"
                : result.overwrittenConfig() ? "Reset config to defaults" : "Kept config, added missing defaults";
            System.out.println(action + ": " + result.configPath());
            System.out.println("Database ready: " + result.databasePath());

            MnemoConfig config = context.loadConfig();
            if (!config.provider().configured()) {
                System.out.println("No API key set; add provider.apiKey to " + result.configPath() + " to enable chat");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard command failed: " + e.getMessage());
            return 1;
        }
    }
}
