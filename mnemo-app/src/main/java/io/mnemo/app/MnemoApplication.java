package io.mnemo.app;

import io.mnemo.cli.ChatCommand;
import io.mnemo.cli.CliContext;
import io.mnemo.cli.ConsolidateCommand;
import io.mnemo.cli.MnemoCliCommand;
import io.mnemo.cli.OnboardCommand;
import io.mnemo.cli.SearchCommand;
import io.mnemo.cli.StatusCommand;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigService;
import java.nio.file.Path;
import picocli.CommandLine;

public final class MnemoApplication {

    private MnemoApplication() {
    }

    public static void main(String[] args) {
        System.exit(commandLine(new CliContext(new ConfigService(), resolveConfigPath())).execute(args));
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new MnemoCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("consolidate", new ConsolidateCommand(context));
        return commandLine;
    }

    private static Path resolveConfigPath() {
        String raw = System.getenv("MNEMO_CONFIG");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        if (raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(raw.substring(2));
        }
        return Path.of(raw);
    }
}
