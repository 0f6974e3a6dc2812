package io.mnemo.cli;

import io.mnemo.core.MnemoRuntime;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.store.StoreStats;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and memory statistics")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (MnemoRuntime runtime = context.openRuntime()) {
            MnemoConfig config = runtime.config();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + ConfigPaths.resolveDatabase(config.storage().databasePath()));
            System.out.println("Provider: " + config.provider().name());
            System.out.println("Model: " + config.provider().model());
            System.out.println("Provider configured: " + config.provider().configured());

            StoreStats stats = runtime.database().stats();
            System.out.println("Memories: " + stats.memories() + " (" + stats.archivedMemories() + " archived)");
            System.out.println("Profile attributes: " + stats.profileAttributes());
            System.out.println("Goals: " + stats.goals() + " (" + stats.activeGoals() + " active)");
            System.out.println("Sessions: " + stats.sessions() + " (" + stats.openSessions() + " open)");
            System.out.println("Turns: " + stats.turns() + " (" + stats.archivedTurns() + " archived)");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
