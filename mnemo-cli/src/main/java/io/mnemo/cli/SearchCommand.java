package io.mnemo.cli;

import io.mnemo.core.MnemoRuntime;
import io.mnemo.core.memory.MemoryCategory;
import io.mnemo.core.retrieval.RelevanceRanker;
import io.mnemo.core.retrieval.ScoredMemory;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Search stored memories by relevance")
public final class SearchCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Search query")
    String query;

    @Option(names = "--category", description = "fact, preference, personality, skill or goal_related")
    String category;

    @Option(names = {"-n", "--limit"}, description = "Maximum results")
    int limit = RelevanceRanker.DEFAULT_LIMIT;

    public SearchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (MnemoRuntime runtime = context.openRuntime()) {
            MemoryCategory filter = category == null || category.isBlank() ? null : MemoryCategory.fromValue(category);
            List<ScoredMemory> hits = runtime.ranker().search(query, filter, limit);
            if (hits.isEmpty()) {
                System.out.println("No memories found");
                return 0;
            }
            for (ScoredMemory hit : hits) {
                System.out.println(String.format(
                    Locale.ROOT,
                    "[%d] %.3f %s: %s",
                    hit.record().id(),
                    hit.score(),
                    hit.record().category().value(),
                    hit.record().content()
                ));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Search command failed: " + e.getMessage());
            return 1;
        }
    }
}
