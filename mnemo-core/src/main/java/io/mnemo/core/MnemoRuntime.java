package io.mnemo.core;

import io.mnemo.core.agent.SystemContextBuilder;
import io.mnemo.core.agent.TurnProcessor;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.ProviderConfig;
import io.mnemo.core.consolidation.ConsolidationEngine;
import io.mnemo.core.consolidation.ConsolidationScheduler;
import io.mnemo.core.extraction.ExtractionPipeline;
import io.mnemo.core.extraction.ExtractionResponseParser;
import io.mnemo.core.goal.GoalStore;
import io.mnemo.core.goal.SqliteGoalStore;
import io.mnemo.core.memory.MemoryCommitter;
import io.mnemo.core.memory.MemoryStore;
import io.mnemo.core.memory.SqliteMemoryStore;
import io.mnemo.core.profile.ProfileStore;
import io.mnemo.core.profile.SqliteProfileStore;
import io.mnemo.core.provider.DisabledProvider;
import io.mnemo.core.provider.LlmProvider;
import io.mnemo.core.provider.OpenAiCompatProvider;
import io.mnemo.core.provider.ProviderTextCompletion;
import io.mnemo.core.retrieval.RelevanceRanker;
import io.mnemo.core.segmentation.ContextSegmentationController;
import io.mnemo.core.session.SessionManager;
import io.mnemo.core.session.SessionStore;
import io.mnemo.core.session.SqliteSessionStore;
import io.mnemo.core.store.RecordLockManager;
import io.mnemo.core.store.SqliteDatabase;
import io.mnemo.core.tool.ToolContext;
import io.mnemo.core.tool.ToolGateway;
import io.mnemo.core.tool.impl.MemoryTools;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Wires the stores, ranker, gateway, pipelines and consolidation from one configuration.
 * The consolidation scheduler is created stopped; call {@link #startConsolidation()} to poll.
 */
public final class MnemoRuntime implements AutoCloseable {
    private final MnemoConfig config;
    private final SqliteDatabase database;
    private final MemoryStore memories;
    private final GoalStore goals;
    private final ProfileStore profile;
    private final SessionStore sessions;
    private final RecordLockManager locks;
    private final RelevanceRanker ranker;
    private final MemoryCommitter committer;
    private final ToolGateway gateway;
    private final SessionManager sessionManager;
    private final ConsolidationEngine consolidationEngine;
    private final ConsolidationScheduler consolidationScheduler;
    private final TurnProcessor turnProcessor;

    private MnemoRuntime(MnemoConfig config, LlmProvider provider, Clock clock) throws IOException {
        this.config = config;
        this.database = new SqliteDatabase(ConfigPaths.resolveDatabase(config.storage().databasePath()));
        this.memories = new SqliteMemoryStore(database, clock);
        this.goals = new SqliteGoalStore(database, clock);
        this.profile = new SqliteProfileStore(database, clock);
        this.sessions = new SqliteSessionStore(database, clock);
        this.locks = new RecordLockManager();
        this.ranker = new RelevanceRanker(
            memories,
            locks,
            config.retrieval().toAnalyzer(),
            config.retrieval().toWeights(),
            clock
        );
        this.committer = new MemoryCommitter(memories, locks, config.extraction().duplicateThreshold());
        this.gateway = new ToolGateway(MemoryTools.registry(), Map.of(
            ToolContext.MEMORY_COMMITTER, committer,
            ToolContext.RELEVANCE_RANKER, ranker,
            ToolContext.GOAL_STORE, goals,
            ToolContext.PROFILE_STORE, profile
        ));

        String model = config.provider().model();
        String extractionModel = config.extraction().model() == null || config.extraction().model().isBlank()
            ? model
            : config.extraction().model();
        ProviderTextCompletion extractionCompletion = new ProviderTextCompletion(provider, extractionModel);
        ExtractionPipeline extraction = config.extraction().enabled()
            ? new ExtractionPipeline(extractionCompletion, new ExtractionResponseParser(), committer, goals, profile, clock)
            : null;

        this.consolidationEngine = new ConsolidationEngine(
            memories,
            sessions,
            new ProviderTextCompletion(provider, model),
            locks,
            config.consolidation().toPolicy(),
            clock
        );
        this.consolidationScheduler = new ConsolidationScheduler(
            consolidationEngine,
            config.consolidation().triggers(),
            clock
        );
        this.sessionManager = new SessionManager(sessions);
        sessionManager.addCloseListener(consolidationScheduler);

        this.turnProcessor = new TurnProcessor(
            provider,
            gateway,
            sessionManager,
            extraction,
            new ContextSegmentationController(sessions, config.segmentation().toPolicy()),
            new SystemContextBuilder(profile, goals, ranker),
            locks,
            config.agent().toSettings(model, config.retrieval().recallLimit()),
            consolidationScheduler
        );
    }

    public static MnemoRuntime open(MnemoConfig config) throws IOException {
        return open(config, buildProvider(config.provider()), Clock.systemUTC());
    }

    public static MnemoRuntime open(MnemoConfig config, LlmProvider provider, Clock clock) throws IOException {
        if (config == null || provider == null || clock == null) {
            throw new IllegalArgumentException("config, provider and clock must not be null");
        }
        return new MnemoRuntime(config, provider, clock);
    }

    static LlmProvider buildProvider(ProviderConfig providerConfig) {
        String name = providerConfig.name() == null || providerConfig.name().isBlank() ? "openai" : providerConfig.name();
        if (!providerConfig.configured()) {
            return new DisabledProvider(name, "missing API key");
        }
        String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
            ? ProviderConfig.defaults().apiBase()
            : providerConfig.apiBase();
        return new OpenAiCompatProvider(
            name,
            providerConfig.apiKey(),
            apiBase,
            providerConfig.extraHeaders(),
            Math.max(1, providerConfig.maxAttempts()),
            Duration.ofSeconds(Math.max(1, providerConfig.timeoutSeconds()))
        );
    }

    public void startConsolidation() {
        consolidationScheduler.start(config.consolidation().pollInterval());
    }

    public MnemoConfig config() {
        return config;
    }

    public SqliteDatabase database() {
        return database;
    }

    public MemoryStore memories() {
        return memories;
    }

    public GoalStore goals() {
        return goals;
    }

    public ProfileStore profile() {
        return profile;
    }

    public SessionStore sessions() {
        return sessions;
    }

    public RelevanceRanker ranker() {
        return ranker;
    }

    public MemoryCommitter committer() {
        return committer;
    }

    public ToolGateway gateway() {
        return gateway;
    }

    public SessionManager sessionManager() {
        return sessionManager;
    }

    public ConsolidationEngine consolidationEngine() {
        return consolidationEngine;
    }

    public ConsolidationScheduler consolidationScheduler() {
        return consolidationScheduler;
    }

    public TurnProcessor turnProcessor() {
        return turnProcessor;
    }

    @Override
    public void close() {
        consolidationScheduler.close();
    }
}
