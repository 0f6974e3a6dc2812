package io.mnemo.core.agent;

import io.mnemo.core.consolidation.ConsolidationScheduler;
import io.mnemo.core.extraction.ExtractionOutcome;
import io.mnemo.core.extraction.ExtractionPipeline;
import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.ToolCall;
import io.mnemo.core.model.TurnResult;
import io.mnemo.core.provider.LlmProvider;
import io.mnemo.core.provider.LlmResponse;
import io.mnemo.core.segmentation.ContextSegmentationController;
import io.mnemo.core.segmentation.SegmentationDecision;
import io.mnemo.core.session.ConversationContext;
import io.mnemo.core.session.ConversationTurn;
import io.mnemo.core.session.Session;
import io.mnemo.core.session.SessionManager;
import io.mnemo.core.session.TurnRole;
import io.mnemo.core.store.RecordLockManager;
import io.mnemo.core.tool.ToolGateway;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one conversational turn: generation with interleaved tool calls, then persistence of
 * the exchange, extraction and context segmentation. Turns of the same conversation are
 * serialized; different conversations proceed in parallel.
 */
public final class TurnProcessor {
    public static final String FAILURE_MESSAGE = "I was unable to complete that request.";
    static final String MAX_ITERATIONS_MESSAGE = "Stopped after max tool iterations";
    private static final Logger LOG = LoggerFactory.getLogger(TurnProcessor.class);

    private final LlmProvider provider;
    private final ToolGateway gateway;
    private final SessionManager sessions;
    private final ExtractionPipeline extraction;
    private final ContextSegmentationController segmentation;
    private final SystemContextBuilder systemContext;
    private final RecordLockManager locks;
    private final AgentSettings settings;
    private final ConsolidationScheduler scheduler;

    public TurnProcessor(
        LlmProvider provider,
        ToolGateway gateway,
        SessionManager sessions,
        ExtractionPipeline extraction,
        ContextSegmentationController segmentation,
        SystemContextBuilder systemContext,
        RecordLockManager locks,
        AgentSettings settings,
        ConsolidationScheduler scheduler
    ) {
        this.provider = provider;
        this.gateway = gateway;
        this.sessions = sessions;
        this.extraction = extraction;
        this.segmentation = segmentation;
        this.systemContext = systemContext;
        this.locks = locks;
        this.settings = settings;
        this.scheduler = scheduler;
    }

    public TurnResult process(String conversationId, String userText) throws IOException {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId must not be blank");
        }
        if (userText == null || userText.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        try {
            return locks.withInterruptibleLock(
                RecordLockManager.conversationKey(conversationId),
                () -> processLocked(conversationId, userText)
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Turn for conversation {} aborted while waiting for the previous turn", conversationId);
            return TurnResult.aborted(List.of());
        }
    }

    /**
     * Closes the open session of {@code conversationId}, if any. The next turn starts a new one.
     */
    public Optional<Session> endSession(String conversationId) throws IOException {
        return locks.withLock(RecordLockManager.conversationKey(conversationId), () -> {
            Optional<Session> open = sessions.store().findOpen(conversationId);
            if (open.isEmpty()) {
                return Optional.<Session>empty();
            }
            return Optional.of(sessions.end(ConversationContext.of(open.get())));
        });
    }

    private TurnResult processLocked(String conversationId, String userText) throws IOException {
        ConversationContext context = sessions.resolve(conversationId);
        List<ChatMessage> transcript = new ArrayList<>();
        transcript.add(ChatMessage.system(
            systemContext.build(settings.systemPrompt(), userText, settings.recallLimit())
        ));
        for (ConversationTurn turn : segmentation.activeWindow(context)) {
            transcript.add(ChatMessage.fromTurn(turn));
        }
        transcript.add(ChatMessage.user(userText));

        Map<String, Object> usage = Map.of();
        for (int i = 0; i < settings.maxToolIterations(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                return abort(context, transcript);
            }
            LlmResponse response;
            try {
                response = provider.chat(settings.model(), transcript, gateway.definitions());
            } catch (InterruptedIOException e) {
                return abort(context, transcript);
            } catch (IOException e) {
                if (Thread.currentThread().isInterrupted()) {
                    return abort(context, transcript);
                }
                LOG.warn("Completion failed for conversation {}: {}", conversationId, e.getMessage());
                return new TurnResult(FAILURE_MESSAGE, transcript, Map.of(), null, null, false);
            }
            usage = response.usage();

            if (!response.hasToolCalls()) {
                transcript.add(ChatMessage.assistant(response.content()));
                return completeTurn(context, userText, response.content(), transcript, usage);
            }

            transcript.add(ChatMessage.assistantWithToolCalls(response.content(), response.toolCalls()));
            for (ToolCall call : response.toolCalls()) {
                if (Thread.currentThread().isInterrupted()) {
                    return abort(context, transcript);
                }
                String output = gateway.invokeAsJson(call.name(), call.arguments(), context);
                LOG.debug("Tool {} returned {}", call.name(), output);
                transcript.add(ChatMessage.tool(output, call.id()));
            }
        }

        transcript.add(ChatMessage.assistant(MAX_ITERATIONS_MESSAGE));
        return completeTurn(context, userText, MAX_ITERATIONS_MESSAGE, transcript, usage);
    }

    private TurnResult completeTurn(
        ConversationContext context,
        String userText,
        String content,
        List<ChatMessage> transcript,
        Map<String, Object> usage
    ) {
        try {
            sessions.store().appendTurn(context.sessionId(), TurnRole.USER, userText);
            sessions.store().appendTurn(context.sessionId(), TurnRole.ASSISTANT, content);
        } catch (IOException e) {
            LOG.warn("Could not record turn for session {}: {}", context.sessionId(), e.getMessage());
            return new TurnResult(content, transcript, usage, null, null, false);
        }

        ExtractionOutcome outcome = extraction == null
            ? ExtractionOutcome.skipped("extraction disabled")
            : extraction.process(userText, content);

        SegmentationDecision decision = null;
        try {
            decision = segmentation.evaluate(context, userText, outcome);
        } catch (IOException e) {
            LOG.debug("Context segmentation skipped: {}", e.getMessage());
        }

        if (scheduler != null) {
            scheduler.recordTurn();
        }
        return new TurnResult(content, transcript, usage, outcome, decision, false);
    }

    private TurnResult abort(ConversationContext context, List<ChatMessage> transcript) {
        LOG.info("Turn aborted for session {}", context.sessionId());
        return TurnResult.aborted(transcript);
    }
}
