package io.mnemo.core.segmentation;

import io.mnemo.core.extraction.ExtractionOutcome;
import io.mnemo.core.session.ConversationContext;
import io.mnemo.core.session.ConversationTurn;
import io.mnemo.core.session.SessionStore;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains the context window pointer of an open session. After each turn it checks the
 * commit, explicit and threshold triggers and, if one fires, moves the pointer past the turn.
 */
public final class ContextSegmentationController {
    private static final Logger LOG = LoggerFactory.getLogger(ContextSegmentationController.class);

    private final SessionStore sessions;
    private final SegmentationPolicy policy;

    public ContextSegmentationController(SessionStore sessions, SegmentationPolicy policy) {
        if (sessions == null) {
            throw new IllegalArgumentException("sessions must not be null");
        }
        this.sessions = sessions;
        this.policy = policy == null ? SegmentationPolicy.defaults() : policy;
    }

    public SegmentationDecision evaluate(ConversationContext context, String userText, ExtractionOutcome extraction)
        throws IOException {
        int current = sessions.get(context.sessionId()).windowStart();
        SegmentationTrigger trigger = trigger(context, userText, extraction);
        if (trigger == SegmentationTrigger.NONE) {
            return SegmentationDecision.unchanged(current);
        }

        int next = sessions.lastSeq(context.sessionId()) + 1;
        if (next <= current) {
            return new SegmentationDecision(trigger, current, current);
        }
        sessions.advanceWindow(context.sessionId(), next);
        int stored = sessions.get(context.sessionId()).windowStart();
        LOG.debug("Session {} window moved {} -> {} ({})", context.sessionId(), current, stored, trigger);
        return new SegmentationDecision(trigger, current, Math.max(current, stored));
    }

    public List<ConversationTurn> activeWindow(ConversationContext context) throws IOException {
        return sessions.activeWindow(context.sessionId());
    }

    private SegmentationTrigger trigger(ConversationContext context, String userText, ExtractionOutcome extraction)
        throws IOException {
        if (policy.isExplicitReset(userText)) {
            return SegmentationTrigger.EXPLICIT;
        }
        if (policy.resetOnCommit() && extraction != null && extraction.committedAnything()) {
            return SegmentationTrigger.COMMIT;
        }
        List<ConversationTurn> window = sessions.activeWindow(context.sessionId());
        int characters = 0;
        for (ConversationTurn turn : window) {
            characters += turn.content().length();
        }
        if (window.size() > policy.maxTurns()
            || SegmentationPolicy.estimateTokens(characters) > policy.maxEstimatedTokens()) {
            return SegmentationTrigger.THRESHOLD;
        }
        return SegmentationTrigger.NONE;
    }
}
