package io.mnemo.core.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.extraction.ExtractionOutcome;
import io.mnemo.core.extraction.ExtractionState;
import io.mnemo.core.session.ConversationContext;
import io.mnemo.core.session.ConversationTurn;
import io.mnemo.core.session.SqliteSessionStore;
import io.mnemo.core.session.TurnRole;
import io.mnemo.core.store.SqliteDatabase;
import io.mnemo.core.support.MutableClock;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContextSegmentationControllerTest {

    @TempDir
    Path tempDir;

    private SqliteSessionStore sessions;
    private ConversationContext context;

    @BeforeEach
    void setUp() throws Exception {
        sessions = new SqliteSessionStore(
            new SqliteDatabase(tempDir.resolve("mnemo.db")),
            MutableClock.at("2026-03-01T10:00:00Z")
        );
        context = ConversationContext.of(sessions.open("chat-1"));
    }

    @Test
    void shouldKeepWindowWhenNothingFires() throws Exception {
        ContextSegmentationController controller = controller(SegmentationPolicy.defaults());
        exchange("how is the weather", "sunny");

        SegmentationDecision decision = controller.evaluate(context, "how is the weather", nothingCommitted());

        assertThat(decision.trigger()).isEqualTo(SegmentationTrigger.NONE);
        assertThat(decision.advanced()).isFalse();
        assertThat(controller.activeWindow(context)).hasSize(2);
    }

    @Test
    void shouldResetOnExplicitTopicChange() throws Exception {
        ContextSegmentationController controller = controller(SegmentationPolicy.defaults());
        exchange("Let's talk about something different", "Sure");

        SegmentationDecision decision = controller.evaluate(
            context, "Let's talk about something different", nothingCommitted());

        assertThat(decision.trigger()).isEqualTo(SegmentationTrigger.EXPLICIT);
        assertThat(decision.windowStart()).isEqualTo(3);
        assertThat(controller.activeWindow(context)).isEmpty();
    }

    @Test
    void shouldRecognizeJapaneseTopicChange() {
        SegmentationPolicy policy = SegmentationPolicy.defaults();

        assertThat(policy.isExplicitReset("ちょっと話題を変えましょう")).isTrue();
        assertThat(policy.isExplicitReset("今日は晴れです")).isFalse();
        assertThat(policy.isExplicitReset("")).isFalse();
    }

    @Test
    void shouldResetAfterCommitOnlyWhenEnabled() throws Exception {
        exchange("I work as a teacher", "Nice");
        ExtractionOutcome committed = new ExtractionOutcome(
            ExtractionState.COMMITTED, List.of(ExtractionState.COMMITTED), 1, 0, 0, 0, null);

        SegmentationDecision disabled = controller(new SegmentationPolicy(false, 20, 3000, null))
            .evaluate(context, "I work as a teacher", committed);
        assertThat(disabled.trigger()).isEqualTo(SegmentationTrigger.NONE);

        SegmentationDecision enabled = controller(SegmentationPolicy.defaults())
            .evaluate(context, "I work as a teacher", committed);
        assertThat(enabled.trigger()).isEqualTo(SegmentationTrigger.COMMIT);
        assertThat(enabled.previousStart()).isEqualTo(1);
        assertThat(enabled.windowStart()).isEqualTo(3);
    }

    @Test
    void shouldResetWhenWindowExceedsTurnBudget() throws Exception {
        ContextSegmentationController controller = controller(new SegmentationPolicy(true, 3, 3000, List.of()));
        exchange("one", "a");

        assertThat(controller.evaluate(context, "one", nothingCommitted()).trigger())
            .isEqualTo(SegmentationTrigger.NONE);

        exchange("two", "b");
        SegmentationDecision decision = controller.evaluate(context, "two", nothingCommitted());

        assertThat(decision.trigger()).isEqualTo(SegmentationTrigger.THRESHOLD);
        assertThat(decision.windowStart()).isEqualTo(5);
    }

    @Test
    void shouldResetWhenWindowExceedsTokenEstimate() throws Exception {
        ContextSegmentationController controller = controller(new SegmentationPolicy(true, 100, 10, List.of()));
        exchange("x".repeat(30), "y".repeat(30));

        SegmentationDecision decision = controller.evaluate(context, "x".repeat(30), nothingCommitted());

        assertThat(decision.trigger()).isEqualTo(SegmentationTrigger.THRESHOLD);
    }

    @Test
    void shouldNeverMoveWindowBackwards() throws Exception {
        ContextSegmentationController controller = controller(SegmentationPolicy.defaults());
        exchange("new topic please", "ok");
        SegmentationDecision first = controller.evaluate(context, "new topic please", nothingCommitted());

        SegmentationDecision repeated = controller.evaluate(context, "new topic please", nothingCommitted());

        assertThat(first.windowStart()).isEqualTo(3);
        assertThat(repeated.windowStart()).isEqualTo(3);
        assertThat(repeated.advanced()).isFalse();

        exchange("what about cooking", "sure");
        List<ConversationTurn> window = controller.activeWindow(context);
        assertThat(window).extracting(ConversationTurn::seq).containsExactly(3, 4);
        assertThat(sessions.advanceWindow(context.sessionId(), 2)).isFalse();
        assertThat(sessions.get(context.sessionId()).windowStart()).isEqualTo(3);
    }

    @Test
    void shouldRejectInvalidPolicy() {
        assertThatThrownBy(() -> new SegmentationPolicy(true, 0, 3000, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SegmentationPolicy(true, 5, 3000, List.of("(unclosed")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private ContextSegmentationController controller(SegmentationPolicy policy) {
        return new ContextSegmentationController(sessions, policy);
    }

    private void exchange(String user, String assistant) throws Exception {
        sessions.appendTurn(context.sessionId(), TurnRole.USER, user);
        sessions.appendTurn(context.sessionId(), TurnRole.ASSISTANT, assistant);
    }

    private static ExtractionOutcome nothingCommitted() {
        return ExtractionOutcome.skipped("extraction disabled");
    }
}
