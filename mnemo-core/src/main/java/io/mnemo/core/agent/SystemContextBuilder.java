package io.mnemo.core.agent;

import io.mnemo.core.goal.Goal;
import io.mnemo.core.goal.GoalStatus;
import io.mnemo.core.goal.GoalStore;
import io.mnemo.core.profile.ProfileStore;
import io.mnemo.core.retrieval.RelevanceRanker;
import io.mnemo.core.retrieval.ScoredMemory;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the system instruction: base prompt, profile attributes, active goals and memories
 * relevant to the incoming message. Each section is best effort.
 */
public final class SystemContextBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(SystemContextBuilder.class);

    private final ProfileStore profile;
    private final GoalStore goals;
    private final RelevanceRanker ranker;

    public SystemContextBuilder(ProfileStore profile, GoalStore goals, RelevanceRanker ranker) {
        this.profile = profile;
        this.goals = goals;
        this.ranker = ranker;
    }

    public String build(String basePrompt, String userText, int recallLimit) {
        StringBuilder prompt = new StringBuilder(basePrompt == null ? "" : basePrompt);

        if (profile != null) {
            try {
                String formatted = profile.formatForPrompt();
                if (!formatted.isBlank()) {
                    prompt.append("\n\n").append(formatted.strip());
                }
            } catch (IOException e) {
                LOG.debug("Profile prompt injection skipped: {}", e.getMessage());
            }
        }

        if (goals != null) {
            try {
                List<Goal> active = goals.list(GoalStatus.ACTIVE);
                if (!active.isEmpty()) {
                    prompt.append("\n\n## Active Goals\n\n");
                    active.forEach(goal -> prompt.append(formatGoal(goal)).append("\n"));
                }
            } catch (IOException e) {
                LOG.debug("Goal prompt injection skipped: {}", e.getMessage());
            }
        }

        if (ranker != null && recallLimit > 0 && userText != null && !userText.isBlank()) {
            try {
                List<ScoredMemory> recalled = ranker.rank(userText, null, recallLimit).stream()
                    .filter(hit -> hit.textMatch() > 0)
                    .toList();
                if (!recalled.isEmpty()) {
                    prompt.append("\n\n## Recalled Memories (relevant)\n\n");
                    recalled.forEach(hit -> prompt.append("- ").append(hit.record().content()).append("\n"));
                }
            } catch (IOException e) {
                LOG.debug("Memory prompt injection skipped: {}", e.getMessage());
            }
        }
        return prompt.toString().strip();
    }

    static String formatGoal(Goal goal) {
        StringBuilder line = new StringBuilder("- [").append(goal.id()).append("] ").append(goal.title());
        line.append(" (priority: ").append(goal.priority().value());
        line.append(", progress: ").append(goal.progress()).append('%');
        if (goal.deadline() != null) {
            line.append(", deadline: ").append(goal.deadline());
        }
        return line.append(')').toString();
    }
}
