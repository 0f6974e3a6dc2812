package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.agent.AgentSettings;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    @JsonAlias({"system_prompt"}) String systemPrompt,
    @JsonAlias({"max_tool_iterations"}) int maxToolIterations
) {

    public static AgentConfig defaults() {
        return new AgentConfig(AgentSettings.DEFAULT_SYSTEM_PROMPT, 8);
    }

    public AgentSettings toSettings(String model, int recallLimit) {
        return new AgentSettings(systemPrompt, model, maxToolIterations, recallLimit);
    }
}
