package com.programmersdiary.aigateway.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Optional;

/**
 * Model providers available to scheduled agent turns, bound from {@code aigateway.agent.*}.
 */
@ConfigurationProperties(prefix = "aigateway.agent")
public record AgentProperties(
        String defaultProvider,
        String systemInstructions,
        Integer sharedSessionMaxMessages,
        List<ProviderConfig> providers) {

    public AgentProperties {
        if (providers == null) providers = List.of();
        if (systemInstructions == null) systemInstructions = "";
        if (sharedSessionMaxMessages == null || sharedSessionMaxMessages < 0) sharedSessionMaxMessages = 20;
    }

    /**
     * The named provider, else the default one, else the first configured one.
     */
    public Optional<ProviderConfig> resolve(String providerId) {
        var wanted = providerId != null && !providerId.isBlank() ? providerId : defaultProvider;
        if (wanted == null || wanted.isBlank()) {
            return providers.stream().findFirst();
        }
        return providers.stream().filter(p -> wanted.equals(p.id())).findFirst();
    }
}
