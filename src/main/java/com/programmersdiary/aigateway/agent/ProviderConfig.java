package com.programmersdiary.aigateway.agent;

public record ProviderConfig(
        String id,
        ProviderType type,
        String apiKey,
        String baseUrl,
        String model) {
}
