package com.programmersdiary.aigateway.agent;

public enum ProviderType {
    OPENAI, ANTHROPIC, OLLAMA, GEMINI
}
