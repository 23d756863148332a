package com.kmg.analysis.classifier;

import com.fasterxml.jackson.databind.node.ObjectNode;

public class ChatCompletionsStrategy implements ModelRequestStrategy {
    static final double TEMPERATURE = 0.1;

    @Override
    public ModelCapability capability() {
        return ModelCapability.CHAT;
    }

    @Override
    public void applyTo(ObjectNode request, int maxOutputTokens) {
        request.put("max_tokens", maxOutputTokens);
        request.put("temperature", TEMPERATURE);
    }
}
