package com.kmg.analysis.classifier;

import com.fasterxml.jackson.databind.node.ObjectNode;

public class ReasoningModelStrategy implements ModelRequestStrategy {
    @Override
    public ModelCapability capability() {
        return ModelCapability.REASONING;
    }

    @Override
    public void applyTo(ObjectNode request, int maxOutputTokens) {
        request.put("max_completion_tokens", maxOutputTokens);
    }
}
