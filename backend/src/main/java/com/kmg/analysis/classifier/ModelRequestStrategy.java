package com.kmg.analysis.classifier;

import com.fasterxml.jackson.databind.node.ObjectNode;

public interface ModelRequestStrategy {
    ModelCapability capability();

    void applyTo(ObjectNode request, int maxOutputTokens);
}
