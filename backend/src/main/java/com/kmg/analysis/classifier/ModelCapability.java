package com.kmg.analysis.classifier;

public enum ModelCapability {
    CHAT,
    REASONING
}
