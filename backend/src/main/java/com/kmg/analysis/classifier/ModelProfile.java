package com.kmg.analysis.classifier;

public record ModelProfile(String tag, ModelCapability capability, double inputPricePerMillion) {
}
