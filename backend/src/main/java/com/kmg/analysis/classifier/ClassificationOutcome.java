package com.kmg.analysis.classifier;

import com.kmg.analysis.model.ClassificationPayload;

public record ClassificationOutcome(ClassificationPayload payload, Integer tokensUsed) {
}
