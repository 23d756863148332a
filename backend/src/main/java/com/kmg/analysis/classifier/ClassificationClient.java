package com.kmg.analysis.classifier;

import com.kmg.analysis.model.ContentItem;

import java.time.Duration;

public interface ClassificationClient {
    ClassificationOutcome classify(ContentItem item, String modelTag, Duration timeout);
}
