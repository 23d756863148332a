package com.kmg.analysis.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ClassificationPayload(JsonNode sentiment, JsonNode impact) {
}
