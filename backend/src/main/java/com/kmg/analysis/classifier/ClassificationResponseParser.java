package com.kmg.analysis.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kmg.analysis.model.ClassificationPayload;
import com.kmg.analysis.model.FailureKind;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class ClassificationResponseParser {
    private static final Set<String> LABELS = Set.of("positive", "neutral", "negative");
    private static final Set<String> MARKET_HORIZONS = Set.of("short", "medium", "long");
    private static final Set<String> GEO_HORIZONS = Set.of("immediate", "short_term", "long_term");
    private static final Set<String> CONFLICT_TYPES = Set.of("diplomatic", "economic", "hybrid", "interstate_war", "nuclear_threat");
    private static final int MAX_THEMES = 6;
    private static final int MAX_ENTITIES = 3;

    private final ObjectMapper objectMapper;

    public ClassificationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClassificationPayload parse(String content) {
        if (content == null || content.isBlank()) {
            throw new ClassificationException(FailureKind.PARSE_ERROR, "Empty classification response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ClassificationException(FailureKind.PARSE_ERROR, "Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationException(FailureKind.PARSE_ERROR, "Response is not a JSON object");
        }

        JsonNode overallIn = requireObject(root, "overall");
        JsonNode impactIn = requireObject(root, "impact");
        JsonNode marketIn = root.path("market");

        ObjectNode sentiment = objectMapper.createObjectNode();
        ObjectNode overall = sentiment.putObject("overall");
        overall.put("label", oneOf(overallIn.path("label"), LABELS, "neutral"));
        overall.put("score", number(overallIn, "score", 0.0, -1.0, 1.0));
        overall.put("confidence", number(overallIn, "confidence", 0.0, 0.0, 1.0));

        ObjectNode market = sentiment.putObject("market");
        market.put("bullish", number(marketIn, "bullish", 0.5, 0.0, 1.0));
        market.put("bearish", number(marketIn, "bearish", 0.5, 0.0, 1.0));
        market.put("uncertainty", number(marketIn, "uncertainty", 0.5, 0.0, 1.0));
        market.put("time_horizon", oneOf(marketIn.path("time_horizon"), MARKET_HORIZONS, "medium"));

        sentiment.put("urgency", number(root, "urgency", 0.0, 0.0, 1.0));
        sentiment.set("themes", strings(root.path("themes"), MAX_THEMES));
        sentiment.set("geopolitical", geopolitical(root.path("geopolitical")));

        ObjectNode impact = objectMapper.createObjectNode();
        impact.put("overall", number(impactIn, "overall", 0.0, 0.0, 1.0));
        impact.put("volatility", number(impactIn, "volatility", 0.0, 0.0, 1.0));

        return new ClassificationPayload(sentiment, impact);
    }

    private ObjectNode geopolitical(JsonNode geo) {
        if (!geo.isObject() || geo.isEmpty()) {
            return FallbackResults.emptyGeopolitical();
        }
        ObjectNode out = objectMapper.createObjectNode();
        out.put("stability_score", number(geo, "stability_score", 0.0, -1.0, 1.0));
        out.put("economic_impact", number(geo, "economic_impact", 0.0, -1.0, 1.0));
        out.put("security_relevance", number(geo, "security_relevance", 0.0, 0.0, 1.0));
        JsonNode diplomaticIn = geo.path("diplomatic_impact");
        ObjectNode diplomatic = out.putObject("diplomatic_impact");
        diplomatic.put("global", number(diplomaticIn, "global", 0.0, -1.0, 1.0));
        diplomatic.put("western", number(diplomaticIn, "western", 0.0, -1.0, 1.0));
        diplomatic.put("regional", number(diplomaticIn, "regional", 0.0, -1.0, 1.0));
        out.set("impact_beneficiaries", strings(geo.path("impact_beneficiaries"), MAX_ENTITIES));
        out.set("impact_affected", strings(geo.path("impact_affected"), MAX_ENTITIES));
        out.set("regions_affected", strings(geo.path("regions_affected"), Integer.MAX_VALUE));
        out.put("time_horizon", oneOf(geo.path("time_horizon"), GEO_HORIZONS, "short_term"));
        out.put("confidence", number(geo, "confidence", 0.0, 0.0, 1.0));
        out.put("escalation_potential", number(geo, "escalation_potential", 0.0, 0.0, 1.0));
        out.set("alliance_activation", strings(geo.path("alliance_activation"), Integer.MAX_VALUE));
        out.put("conflict_type", oneOf(geo.path("conflict_type"), CONFLICT_TYPES, "diplomatic"));
        return out;
    }

    private JsonNode requireObject(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isObject()) {
            throw new ClassificationException(FailureKind.PARSE_ERROR, "Response is missing the '" + field + "' object");
        }
        return node;
    }

    private double number(JsonNode parent, String field, double fallback, double min, double max) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new ClassificationException(FailureKind.PARSE_ERROR, "Field '" + field + "' is not a number", e);
            }
        } else {
            throw new ClassificationException(FailureKind.PARSE_ERROR, "Field '" + field + "' is not a number");
        }
        if (Double.isNaN(value)) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }

    private String oneOf(JsonNode node, Set<String> allowed, String fallback) {
        if (!node.isTextual()) {
            return fallback;
        }
        String value = node.asText().trim().toLowerCase();
        return allowed.contains(value) ? value : fallback;
    }

    private ArrayNode strings(JsonNode node, int limit) {
        ArrayNode out = objectMapper.createArrayNode();
        if (!node.isArray()) {
            return out;
        }
        for (JsonNode element : node) {
            if (out.size() >= limit) {
                break;
            }
            if (element.isNull()) {
                continue;
            }
            String text = element.isTextual() ? element.asText().trim() : element.toString();
            if (!text.isEmpty()) {
                out.add(text);
            }
        }
        return out;
    }
}
