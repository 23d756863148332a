package com.kmg.analysis.classifier;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kmg.analysis.model.ClassificationPayload;

public final class FallbackResults {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private FallbackResults() {
    }

    public static ClassificationPayload neutral() {
        ObjectNode sentiment = NODES.objectNode();
        ObjectNode overall = sentiment.putObject("overall");
        overall.put("label", "neutral");
        overall.put("score", 0.0);
        overall.put("confidence", 0.0);
        ObjectNode market = sentiment.putObject("market");
        market.put("bullish", 0.5);
        market.put("bearish", 0.5);
        market.put("uncertainty", 0.5);
        market.put("time_horizon", "medium");
        sentiment.put("urgency", 0.0);
        sentiment.putArray("themes");
        sentiment.set("geopolitical", emptyGeopolitical());

        ObjectNode impact = NODES.objectNode();
        impact.put("overall", 0.0);
        impact.put("volatility", 0.0);
        return new ClassificationPayload(sentiment, impact);
    }

    static ObjectNode emptyGeopolitical() {
        ObjectNode geo = NODES.objectNode();
        geo.put("stability_score", 0.0);
        geo.put("economic_impact", 0.0);
        geo.put("security_relevance", 0.0);
        ObjectNode diplomatic = geo.putObject("diplomatic_impact");
        diplomatic.put("global", 0.0);
        diplomatic.put("western", 0.0);
        diplomatic.put("regional", 0.0);
        geo.putArray("impact_beneficiaries");
        geo.putArray("impact_affected");
        geo.putArray("regions_affected");
        geo.put("time_horizon", "short_term");
        geo.put("confidence", 0.0);
        geo.put("escalation_potential", 0.0);
        geo.putArray("alliance_activation");
        geo.put("conflict_type", "diplomatic");
        return geo;
    }
}
