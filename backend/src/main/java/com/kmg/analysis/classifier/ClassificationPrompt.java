package com.kmg.analysis.classifier;

import com.kmg.analysis.model.ContentItem;

final class ClassificationPrompt {
    private ClassificationPrompt() {
    }

    static String build(ContentItem item, int contentMaxChars) {
        String title = item.title() == null ? "" : item.title();
        String summary = item.summary() == null ? "" : item.summary();
        if (summary.length() > contentMaxChars) {
            summary = summary.substring(0, contentMaxChars);
        }
        return """
                You are a precise financial and geopolitical news classifier. Return STRICT JSON only.

                Title: %s
                Summary: %s

                Return this exact JSON structure:
                {
                  "overall": {"label": "positive|neutral|negative", "score": -1.0 to 1.0, "confidence": 0.0 to 1.0},
                  "market": {"bullish": 0.0 to 1.0, "bearish": 0.0 to 1.0, "uncertainty": 0.0 to 1.0, "time_horizon": "short|medium|long"},
                  "urgency": 0.0 to 1.0,
                  "impact": {"overall": 0.0 to 1.0, "volatility": 0.0 to 1.0},
                  "themes": ["max", "6", "strings"],
                  "geopolitical": {
                    "stability_score": -1.0 to 1.0,
                    "economic_impact": -1.0 to 1.0,
                    "security_relevance": 0.0 to 1.0,
                    "diplomatic_impact": {"global": -1.0 to 1.0, "western": -1.0 to 1.0, "regional": -1.0 to 1.0},
                    "impact_beneficiaries": ["max 3 ISO3166/Blocs"],
                    "impact_affected": ["max 3 ISO3166/Blocs"],
                    "regions_affected": ["regions"],
                    "time_horizon": "immediate|short_term|long_term",
                    "confidence": 0.0 to 1.0,
                    "escalation_potential": 0.0 to 1.0,
                    "alliance_activation": ["alliances/treaties"],
                    "conflict_type": "diplomatic|economic|hybrid|interstate_war|nuclear_threat"
                  }
                }

                Entity Standards:
                - Countries: ISO 3166-1 Alpha-2 (US, DE, FR, CN, RU, UA, etc.)
                - Blocs: EU, NATO, ASEAN, BRICS, G7, UN, OPEC
                - Regions: Middle_East, Eastern_Europe, Asia_Pacific, Latin_America, Sub_Saharan_Africa
                - Markets: Energy_Markets, Financial_Markets, Global_Trade, Commodity_Markets
                - Max 3 entries for impact_beneficiaries and impact_affected
                - If news is not geopolitically relevant, set all geopolitical scores to 0.0 and arrays to []
                """.formatted(title, summary);
    }
}
