package com.kmg.analysis.classifier;

import com.kmg.analysis.config.AnalysisProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ModelCatalog {
    private static final List<String> REASONING_PREFIXES = List.of("gpt-5", "o3", "o4");

    private static final Map<String, Double> INPUT_PRICES = Map.of(
            "gpt-4.1-nano", 0.020,
            "gpt-4o-mini", 0.025,
            "gpt-4.1-mini", 0.070,
            "o4-mini", 0.200,
            "gpt-4.1", 0.350,
            "gpt-4o", 0.425
    );

    private final String defaultModel;
    private final Map<String, ModelProfile> profiles = new ConcurrentHashMap<>();
    private final Map<ModelCapability, ModelRequestStrategy> strategies = new EnumMap<>(ModelCapability.class);

    public ModelCatalog(AnalysisProperties properties) {
        this.defaultModel = properties.getClassifier().getDefaultModel();
        register(new ChatCompletionsStrategy());
        register(new ReasoningModelStrategy());
    }

    private void register(ModelRequestStrategy strategy) {
        strategies.put(strategy.capability(), strategy);
    }

    public String resolveTag(String modelTag) {
        if (modelTag == null || modelTag.isBlank()) {
            return defaultModel;
        }
        return modelTag.trim();
    }

    public ModelProfile profileFor(String modelTag) {
        String tag = resolveTag(modelTag);
        return profiles.computeIfAbsent(tag, this::buildProfile);
    }

    public ModelRequestStrategy strategyFor(String modelTag) {
        return strategies.get(profileFor(modelTag).capability());
    }

    public double costFor(String modelTag, int tokens) {
        return tokens * profileFor(modelTag).inputPricePerMillion() / 1_000_000.0;
    }

    private ModelProfile buildProfile(String tag) {
        ModelCapability capability = ModelCapability.CHAT;
        for (String prefix : REASONING_PREFIXES) {
            if (tag.startsWith(prefix)) {
                capability = ModelCapability.REASONING;
                break;
            }
        }
        Double price = INPUT_PRICES.get(tag);
        if (price == null) {
            price = INPUT_PRICES.getOrDefault(defaultModel, INPUT_PRICES.get("gpt-4.1-nano"));
        }
        return new ModelProfile(tag, capability, price);
    }
}
