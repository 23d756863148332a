package com.kmg.analysis.classifier;

import com.kmg.analysis.config.AnalysisProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ModelCatalogTest {

    private final ModelCatalog catalog = new ModelCatalog(new AnalysisProperties());

    @Test
    void blankTagResolvesToDefaultModel() {
        assertThat(catalog.resolveTag(null)).isEqualTo("gpt-4.1-nano");
        assertThat(catalog.resolveTag("  ")).isEqualTo("gpt-4.1-nano");
        assertThat(catalog.resolveTag(" gpt-4o ")).isEqualTo("gpt-4o");
    }

    @Test
    void reasoningFamiliesUseReasoningStrategy() {
        assertThat(catalog.profileFor("o4-mini").capability()).isEqualTo(ModelCapability.REASONING);
        assertThat(catalog.profileFor("gpt-5-mini").capability()).isEqualTo(ModelCapability.REASONING);
        assertThat(catalog.strategyFor("o3")).isInstanceOf(ReasoningModelStrategy.class);
        assertThat(catalog.strategyFor("gpt-4o-mini")).isInstanceOf(ChatCompletionsStrategy.class);
    }

    @Test
    void costUsesInputPricePerMillionTokens() {
        assertThat(catalog.costFor("gpt-4o", 1_000_000)).isCloseTo(0.425, within(1e-9));
        assertThat(catalog.costFor("gpt-4.1-nano", 500)).isCloseTo(0.00001, within(1e-12));
        // unknown tags are priced like the default model
        assertThat(catalog.costFor("custom-model", 1_000_000)).isCloseTo(0.020, within(1e-9));
    }

    @Test
    void profilesAreCached() {
        assertThat(catalog.profileFor("gpt-4o")).isSameAs(catalog.profileFor("gpt-4o"));
    }
}
