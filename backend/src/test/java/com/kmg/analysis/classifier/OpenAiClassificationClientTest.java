package com.kmg.analysis.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.model.ContentItem;
import com.kmg.analysis.model.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiClassificationClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AnalysisProperties properties;
    private OpenAiClassificationClient client;

    @BeforeEach
    void setUp() {
        properties = new AnalysisProperties();
        properties.getClassifier().setApiKey("sk-test");
        properties.getClassifier().setContentMaxChars(20);
        client = new OpenAiClassificationClient(
                properties,
                new ModelCatalog(properties),
                new ClassificationResponseParser(objectMapper),
                objectMapper,
                RestClient.builder()
        );
    }

    @Test
    void chatModelsGetMaxTokensAndTemperature() {
        ObjectNode request = client.buildRequest(new ContentItem(7L, "Oil spikes", "Brent crude jumps after supply cut"), "gpt-4.1-nano");

        assertThat(request.get("model").asText()).isEqualTo("gpt-4.1-nano");
        assertThat(request.get("max_tokens").asInt()).isEqualTo(500);
        assertThat(request.get("temperature").asDouble()).isEqualTo(0.1);
        assertThat(request.has("max_completion_tokens")).isFalse();
        assertThat(request.at("/response_format/type").asText()).isEqualTo("json_object");
        String prompt = request.at("/messages/0/content").asText();
        assertThat(prompt).contains("Title: Oil spikes").contains("Summary: Brent crude jumps af\n");
    }

    @Test
    void reasoningModelsGetMaxCompletionTokensOnly() {
        ObjectNode request = client.buildRequest(new ContentItem(7L, "t", "s"), "o4-mini");

        assertThat(request.get("max_completion_tokens").asInt()).isEqualTo(500);
        assertThat(request.has("max_tokens")).isFalse();
        assertThat(request.has("temperature")).isFalse();
    }

    @Test
    void readsContentAndUsageFromEnvelope() throws Exception {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.putArray("choices").addObject().putObject("message")
                .put("content", "{\"overall\":{\"label\":\"positive\",\"score\":0.5},\"impact\":{\"overall\":0.4}}");
        envelope.putObject("usage").put("total_tokens", 321);

        ClassificationOutcome outcome = client.readResponse(objectMapper.writeValueAsString(envelope), 7L);

        assertThat(outcome.tokensUsed()).isEqualTo(321);
        assertThat(outcome.payload().sentiment().at("/overall/label").asText()).isEqualTo("positive");
    }

    @Test
    void missingUsageLeavesTokensUnknown() {
        ClassificationOutcome outcome = client.readResponse(
                "{\"choices\":[{\"message\":{\"content\":\"{\\\"overall\\\":{},\\\"impact\\\":{}}\"}}]}", 7L);

        assertThat(outcome.tokensUsed()).isNull();
    }

    @Test
    void malformedEnvelopeIsParseError() {
        assertThatThrownBy(() -> client.readResponse("<html>bad gateway</html>", 7L))
                .isInstanceOf(ClassificationException.class)
                .extracting(e -> ((ClassificationException) e).kind())
                .isEqualTo(FailureKind.PARSE_ERROR);
        assertThatThrownBy(() -> client.readResponse("{\"choices\":[]}", 7L))
                .isInstanceOf(ClassificationException.class)
                .extracting(e -> ((ClassificationException) e).kind())
                .isEqualTo(FailureKind.PARSE_ERROR);
    }

    @Test
    void missingApiKeyIsAuthError() {
        properties.getClassifier().setApiKey(" ");

        assertThatThrownBy(() -> client.classify(new ContentItem(1L, "t", "s"), null, Duration.ofSeconds(1)))
                .isInstanceOf(ClassificationException.class)
                .extracting(e -> ((ClassificationException) e).kind())
                .isEqualTo(FailureKind.AUTH_ERROR);
    }

    @Test
    void mapsHttpStatusToFailureKind() {
        assertThat(OpenAiClassificationClient.kindForStatus(429)).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(OpenAiClassificationClient.kindForStatus(401)).isEqualTo(FailureKind.AUTH_ERROR);
        assertThat(OpenAiClassificationClient.kindForStatus(403)).isEqualTo(FailureKind.AUTH_ERROR);
        assertThat(OpenAiClassificationClient.kindForStatus(502)).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(OpenAiClassificationClient.kindForStatus(408)).isEqualTo(FailureKind.TIMEOUT);
        assertThat(OpenAiClassificationClient.kindForStatus(400)).isEqualTo(FailureKind.UNKNOWN);
    }
}
