package com.kmg.analysis.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kmg.analysis.config.AnalysisProperties;
import com.kmg.analysis.model.ContentItem;
import com.kmg.analysis.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class OpenAiClassificationClient implements ClassificationClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiClassificationClient.class);

    private final AnalysisProperties properties;
    private final ModelCatalog modelCatalog;
    private final ClassificationResponseParser responseParser;
    private final ObjectMapper objectMapper;
    private final RestClient.Builder restClientBuilder;
    private final Map<Duration, RestClient> clients = new ConcurrentHashMap<>();

    public OpenAiClassificationClient(
            AnalysisProperties properties,
            ModelCatalog modelCatalog,
            ClassificationResponseParser responseParser,
            ObjectMapper objectMapper,
            RestClient.Builder restClientBuilder
    ) {
        this.properties = properties;
        this.modelCatalog = modelCatalog;
        this.responseParser = responseParser;
        this.objectMapper = objectMapper;
        this.restClientBuilder = restClientBuilder;
    }

    @Override
    public ClassificationOutcome classify(ContentItem item, String modelTag, Duration timeout) {
        String apiKey = properties.getClassifier().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ClassificationException(FailureKind.AUTH_ERROR, "Classifier API key is not configured");
        }

        String model = modelCatalog.resolveTag(modelTag);
        ObjectNode request = buildRequest(item, model);

        String body;
        try {
            body = clientFor(timeout).post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new ClassificationException(kindForStatus(e.getStatusCode().value()),
                    "Classifier returned HTTP " + e.getStatusCode().value() + ": " + abbreviate(e.getResponseBodyAsString()), e);
        } catch (ResourceAccessException e) {
            throw new ClassificationException(FailureKind.TIMEOUT, "Classifier call failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ClassificationException(FailureKind.UNKNOWN, "Classifier call failed: " + e.getMessage(), e);
        }

        return readResponse(body, item.id());
    }

    ObjectNode buildRequest(ContentItem item, String model) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);
        ObjectNode message = request.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", ClassificationPrompt.build(item, properties.getClassifier().getContentMaxChars()));
        request.putObject("response_format").put("type", "json_object");
        modelCatalog.strategyFor(model).applyTo(request, properties.getClassifier().getMaxOutputTokens());
        return request;
    }

    ClassificationOutcome readResponse(String body, long contentItemId) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ClassificationException(FailureKind.PARSE_ERROR, "Classifier envelope is not JSON", e);
        }
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new ClassificationException(FailureKind.PARSE_ERROR, "Classifier response has no message content");
        }

        JsonNode totalTokens = root.path("usage").path("total_tokens");
        Integer tokensUsed = totalTokens.isNumber() ? totalTokens.asInt() : null;
        if (tokensUsed == null) {
            log.debug("No usage reported for content item {}", contentItemId);
        }
        return new ClassificationOutcome(responseParser.parse(content.asText()), tokensUsed);
    }

    static FailureKind kindForStatus(int status) {
        if (status == 429) {
            return FailureKind.RATE_LIMITED;
        }
        if (status == 401 || status == 403) {
            return FailureKind.AUTH_ERROR;
        }
        if (status >= 500) {
            return FailureKind.SERVER_ERROR;
        }
        if (status == 408) {
            return FailureKind.TIMEOUT;
        }
        return FailureKind.UNKNOWN;
    }

    private RestClient clientFor(Duration timeout) {
        Duration effective = timeout == null ? properties.getClassifier().getCallTimeout() : timeout;
        return clients.computeIfAbsent(effective, this::createClient);
    }

    private RestClient createClient(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        return restClientBuilder.clone()
                .baseUrl(properties.getClassifier().getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    private String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > 200 ? value.substring(0, 200) + "..." : value;
    }
}
