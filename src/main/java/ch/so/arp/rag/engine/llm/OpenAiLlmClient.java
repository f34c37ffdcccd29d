package ch.so.arp.rag.engine.llm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.rag.engine.BackendUnavailableException;

/**
 * Calls the {@code /chat/completions} endpoint of an OpenAI compatible
 * service. The retrieved context goes into a system message, the question
 * into the user message; parameters are copied into the request body.
 */
public class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final RestClient restClient;
    private final String model;
    private final String systemPrompt;

    public OpenAiLlmClient(RestClient restClient, OpenAiClientProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property '" + OpenAiClientProperties.FALLBACK_API_KEY_PROPERTY
                            + "' must be provided when mocks are disabled");
        }
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = properties.getModel();
        this.systemPrompt = properties.getSystemPrompt();
    }

    @Override
    public String complete(String question, List<String> context, Map<String, Object> parameters) {
        Map<String, Object> body = new LinkedHashMap<>(parameters);
        body.putIfAbsent("model", model);
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", systemPrompt + "\n\n" + String.join("\n\n", context)));
        messages.add(Map.of("role", "user", "content", question));
        body.put("messages", messages);
        LOGGER.debug("Requesting completion from model {} with {} context snippets", body.get("model"),
                context.size());

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException ex) {
            throw new BackendUnavailableException("Completion service unreachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            LOGGER.error("Completion request failed: {}", ex.getMessage());
            throw new IllegalStateException("Completion request failed: " + ex.getMessage(), ex);
        }
        JsonNode choice = response == null ? null : response.path("choices").path(0);
        if (choice == null || choice.isMissingNode()) {
            LOGGER.warn("Completion response without choices");
            return "";
        }
        return choice.path("message").path("content").asText("");
    }

    @Override
    public String model() {
        return model;
    }
}
