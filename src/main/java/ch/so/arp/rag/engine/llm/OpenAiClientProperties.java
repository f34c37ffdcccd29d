package ch.so.arp.rag.engine.llm;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Settings of the OpenAI compatible service answering queries, bound from
 * {@code rag.chat.openai.*}. The API key falls back to
 * {@code spring.ai.openai.api-key}.
 */
@ConfigurationProperties(prefix = "rag.chat.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    static final String FALLBACK_API_KEY_PROPERTY = "spring.ai.openai.api-key";

    private String apiKey;

    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Chat model used when the query does not name one in its parameters.
     */
    private String model = "gpt-4o-mini";

    /**
     * Read timeout of a single completion request.
     */
    private Duration timeout = Duration.ofSeconds(300);

    /**
     * Instruction placed in front of the retrieved context.
     */
    private String systemPrompt = "Answer the question using only the following context. "
            + "If the context does not contain the answer, say so.";

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey) || environment == null) {
            return apiKey;
        }
        return environment.getProperty(FALLBACK_API_KEY_PROPERTY);
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
