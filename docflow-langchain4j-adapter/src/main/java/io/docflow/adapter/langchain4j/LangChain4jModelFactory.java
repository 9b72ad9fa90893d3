package io.docflow.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// Creates LangChain4j {@link ChatModel}s for extraction, picking the provider from the
/// model name prefix.
///
/// ```
/// prefix                 provider    credential keys (first found wins)
/// ———————————————————————+———————————+——————————————————————————————————————————————
/// claude                 │ Anthropic │ ANTHROPIC_API_KEY, anthropic_api_key
/// gpt, o1, o3, o4        │ OpenAI    │ OPENAI_API_KEY, LANGEXTRACT_API_KEY, openai_api_key
/// gemini, gemma          │ Google    │ GOOGLE_API_KEY, LANGEXTRACT_API_KEY, google_api_key
/// deepseek               │ DeepSeek  │ DEEPSEEK_API_KEY, deepseek_api_key
/// ```
///
/// DeepSeek uses the OpenAI-compatible API with a custom base URL.
///
/// @implNote Stateless and thread-safe. Each call creates a new model instance.
public class LangChain4jModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    private static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    static final int DEFAULT_MAX_TOKENS = 4096;
    static final long DEFAULT_TIMEOUT_SECONDS = 60;
    static final double DEFAULT_TEMPERATURE = 0.0;

    private final double temperature;
    private final int maxTokens;
    private final Duration timeout;

    public LangChain4jModelFactory() {
        this(DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS));
    }

    public LangChain4jModelFactory(double temperature, int maxTokens, Duration timeout) {
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.timeout = timeout;
    }

    /// Returns whether a model name maps to a supported provider.
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || isOpenAi(modelName)
                || modelName.startsWith("gemini")
                || modelName.startsWith("gemma")
                || modelName.startsWith("deepseek");
    }

    /// Creates the chat model for a model name.
    ///
    /// @param modelName model identifier, e.g. `gpt-4o`, not null
    /// @param credentials API keys, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if the provider's API key is missing
    public ChatModel createModel(String modelName, Map<String, String> credentials) {
        logger.info("Creating LangChain4j chat model: " + modelName);

        if (modelName == null) {
            throw new IllegalArgumentException("Unsupported model: null");
        }
        if (modelName.startsWith("claude")) {
            return AnthropicChatModel.builder()
                    .apiKey(requireApiKey(credentials, "ANTHROPIC_API_KEY", "anthropic_api_key"))
                    .modelName(modelName)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .timeout(timeout)
                    .build();
        } else if (isOpenAi(modelName)) {
            return createOpenAiModel(
                    modelName,
                    requireApiKey(
                            credentials, "OPENAI_API_KEY", "LANGEXTRACT_API_KEY", "openai_api_key"),
                    null);
        } else if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(
                            requireApiKey(
                                    credentials,
                                    "GOOGLE_API_KEY",
                                    "LANGEXTRACT_API_KEY",
                                    "google_api_key"))
                    .modelName(modelName)
                    .temperature(temperature)
                    .maxOutputTokens(maxTokens)
                    .timeout(timeout)
                    .build();
        } else if (modelName.startsWith("deepseek")) {
            return createOpenAiModel(
                    modelName,
                    requireApiKey(credentials, "DEEPSEEK_API_KEY", "deepseek_api_key"),
                    DEEPSEEK_BASE_URL);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private ChatModel createOpenAiModel(String modelName, String apiKey, String baseUrl) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .maxTokens(maxTokens)
                        .timeout(timeout);

        // Reasoning models reject a temperature other than the default
        if (!modelName.startsWith("o")) builder.temperature(temperature);
        if (baseUrl != null) builder.baseUrl(baseUrl);

        return builder.build();
    }

    private static boolean isOpenAi(String modelName) {
        return modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("o3")
                || modelName.startsWith("o4");
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @throws IllegalStateException if no key name resolves to a non-blank value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
