package io.docflow.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class LangChain4jModelFactoryTest {

    private static final Map<String, String> CREDENTIALS =
            Map.of(
                    "OPENAI_API_KEY", "sk-openai",
                    "ANTHROPIC_API_KEY", "sk-anthropic",
                    "GOOGLE_API_KEY", "g-key",
                    "DEEPSEEK_API_KEY", "ds-key");

    private final LangChain4jModelFactory factory = new LangChain4jModelFactory();

    @ParameterizedTest
    @CsvSource({
        "gpt-4o, OpenAiChatModel",
        "o3-mini, OpenAiChatModel",
        "deepseek-chat, OpenAiChatModel",
        "claude-sonnet-4, AnthropicChatModel",
        "gemini-2.0-flash, GoogleAiGeminiChatModel"
    })
    void shouldPickProviderByPrefix(String modelName, String expectedType) {
        assertThat(factory.createModel(modelName, CREDENTIALS).getClass().getSimpleName())
                .isEqualTo(expectedType);
    }

    @Test
    void shouldFallBackToLangExtractKeyForOpenAi() {
        assertThat(factory.createModel("gpt-4o", Map.of("LANGEXTRACT_API_KEY", "lx")))
                .isInstanceOf(OpenAiChatModel.class);
    }

    @Test
    void shouldFailWithoutProviderKey() {
        assertThatThrownBy(() -> factory.createModel("claude-sonnet-4", Map.of("OPENAI_API_KEY", "k")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("API key not found. Provide one of: ANTHROPIC_API_KEY, anthropic_api_key");
    }

    @ParameterizedTest
    @ValueSource(strings = {"llama3", "mistral-large"})
    void shouldRejectUnsupportedModels(String modelName) {
        assertThat(factory.supportsModel(modelName)).isFalse();
        assertThatThrownBy(() -> factory.createModel(modelName, CREDENTIALS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported model: " + modelName);
    }

    @Test
    void shouldSupportKnownPrefixes() {
        assertThat(factory.supportsModel("gpt-4o-mini")).isTrue();
        assertThat(factory.supportsModel("gemma-3")).isTrue();
        assertThat(factory.supportsModel(null)).isFalse();
    }
}
