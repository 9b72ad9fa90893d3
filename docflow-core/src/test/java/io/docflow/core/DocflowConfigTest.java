package io.docflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class DocflowConfigTest {

    @Test
    void shouldUseDefaults() {
        DocflowConfig config = new DocflowConfig();

        assertThat(config.getMaxFileSizeMb()).isEqualTo(50);
        assertThat(config.getMaxFileSizeBytes()).isEqualTo(50L * 1024 * 1024);
        assertThat(config.getOcrTimeoutSeconds()).isEqualTo(300);
        assertThat(config.getMistralOcrUrl()).isEqualTo("https://api.mistral.ai/v1/ocr");
        assertThat(config.getMistralModel()).isEqualTo("mistral-ocr-latest");
        assertThat(config.getDefaultModelId()).isEqualTo("gpt-4o");
        assertThat(config.getDefaultConfidence()).isEqualTo(0.95);
    }

    @Test
    void shouldReadPropertiesAndKeepDefaultsForAbsentKeys() {
        Properties properties = new Properties();
        properties.setProperty("docflow.max-file-size-mb", " 10 ");
        properties.setProperty("docflow.default-model-id", "claude-sonnet-4");
        properties.setProperty("docflow.default-confidence", "0.7");

        DocflowConfig config = DocflowConfig.fromProperties(properties);

        assertThat(config.getMaxFileSizeMb()).isEqualTo(10);
        assertThat(config.getDefaultModelId()).isEqualTo("claude-sonnet-4");
        assertThat(config.getDefaultConfidence()).isEqualTo(0.7);
        assertThat(config.getOcrTimeoutSeconds()).isEqualTo(300);
    }

    @Test
    void shouldRejectNonNumericValues() {
        Properties properties = new Properties();
        properties.setProperty("docflow.ocr-timeout-seconds", "soon");

        assertThatThrownBy(() -> DocflowConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("docflow.ocr-timeout-seconds must be an integer: soon");
    }
}
