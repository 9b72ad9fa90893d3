package io.docflow.core;

import java.util.Properties;

/// Configuration options for the Docflow execution environment.
///
/// Use the {@link Builder} for fluent configuration, construct directly with
/// setters, or read from {@link Properties} with {@link #fromProperties(Properties)}.
///
/// ### Default Values
/// - `maxFileSizeMb`: `50`
/// - `ocrTimeoutSeconds`: `300`
/// - `mistralOcrUrl`: `"https://api.mistral.ai/v1/ocr"`
/// - `mistralModel`: `"mistral-ocr-latest"`
/// - `defaultModelId`: `"gpt-4o"`
/// - `defaultConfidence`: `0.95`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link DocflowFactory}.
/// Do not modify after environment creation.
///
/// @see DocflowFactory.Builder#config(DocflowConfig)
public class DocflowConfig {

    /// Prefix of configuration keys read by {@link #fromProperties(Properties)}.
    public static final String PROPERTY_PREFIX = "docflow.";

    private int maxFileSizeMb = 50;
    private int ocrTimeoutSeconds = 300;
    private String mistralOcrUrl = "https://api.mistral.ai/v1/ocr";
    private String mistralModel = "mistral-ocr-latest";
    private String defaultModelId = "gpt-4o";
    private double defaultConfidence = 0.95;

    /// Creates a configuration with default values.
    public DocflowConfig() {}

    /// Returns the largest accepted upload, in megabytes.
    public int getMaxFileSizeMb() {
        return maxFileSizeMb;
    }

    public void setMaxFileSizeMb(int maxFileSizeMb) {
        this.maxFileSizeMb = maxFileSizeMb;
    }

    /// Returns the largest accepted upload, in bytes.
    public long getMaxFileSizeBytes() {
        return (long) maxFileSizeMb * 1024 * 1024;
    }

    /// Returns the timeout of one OCR request, in seconds.
    public int getOcrTimeoutSeconds() {
        return ocrTimeoutSeconds;
    }

    public void setOcrTimeoutSeconds(int ocrTimeoutSeconds) {
        this.ocrTimeoutSeconds = ocrTimeoutSeconds;
    }

    public String getMistralOcrUrl() {
        return mistralOcrUrl;
    }

    public void setMistralOcrUrl(String mistralOcrUrl) {
        this.mistralOcrUrl = mistralOcrUrl;
    }

    public String getMistralModel() {
        return mistralModel;
    }

    public void setMistralModel(String mistralModel) {
        this.mistralModel = mistralModel;
    }

    /// Returns the extraction model used when a caller names none.
    public String getDefaultModelId() {
        return defaultModelId;
    }

    public void setDefaultModelId(String defaultModelId) {
        this.defaultModelId = defaultModelId;
    }

    /// Returns the OCR confidence assumed when the OCR service reports none.
    public double getDefaultConfidence() {
        return defaultConfidence;
    }

    public void setDefaultConfidence(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }

    /// Reads a configuration from properties, keeping defaults for absent keys.
    ///
    /// Recognized keys: `docflow.max-file-size-mb`, `docflow.ocr-timeout-seconds`,
    /// `docflow.mistral-ocr-url`, `docflow.mistral-model`, `docflow.default-model-id`,
    /// `docflow.default-confidence`.
    ///
    /// @param properties the properties, not null
    /// @return a new configuration, never null
    /// @throws IllegalArgumentException if a numeric key holds a non-numeric value
    public static DocflowConfig fromProperties(Properties properties) {
        DocflowConfig config = new DocflowConfig();
        String value = properties.getProperty(PROPERTY_PREFIX + "max-file-size-mb");
        if (value != null) {
            config.maxFileSizeMb = parseInt("max-file-size-mb", value);
        }
        value = properties.getProperty(PROPERTY_PREFIX + "ocr-timeout-seconds");
        if (value != null) {
            config.ocrTimeoutSeconds = parseInt("ocr-timeout-seconds", value);
        }
        config.mistralOcrUrl =
                properties.getProperty(PROPERTY_PREFIX + "mistral-ocr-url", config.mistralOcrUrl);
        config.mistralModel =
                properties.getProperty(PROPERTY_PREFIX + "mistral-model", config.mistralModel);
        config.defaultModelId =
                properties.getProperty(PROPERTY_PREFIX + "default-model-id", config.defaultModelId);
        value = properties.getProperty(PROPERTY_PREFIX + "default-confidence");
        if (value != null) {
            try {
                config.defaultConfidence = Double.parseDouble(value.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        PROPERTY_PREFIX + "default-confidence must be numeric: " + value, e);
            }
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    PROPERTY_PREFIX + key + " must be an integer: " + value, e);
        }
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link DocflowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final DocflowConfig config = new DocflowConfig();

        public Builder maxFileSizeMb(int maxFileSizeMb) {
            config.maxFileSizeMb = maxFileSizeMb;
            return this;
        }

        public Builder ocrTimeoutSeconds(int ocrTimeoutSeconds) {
            config.ocrTimeoutSeconds = ocrTimeoutSeconds;
            return this;
        }

        public Builder mistralOcrUrl(String mistralOcrUrl) {
            config.mistralOcrUrl = mistralOcrUrl;
            return this;
        }

        public Builder mistralModel(String mistralModel) {
            config.mistralModel = mistralModel;
            return this;
        }

        public Builder defaultModelId(String defaultModelId) {
            config.defaultModelId = defaultModelId;
            return this;
        }

        public Builder defaultConfidence(double defaultConfidence) {
            config.defaultConfidence = defaultConfidence;
            return this;
        }

        /// Builds and returns the configured {@link DocflowConfig} instance.
        ///
        /// @return the configured instance, never null
        public DocflowConfig build() {
            return config;
        }
    }
}
