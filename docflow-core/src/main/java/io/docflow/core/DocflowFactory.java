package io.docflow.core;

import io.docflow.core.execution.ExecutionListener;
import io.docflow.core.execution.LoggingExecutionListener;
import io.docflow.core.execution.WorkflowExecutor;
import io.docflow.core.execution.executor.DefaultNodeExecutorRegistry;
import io.docflow.core.execution.executor.NodeExecutorRegistry;
import io.docflow.core.export.ExportWriter;
import io.docflow.core.extraction.EntityExtractionException;
import io.docflow.core.extraction.EntityExtractor;
import io.docflow.core.extraction.TextExtractionException;
import io.docflow.core.extraction.TextExtractor;
import io.docflow.core.service.WorkflowService;
import io.docflow.core.storage.ExecutionRepository;
import io.docflow.core.storage.InMemoryExecutionRepository;
import io.docflow.core.validation.WorkflowValidator;
import io.docflow.core.workflow.InMemoryWorkflowRepository;
import io.docflow.core.workflow.WorkflowRepository;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/// Factory for creating and wiring Docflow environments.
///
/// The core module ships no OCR, extraction or export implementations; they are
/// supplied through the {@link Builder}. Collaborators left unset fail every
/// document they are asked to process, which shows up as item-level errors.
///
/// ### Usage
/// {@snippet :
/// Map<String, String> credentials = DocflowFactory.loadCredentials(properties);
/// DocflowConfig config = DocflowConfig.fromProperties(properties);
/// var env = DocflowFactory.builder()
///     .config(config)
///     .credentials(credentials)
///     .textExtractor(MistralOcrClient.create(config, credentials))
///     .entityExtractor(new LangChain4jEntityExtractor(new LangChain4jModelFactory(credentials)))
///     .exportWriters(List.of(new JsonExportWriter(), new CsvExportWriter()))
///     .build();
/// }
///
/// @see DocflowEnvironment
/// @see DocflowConfig
public final class DocflowFactory {

    private static final Logger logger = Logger.getLogger(DocflowFactory.class.getName());

    /// Prefix stripped from credential keys read from properties.
    public static final String CREDENTIALS_PREFIX = "docflow.credentials.";

    private DocflowFactory() {}

    /// Discovers API credentials from environment variables.
    ///
    /// Picks up every variable named `*_API_KEY`, `*_KEY`, `*_SECRET` or `*_TOKEN`,
    /// which covers `MISTRAL_API_KEY`, `OPENAI_API_KEY`, `LANGEXTRACT_API_KEY`,
    /// `ANTHROPIC_API_KEY` and `GOOGLE_API_KEY`.
    ///
    /// @return map of discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        return filterCredentials(System.getenv());
    }

    static Map<String, String> filterCredentials(Map<String, String> variables) {
        Map<String, String> credentials = new HashMap<>();
        variables.forEach(
                (key, value) -> {
                    if (value != null && !value.isEmpty() && isApiKeyPattern(key)) {
                        credentials.put(key, value);
                    }
                });
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase(Locale.ROOT);
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    /// Loads credentials from a Properties object.
    ///
    /// Supports prefixed keys (`docflow.credentials.MISTRAL_API_KEY=...`, prefix
    /// stripped) and direct API key names (`MISTRAL_API_KEY=...`).
    ///
    /// @param properties the properties to extract credentials from, not null
    /// @return map of credential keys to their values, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key);
            if (value == null || value.isEmpty()) {
                continue;
            }
            if (key.startsWith(CREDENTIALS_PREFIX)) {
                credentials.put(key.substring(CREDENTIALS_PREFIX.length()), value);
            } else if (isApiKeyPattern(key)) {
                credentials.put(key, value);
            }
        }
        return credentials;
    }

    /// Loads credentials from environment variables and properties; properties win.
    ///
    /// @param properties the properties to merge with environment credentials, not null
    /// @return merged map of credentials, never null
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link DocflowEnvironment}.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private DocflowConfig config = new DocflowConfig();
        private final Map<String, String> credentials = new HashMap<>();
        private TextExtractor textExtractor;
        private EntityExtractor entityExtractor;
        private final List<ExportWriter> exportWriters = new ArrayList<>();
        private NodeExecutorRegistry nodeExecutorRegistry;
        private WorkflowRepository workflowRepository;
        private ExecutionRepository executionRepository;
        private ExecutionListener listener;

        private Builder() {}

        public Builder config(DocflowConfig config) {
            this.config = config;
            return this;
        }

        /// Adds credentials; later calls override earlier keys.
        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder textExtractor(TextExtractor textExtractor) {
            this.textExtractor = textExtractor;
            return this;
        }

        public Builder entityExtractor(EntityExtractor entityExtractor) {
            this.entityExtractor = entityExtractor;
            return this;
        }

        public Builder exportWriters(List<? extends ExportWriter> exportWriters) {
            this.exportWriters.addAll(exportWriters);
            return this;
        }

        public Builder exportWriter(ExportWriter exportWriter) {
            this.exportWriters.add(exportWriter);
            return this;
        }

        /// Replaces the default registry; collaborators set on this builder are then ignored.
        public Builder nodeExecutorRegistry(NodeExecutorRegistry nodeExecutorRegistry) {
            this.nodeExecutorRegistry = nodeExecutorRegistry;
            return this;
        }

        public Builder workflowRepository(WorkflowRepository workflowRepository) {
            this.workflowRepository = workflowRepository;
            return this;
        }

        public Builder executionRepository(ExecutionRepository executionRepository) {
            this.executionRepository = executionRepository;
            return this;
        }

        /// Sets the listener used by service executions (default logs to `java.util.logging`).
        public Builder listener(ExecutionListener listener) {
            this.listener = listener;
            return this;
        }

        /// Builds the environment.
        ///
        /// @return the wired environment, never null
        public DocflowEnvironment build() {
            NodeExecutorRegistry registry = nodeExecutorRegistry;
            if (registry == null) {
                registry =
                        new DefaultNodeExecutorRegistry(
                                textExtractor != null ? textExtractor : unconfiguredTextExtractor(),
                                entityExtractor != null
                                        ? entityExtractor
                                        : unconfiguredEntityExtractor(),
                                exportWriters,
                                config.getDefaultConfidence());
            }

            WorkflowRepository workflows =
                    workflowRepository != null
                            ? workflowRepository
                            : new InMemoryWorkflowRepository();
            ExecutionRepository executions =
                    executionRepository != null
                            ? executionRepository
                            : new InMemoryExecutionRepository();
            WorkflowExecutor executor = new WorkflowExecutor(registry);
            WorkflowValidator validator = new WorkflowValidator();
            WorkflowService service =
                    new WorkflowService(
                            executor,
                            workflows,
                            executions,
                            validator,
                            config,
                            listener != null ? listener : new LoggingExecutionListener());

            return new DocflowEnvironment(
                    config,
                    credentials,
                    executor,
                    registry,
                    workflows,
                    executions,
                    validator,
                    service);
        }

        private static TextExtractor unconfiguredTextExtractor() {
            logger.warning("No text extractor configured; OCR nodes will fail every document");
            return (content, filename) -> {
                throw new TextExtractionException(503, "No text extractor configured");
            };
        }

        private static EntityExtractor unconfiguredEntityExtractor() {
            logger.warning(
                    "No entity extractor configured; extraction nodes will fail every document");
            return (text, fields, model, description) -> {
                throw new EntityExtractionException("No entity extractor configured");
            };
        }
    }
}
