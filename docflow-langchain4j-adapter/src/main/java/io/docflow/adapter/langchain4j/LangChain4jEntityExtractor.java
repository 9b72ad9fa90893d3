package io.docflow.adapter.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.docflow.core.extraction.EntityExtractionException;
import io.docflow.core.extraction.EntityExtractor;
import io.docflow.core.extraction.ExtractedFields;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link EntityExtractor}.
///
/// Asks a chat model for a JSON object holding the requested fields and a confidence
/// per field, then parses the answer with Jackson. The expected answer is
///
/// ```
/// {"fields": {"invoice_number": "INV-1", "total_amount": 120.5},
///  "confidence": {"invoice_number": 0.98, "total_amount": 0.9}}
/// ```
///
/// A bare object of field values is accepted too, and code fences around the JSON are
/// ignored. Requested fields the model leaves out come back as null values.
///
/// Chat models are resolved per model name and cached, so one extractor serves every
/// model an AI extractor node names.
///
/// @implNote Thread-safe when the resolved chat models are.
/// @see LangChain4jModelFactory for provider selection
public class LangChain4jEntityExtractor implements EntityExtractor {

    private static final Logger logger =
            Logger.getLogger(LangChain4jEntityExtractor.class.getName());

    static final String SYSTEM_PROMPT =
            """
            You extract structured data from business documents.
            Answer with a single JSON object and nothing else, of the form
            {"fields": {"<field>": <value or null>}, "confidence": {"<field>": <number between 0 and 1>}}.
            Use null for fields that do not appear in the document. Keep numbers as JSON numbers.""";

    private final Function<String, ChatModel> modelResolver;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;

    /// Creates an extractor that resolves models through the given function.
    ///
    /// @param modelResolver creates the chat model for a model name, not null
    public LangChain4jEntityExtractor(Function<String, ChatModel> modelResolver) {
        this(modelResolver, new ObjectMapper());
    }

    public LangChain4jEntityExtractor(
            Function<String, ChatModel> modelResolver, ObjectMapper mapper) {
        this.modelResolver = Objects.requireNonNull(modelResolver, "modelResolver must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Creates an extractor that sends every request to one chat model, whatever
    /// model name the node asks for.
    public static LangChain4jEntityExtractor forModel(ChatModel model) {
        Objects.requireNonNull(model, "model must not be null");
        return new LangChain4jEntityExtractor(name -> model);
    }

    /// Creates an extractor whose models come from {@link LangChain4jModelFactory}.
    ///
    /// @param credentials API keys, not null
    public static LangChain4jEntityExtractor fromCredentials(Map<String, String> credentials) {
        LangChain4jModelFactory factory = new LangChain4jModelFactory();
        Map<String, String> keys = Map.copyOf(credentials);
        return new LangChain4jEntityExtractor(name -> factory.createModel(name, keys));
    }

    @Override
    public ExtractedFields extractFields(
            String text, List<String> fields, String model, String description)
            throws EntityExtractionException {
        logger.fine("Extracting " + fields.size() + " fields with model " + model);

        String answer;
        try {
            ChatModel chatModel = models.computeIfAbsent(model, modelResolver);
            ChatResponse response =
                    chatModel.chat(
                            List.<ChatMessage>of(
                                    SystemMessage.from(SYSTEM_PROMPT),
                                    UserMessage.from(buildPrompt(text, fields, description))));
            if (response == null || response.aiMessage() == null) {
                throw new EntityExtractionException("No response from model " + model);
            }
            answer = response.aiMessage().text();
        } catch (RuntimeException e) {
            logger.severe("Extraction with model " + model + " failed: " + e.getMessage());
            throw new EntityExtractionException(
                    "Information extraction failed: " + e.getMessage(), e);
        }

        return parseAnswer(answer, fields);
    }

    static String buildPrompt(String text, List<String> fields, String description) {
        var sb = new StringBuilder();
        if (description != null && !description.isBlank()) {
            sb.append(description).append("\n\n");
        }
        sb.append("Fields to extract: ").append(String.join(", ", fields)).append("\n\n");
        sb.append("Document text:\n").append(text);
        return sb.toString();
    }

    ExtractedFields parseAnswer(String answer, List<String> fields)
            throws EntityExtractionException {
        JsonNode root = readJsonObject(answer);

        JsonNode valuesNode = root.has("fields") ? root.get("fields") : root;
        if (!valuesNode.isObject()) {
            throw new EntityExtractionException("Model answer has no field object");
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (String field : fields) {
            values.put(field, null);
        }
        Iterator<Map.Entry<String, JsonNode>> entries = valuesNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (valuesNode == root && entry.getKey().equals("confidence")) {
                continue;
            }
            values.put(entry.getKey(), mapper.convertValue(entry.getValue(), Object.class));
        }

        Map<String, Double> confidence = new LinkedHashMap<>();
        JsonNode confidenceNode = root.get("confidence");
        if (confidenceNode != null && confidenceNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> scores = confidenceNode.fields();
            while (scores.hasNext()) {
                Map.Entry<String, JsonNode> score = scores.next();
                if (score.getValue().isNumber()) {
                    confidence.put(score.getKey(), score.getValue().asDouble());
                }
            }
        }
        return new ExtractedFields(values, confidence);
    }

    private JsonNode readJsonObject(String answer) throws EntityExtractionException {
        if (answer == null) {
            throw new EntityExtractionException("Model returned an empty answer");
        }
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new EntityExtractionException("Model answer is not a JSON object");
        }
        try {
            JsonNode root = mapper.readTree(answer.substring(start, end + 1));
            if (!root.isObject()) {
                throw new EntityExtractionException("Model answer is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new EntityExtractionException(
                    "Model answer is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
