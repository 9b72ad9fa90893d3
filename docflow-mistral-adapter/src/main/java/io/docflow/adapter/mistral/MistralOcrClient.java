package io.docflow.adapter.mistral;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.docflow.core.DocflowConfig;
import io.docflow.core.extraction.TextExtraction;
import io.docflow.core.extraction.TextExtractionException;
import io.docflow.core.extraction.TextExtractor;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link TextExtractor} backed by the Mistral OCR HTTP API.
///
/// Each document is posted inline as a Base64 `data:` URL. The text of every returned
/// page (Markdown) is joined with blank lines.
///
/// ### Failures
/// All failures surface as {@link TextExtractionException} with an HTTP-style status:
/// - the API's own status for non-200 responses, message `Mistral OCR failed: <body>`
/// - `408` when the request times out
/// - `502` when the response body is not the expected JSON
/// - `503` when the API cannot be reached
///
/// @implNote Thread-safe. The underlying `HttpClient` is shared across calls.
public class MistralOcrClient implements TextExtractor {

    private static final Logger logger = Logger.getLogger(MistralOcrClient.class.getName());

    /// Credential key holding the Mistral API key.
    public static final String API_KEY_CREDENTIAL = "MISTRAL_API_KEY";

    static final int IMAGE_LIMIT = 10;
    static final String DEFAULT_CONTENT_TYPE = "application/pdf";

    private static final Map<String, String> CONTENT_TYPES =
            Map.of(
                    "pdf", "application/pdf",
                    "png", "image/png",
                    "jpg", "image/jpeg",
                    "jpeg", "image/jpeg",
                    "webp", "image/webp");

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public MistralOcrClient(
            HttpClient httpClient,
            ObjectMapper mapper,
            URI endpoint,
            String apiKey,
            String model,
            Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /// Creates a client from the environment configuration.
    ///
    /// @param config endpoint, model and timeout settings, not null
    /// @param credentials must contain {@value #API_KEY_CREDENTIAL}
    /// @return a new client, never null
    /// @throws IllegalStateException if the API key is missing
    public static MistralOcrClient create(DocflowConfig config, Map<String, String> credentials) {
        String apiKey = credentials.get(API_KEY_CREDENTIAL);
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(API_KEY_CREDENTIAL + " not configured");
        }
        Duration timeout = Duration.ofSeconds(config.getOcrTimeoutSeconds());
        HttpClient httpClient =
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        return new MistralOcrClient(
                httpClient,
                new ObjectMapper(),
                URI.create(config.getMistralOcrUrl()),
                apiKey,
                config.getMistralModel(),
                timeout);
    }

    @Override
    public TextExtraction extractText(byte[] content, String filename)
            throws TextExtractionException {
        long start = System.nanoTime();

        HttpRequest request =
                HttpRequest.newBuilder()
                        .uri(endpoint)
                        .timeout(timeout)
                        .header("Authorization", "Bearer " + apiKey)
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(buildPayload(content, filename)))
                        .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TextExtractionException(
                    408, "OCR processing timed out after " + timeout.toSeconds() + " seconds", e);
        } catch (IOException e) {
            throw new TextExtractionException(503, "OCR service unavailable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextExtractionException(503, "OCR request interrupted", e);
        }

        if (response.statusCode() != 200) {
            logger.warning("Mistral OCR returned status " + response.statusCode() + " for " + filename);
            throw new TextExtractionException(
                    response.statusCode(), "Mistral OCR failed: " + response.body());
        }

        JsonNode pages = readPages(response.body());
        List<String> text = new ArrayList<>();
        for (JsonNode page : pages) {
            JsonNode markdown = page.get("markdown");
            if (markdown != null && markdown.isTextual()) {
                text.add(markdown.asText());
            }
        }
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        logger.fine("Mistral OCR read " + pages.size() + " pages of " + filename);
        return new TextExtraction(String.join("\n\n", text), seconds, Math.max(pages.size(), 1));
    }

    String buildPayload(byte[] content, String filename) {
        String dataUrl =
                "data:"
                        + contentTypeFor(filename)
                        + ";base64,"
                        + Base64.getEncoder().encodeToString(content);

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        ObjectNode document = payload.putObject("document");
        document.put("type", "document_url");
        document.put("document_url", dataUrl);
        payload.put("include_image_base64", true);
        payload.put("image_limit", IMAGE_LIMIT);
        return payload.toString();
    }

    /// Returns the `pages` array of the response, or a missing node when there is none.
    private JsonNode readPages(String body) throws TextExtractionException {
        try {
            return mapper.readTree(body).path("pages");
        } catch (JsonProcessingException e) {
            throw new TextExtractionException(
                    502, "Mistral OCR returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /// Maps a file extension to the MIME type sent to the API; unknown or missing
    /// extensions are sent as PDF.
    static String contentTypeFor(String filename) {
        if (filename == null || filename.isEmpty()) {
            return DEFAULT_CONTENT_TYPE;
        }
        int dot = filename.lastIndexOf('.');
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return CONTENT_TYPES.getOrDefault(extension, DEFAULT_CONTENT_TYPE);
    }
}
