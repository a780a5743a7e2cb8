package com.banana.integration.gemini;

import com.banana.core.model.GenerationMode;
import com.banana.core.model.GenerationRequest;
import com.banana.core.request.ReferenceImage;
import com.banana.logging.AppLogger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Calls the Gemini {@code generateContent} endpoint for edits and text prompts, and the Imagen
 * {@code predict} endpoint for {@link GenerationMode#IMAGEN}. One call per worker; the client is
 * safe to share between workers.
 */
public class GeminiImageClient {
    private static final Logger LOGGER = AppLogger.get();
    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(3);

    static final String MISSING_KEY_MESSAGE = "GEMINI_API_KEY not found in environment variables";

    private final HttpClient httpClient;
    private final GeminiSettings settings;

    public GeminiImageClient(GeminiSettings settings) {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(20))
            .build(),
            settings);
    }

    public GeminiImageClient(HttpClient httpClient, GeminiSettings settings) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<byte[]> generate(GenerationRequest request, List<ReferenceImage> images, Consumer<String> status)
        throws GenerationException, InterruptedException {
        Objects.requireNonNull(request, "request");
        Consumer<String> progress = status == null ? message -> { } : status;
        if (!settings.hasApiKey()) {
            throw new GenerationException(MISSING_KEY_MESSAGE);
        }

        boolean imagen = request.mode() == GenerationMode.IMAGEN;
        String model = imagen ? settings.imagenModel() : settings.geminiModel();
        URI endpoint = endpoint(model, imagen ? "predict" : "generateContent");
        String body = imagen
            ? GeminiPayloadMapper.predictBody(request).toString()
            : GeminiPayloadMapper.generateContentBody(request, images == null ? List.of() : images).toString();

        progress.accept("Calling " + model);
        ApiResponse response;
        try {
            response = execute(endpoint, body);
        } catch (IOException ex) {
            throw new GenerationException("Connection error: " + ex.getMessage(), ex);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            String description = GeminiPayloadMapper.describeError(response.statusCode(), response.body());
            LOGGER.warning(model + " returned " + response.statusCode() + ": " + description);
            throw new GenerationException(description, response.statusCode(), null);
        }

        progress.accept("Processing response");
        List<byte[]> results = imagen
            ? GeminiPayloadMapper.parsePredict(response.body())
            : GeminiPayloadMapper.parseGenerateContent(response.body());
        progress.accept("Received " + results.size() + " image(s)");
        return results;
    }

    URI endpoint(String model, String method) {
        String base = settings.apiBase().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/models/" + model + ":" + method);
    }

    protected ApiResponse execute(URI endpoint, String jsonBody) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/json")
            .header("x-goog-api-key", settings.apiKey())
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new ApiResponse(response.statusCode(), response.body());
    }

    public record ApiResponse(int statusCode, String body) {
    }
}
