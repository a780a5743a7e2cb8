package com.banana.integration.gemini;

import com.banana.core.model.AspectRatio;
import com.banana.core.model.GenerationMode;
import com.banana.core.model.GenerationRequest;
import com.banana.core.request.ReferenceImage;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Builds request bodies for {@code generateContent} and {@code predict} and pulls image bytes out
 * of their responses.
 */
public final class GeminiPayloadMapper {

    static final double TEMPERATURE = 0.7;
    static final List<String> SAFETY_CATEGORIES = List.of(
        "HARM_CATEGORY_HATE_SPEECH",
        "HARM_CATEGORY_HARASSMENT",
        "HARM_CATEGORY_SEXUALLY_EXPLICIT",
        "HARM_CATEGORY_DANGEROUS_CONTENT");

    private GeminiPayloadMapper() {
    }

    public static String textToImagePrompt(String prompt, AspectRatio aspectRatio) {
        return "Create a high-quality image based on this description: " + prompt + "\n\n"
            + "Style: photorealistic, detailed, well-composed\n"
            + "Output: single image with aspect ratio " + aspectRatio.label();
    }

    public static String editPrompt(String prompt, AspectRatio aspectRatio) {
        return prompt + ". Output the image in " + aspectRatio.label() + " aspect ratio.";
    }

    /**
     * Body for {@code models/{model}:generateContent}: the prompt first, then the reference images
     * in slot order.
     */
    public static JSONObject generateContentBody(GenerationRequest request, List<ReferenceImage> images) {
        JSONArray parts = new JSONArray();
        String prompt = request.mode() == GenerationMode.IMAGE_EDIT
            ? editPrompt(request.promptText(), request.aspectRatio())
            : textToImagePrompt(request.promptText(), request.aspectRatio());
        parts.put(new JSONObject().put("text", prompt));

        if (request.mode().usesReferenceImages()) {
            Base64.Encoder encoder = Base64.getEncoder();
            for (ReferenceImage image : images) {
                parts.put(new JSONObject().put("inline_data", new JSONObject()
                    .put("mime_type", image.mimeType())
                    .put("data", encoder.encodeToString(image.data()))));
            }
        }

        JSONObject generationConfig = new JSONObject()
            .put("responseModalities", new JSONArray().put("IMAGE").put("TEXT"))
            .put("candidateCount", 1)
            .put("temperature", TEMPERATURE);

        JSONArray safety = new JSONArray();
        for (String category : SAFETY_CATEGORIES) {
            safety.put(new JSONObject().put("category", category).put("threshold", "BLOCK_NONE"));
        }

        return new JSONObject()
            .put("contents", new JSONArray().put(new JSONObject().put("role", "user").put("parts", parts)))
            .put("generationConfig", generationConfig)
            .put("safetySettings", safety);
    }

    /**
     * Body for {@code models/{model}:predict}.
     */
    public static JSONObject predictBody(GenerationRequest request) {
        return new JSONObject()
            .put("instances", new JSONArray().put(new JSONObject().put("prompt", request.promptText())))
            .put("parameters", new JSONObject()
                .put("sampleCount", 1)
                .put("aspectRatio", request.aspectRatio().label()));
    }

    public static List<byte[]> parseGenerateContent(String body) throws GenerationException {
        JSONObject json = parse(body);
        JSONArray candidates = json.optJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            String blockReason = json.optJSONObject("promptFeedback") == null
                ? null
                : json.getJSONObject("promptFeedback").optString("blockReason", null);
            throw new GenerationException("No candidates received from API"
                + (blockReason == null ? " - check API key billing status" : " (blocked: " + blockReason + ")"));
        }

        JSONObject content = candidates.getJSONObject(0).optJSONObject("content");
        if (content == null) {
            throw new GenerationException("No content received from API");
        }
        JSONArray parts = content.optJSONArray("parts");
        if (parts == null || parts.isEmpty()) {
            throw new GenerationException("No parts received from content");
        }

        List<byte[]> images = new ArrayList<>();
        for (int i = 0; i < parts.length(); i++) {
            JSONObject part = parts.optJSONObject(i);
            if (part == null) {
                continue;
            }
            JSONObject inline = part.optJSONObject("inlineData");
            if (inline == null) {
                inline = part.optJSONObject("inline_data");
            }
            if (inline != null) {
                String data = inline.optString("data", "");
                if (!data.isEmpty()) {
                    images.add(decode(data));
                }
            }
        }
        if (images.isEmpty()) {
            throw new GenerationException("No image data found in response");
        }
        return images;
    }

    public static List<byte[]> parsePredict(String body) throws GenerationException {
        JSONObject json = parse(body);
        JSONArray predictions = json.optJSONArray("predictions");
        List<byte[]> images = new ArrayList<>();
        if (predictions != null) {
            for (int i = 0; i < predictions.length(); i++) {
                JSONObject prediction = predictions.optJSONObject(i);
                String data = prediction == null ? "" : prediction.optString("bytesBase64Encoded", "");
                if (!data.isEmpty()) {
                    images.add(decode(data));
                }
            }
        }
        if (images.isEmpty()) {
            throw new GenerationException("No image data found in Imagen response");
        }
        return images;
    }

    /**
     * Renders a non-2xx response as {@code STATUS: message}, falling back to the HTTP code.
     */
    public static String describeError(int statusCode, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JSONObject error = new JSONObject(body).optJSONObject("error");
                if (error != null) {
                    String status = error.optString("status", "");
                    String message = error.optString("message", "");
                    if (!status.isEmpty() || !message.isEmpty()) {
                        return status.isEmpty() ? message : status + ": " + message;
                    }
                }
            } catch (JSONException ex) {
                return "HTTP " + statusCode + ": " + abbreviate(body);
            }
        }
        return "HTTP " + statusCode;
    }

    private static JSONObject parse(String body) throws GenerationException {
        if (body == null || body.isBlank()) {
            throw new GenerationException("No content received from API");
        }
        try {
            return new JSONObject(body);
        } catch (JSONException ex) {
            throw new GenerationException("Malformed API response: " + ex.getMessage(), ex);
        }
    }

    private static byte[] decode(String data) throws GenerationException {
        try {
            return Base64.getMimeDecoder().decode(data);
        } catch (IllegalArgumentException ex) {
            throw new GenerationException("Invalid image data in response: " + ex.getMessage(), ex);
        }
    }

    private static String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
