package com.phillippitts.swarmcouncil.service.provider.http;

import com.phillippitts.swarmcouncil.exception.ProviderException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Builds request bodies and extracts generated text for the supported wire formats.
 * Malformed or empty responses are reported as {@link ProviderException}.
 */
final class ProviderJsonCodec {

    private ProviderJsonCodec() {}

    static JSONObject chatCompletionsRequest(String model, String prompt, int maxTokens, double temperature) {
        JSONObject message = new JSONObject()
                .put("role", "user")
                .put("content", prompt);
        return new JSONObject()
                .put("model", model)
                .put("messages", new JSONArray().put(message))
                .put("max_tokens", maxTokens)
                .put("temperature", temperature)
                .put("stream", false);
    }

    static JSONObject geminiRequest(String prompt, int maxTokens, double temperature) {
        JSONObject part = new JSONObject().put("text", prompt);
        JSONObject content = new JSONObject().put("parts", new JSONArray().put(part));
        JSONObject generationConfig = new JSONObject()
                .put("temperature", temperature)
                .put("maxOutputTokens", maxTokens);
        return new JSONObject()
                .put("contents", new JSONArray().put(content))
                .put("generationConfig", generationConfig);
    }

    /**
     * Extracts {@code choices[0].message.content}.
     */
    static String extractChatContent(String json, String providerId) {
        JSONObject root = parse(json, providerId);
        JSONArray choices = root.optJSONArray("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ProviderException("Response has no choices", providerId);
        }
        JSONObject message = choices.optJSONObject(0) == null ? null : choices.optJSONObject(0).optJSONObject("message");
        String content = message == null ? "" : message.optString("content", "");
        return requireText(content, providerId);
    }

    /**
     * Extracts {@code candidates[0].content.parts[*].text}, joining multiple parts.
     */
    static String extractGeminiText(String json, String providerId) {
        JSONObject root = parse(json, providerId);
        JSONArray candidates = root.optJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            JSONObject feedback = root.optJSONObject("promptFeedback");
            String reason = feedback == null ? "none" : feedback.optString("blockReason", "none");
            throw new ProviderException("Response has no candidates (blockReason=" + reason + ")", providerId);
        }
        JSONObject first = candidates.optJSONObject(0);
        JSONObject content = first == null ? null : first.optJSONObject("content");
        JSONArray parts = content == null ? null : content.optJSONArray("parts");
        StringBuilder sb = new StringBuilder();
        if (parts != null) {
            for (int i = 0; i < parts.length(); i++) {
                JSONObject part = parts.optJSONObject(i);
                if (part != null) {
                    sb.append(part.optString("text", ""));
                }
            }
        }
        return requireText(sb.toString(), providerId);
    }

    private static JSONObject parse(String json, String providerId) {
        if (json == null || json.isBlank()) {
            throw new ProviderException("Empty response body", providerId);
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new ProviderException("Malformed JSON response", providerId, e);
        }
    }

    private static String requireText(String text, String providerId) {
        if (text == null || text.isBlank()) {
            throw new ProviderException("Response contained no generated text", providerId);
        }
        return text.trim();
    }
}
