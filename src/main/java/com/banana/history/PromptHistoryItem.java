package com.banana.history;

import org.json.JSONObject;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A prompt the user chose to keep.
 */
public record PromptHistoryItem(String text, LocalDateTime timestamp) {

    public PromptHistoryItem {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(timestamp, "timestamp");
        text = text.strip();
    }

    JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("text", text);
        json.put("timestamp", timestamp.toString());
        return json;
    }

    static PromptHistoryItem fromJson(JSONObject json) {
        return new PromptHistoryItem(json.getString("text"), LocalDateTime.parse(json.getString("timestamp")));
    }
}
