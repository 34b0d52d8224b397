package ai.nda.redline.config;

import java.util.Locale;

/**
 * Language model providers available for citation cleaning.
 */
public enum LlmProvider {
    GEMINI,
    OLLAMA;

    public static LlmProvider from(String value) {
        if (value == null) {
            return OLLAMA;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini" -> GEMINI;
            case "ollama", "" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
