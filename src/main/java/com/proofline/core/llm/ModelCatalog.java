package com.proofline.core.llm;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static allow-list of model names per provider, consulted when the vendor
 * cannot be asked whether a model exists.
 * <p>
 * A listed name also admits dated or versioned variants: {@code gpt-4o}
 * admits {@code gpt-4o-2024-08-06}, {@code gemini-1.5-pro} admits
 * {@code gemini-1.5-pro.002}.
 */
public final class ModelCatalog {

    public static final List<String> OPENAI_MODELS = List.of(
            "gpt-4.1",
            "gpt-4o",
            "gpt-4o-mini",
            "gpt-3.5-turbo",
            "gpt-5"
    );

    public static final List<String> DEEPSEEK_MODELS = List.of(
            "deepseek-chat",
            "deepseek-coder"
    );

    public static final List<String> GOOGLE_MODELS = List.of(
            "gemini-pro",
            "gemini-1.5-pro",
            "gemini-1.5-flash"
    );

    public static final List<String> ANTHROPIC_MODELS = List.of(
            "claude-3-opus",
            "claude-3-sonnet",
            "claude-3-haiku"
    );

    private static final Map<String, List<String>> BY_PROVIDER = Map.of(
            "openai", OPENAI_MODELS,
            "deepseek", DEEPSEEK_MODELS,
            "google", GOOGLE_MODELS,
            "anthropic", ANTHROPIC_MODELS
    );

    private ModelCatalog() {}

    public static List<String> modelsFor(String provider) {
        if (provider == null) {
            return List.of();
        }
        return BY_PROVIDER.getOrDefault(provider.toLowerCase(Locale.ROOT), List.of());
    }

    public static boolean isListed(String provider, String modelName) {
        if (modelName == null || modelName.isBlank()) {
            return false;
        }
        for (String listed : modelsFor(provider)) {
            if (modelName.equals(listed)
                    || modelName.startsWith(listed + "-")
                    || modelName.startsWith(listed + ".")) {
                return true;
            }
        }
        return false;
    }
}
