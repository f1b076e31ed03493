package com.proofline.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Provider name to implementation, assembled once from the {@link AiProvider} beans.
 * Lookup ignores case so "openai" and "OpenAI" name the same provider.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, AiProvider> providers;

    public ProviderRegistry(List<AiProvider> providers) {
        Map<String, AiProvider> byName = new LinkedHashMap<>();
        for (AiProvider provider : providers) {
            AiProvider previous = byName.put(key(provider.name()), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate AI provider: " + provider.name());
            }
        }
        this.providers = Collections.unmodifiableMap(byName);
        log.info("AI providers registered: {}", names());
    }

    public Optional<AiProvider> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(key(name)));
    }

    /**
     * @throws AiProviderException for an unknown provider
     */
    public AiProvider require(String name) {
        return find(name).orElseThrow(() -> new AiProviderException("Unsupported AI provider: " + name));
    }

    public Set<String> names() {
        Set<String> names = new TreeSet<>();
        providers.values().forEach(provider -> names.add(provider.name()));
        return names;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
