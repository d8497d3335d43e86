package uk.gegc.quizforge.features.ai.application;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Providers that were built at startup, plus the load error of those that could not be.
 */
public class ProviderRegistry {

    private final Map<String, QuestionProvider> providers = new LinkedHashMap<>();
    private final Map<String, String> loadFailures = new LinkedHashMap<>();

    public void register(QuestionProvider provider) {
        providers.put(provider.getName(), provider);
    }

    public void recordLoadFailure(String name, String error) {
        loadFailures.put(name, error);
    }

    public Optional<QuestionProvider> find(String name) {
        return Optional.ofNullable(name == null ? null : providers.get(name));
    }

    public Collection<QuestionProvider> all() {
        return Collections.unmodifiableCollection(providers.values());
    }

    public Map<String, String> loadFailures() {
        return Collections.unmodifiableMap(loadFailures);
    }
}
