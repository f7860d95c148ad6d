package com.github.linkfetch.identifier;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Priority-ordered list of {@link ResourceIdentifier}s. Only the first identifier
 * that can resolve a URL is asked to; results are never merged.
 */
@Slf4j
public class ResourceIdentifierChain {

    private final List<ResourceIdentifier> identifiers = new CopyOnWriteArrayList<>();

    public ResourceIdentifierChain add(@NonNull ResourceIdentifier identifier) {
        identifiers.add(identifier);
        return this;
    }

    public boolean remove(ResourceIdentifier identifier) {
        return identifiers.remove(identifier);
    }

    public void clear() {
        identifiers.clear();
    }

    public int size() {
        return identifiers.size();
    }

    public List<ResourceIdentifier> getIdentifiers() {
        return Collections.unmodifiableList(identifiers);
    }

    /**
     * Resolve a URL into download targets.
     * <p>
     * If the identifier that claims the URL throws, the exception propagates: later
     * identifiers are not tried, and the URL is not returned as-is.
     *
     * @param url URL to resolve
     * @return Targets of the first identifier that can resolve the URL, or the URL itself if none can
     */
    public Set<String> resolve(@NonNull String url) {
        log.debug("Trying to resolve URL '{}'", url);

        for (ResourceIdentifier identifier : identifiers) {
            if (identifier.canResolve(url)) {
                Set<String> resolved = identifier.resolve(url);
                log.debug("Resolved '{}' to {} with {}", url, resolved, identifier.getClass().getSimpleName());
                return resolved;
            }
        }

        Set<String> self = new LinkedHashSet<>();
        self.add(url);
        return self;
    }
}
