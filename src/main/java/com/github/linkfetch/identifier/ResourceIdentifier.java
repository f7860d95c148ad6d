package com.github.linkfetch.identifier;

import java.util.Set;

/**
 * Turns one URL into the set of URLs that actually need downloading. A URL to an
 * Imgur album, for example, is a resource made of several image files, and an
 * identifier can ask the Imgur API for them.
 */
public interface ResourceIdentifier {

    /**
     * Tests if this identifier handles the given URL. If true, {@link #resolve(String)}
     * is called directly after.
     *
     * @param url URL to test
     * @return true if this identifier can resolve the URL
     */
    boolean canResolve(String url);

    /**
     * Finds the files that make up the resource at the given URL. Only called after
     * {@link #canResolve(String)} returned true. An empty set means there is nothing
     * to download.
     *
     * @param url URL to resolve
     * @return Download targets, in the order they should be fetched
     * @throws com.github.linkfetch.exception.ResolutionException if the resource cannot be resolved
     * @throws com.github.linkfetch.exception.NetworkException if an API call fails in transit
     */
    Set<String> resolve(String url);
}
