package com.github.linkfetch.identifier;

import com.github.linkfetch.exception.ResolutionException;
import lombok.Getter;

import java.util.Set;

/**
 * Identifier that handles a URL if and only if it matches one of the regexes in
 * its {@link RegexTable}. Each regex is labelled with a resource kind, so one
 * identifier can tell, for example, a single image from a whole album.
 */
public abstract class RegexResourceIdentifier implements ResourceIdentifier {

    @Getter
    private final RegexTable regexes;

    protected RegexResourceIdentifier(RegexTable regexes) {
        if (regexes.size() == 0) {
            throw new IllegalArgumentException("At least one regex is required");
        }
        this.regexes = regexes;
    }

    @Override
    public boolean canResolve(String url) {
        return regexes.matches(url);
    }

    @Override
    public Set<String> resolve(String url) {
        RegexTable.Match match = regexes.firstMatch(url)
                .orElseThrow(() -> new ResolutionException("Could not find any regex that matches " + url, url));
        return expand(url, match);
    }

    /**
     * Identify the files that make up the resource.
     *
     * @param url URL being resolved
     * @param match First regex (in table order) that matched the URL
     * @return Download targets
     */
    protected abstract Set<String> expand(String url, RegexTable.Match match);

    /**
     * Cut a captured path segment at the first '#', then at the first '?', so
     * {@code "abc?foo=bar#ref"} and {@code "abc#ref"} both become {@code "abc"}.
     * A delimiter in the first position is kept so the result is never empty.
     */
    public static String stripQuery(String path) {
        return stripFrom('?', stripFrom('#', path));
    }

    private static String stripFrom(char delimiter, String str) {
        int index = str.indexOf(delimiter);
        if (index > 0) {
            return str.substring(0, index);
        }
        return str;
    }
}
