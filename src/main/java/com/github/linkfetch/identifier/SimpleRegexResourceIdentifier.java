package com.github.linkfetch.identifier;

/**
 * A {@link RegexResourceIdentifier} with a single regex whose resource kind is "it".
 */
public abstract class SimpleRegexResourceIdentifier extends RegexResourceIdentifier {

    public static final String RESOURCE_KIND = "it";

    protected SimpleRegexResourceIdentifier(String regex) {
        super(new RegexTable().add(regex, RESOURCE_KIND));
    }
}
