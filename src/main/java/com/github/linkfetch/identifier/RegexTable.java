package com.github.linkfetch.identifier;

import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered mapping of regular expressions to resource kinds. When more than one
 * regex matches a URL, the one added first wins; neither the longest nor the most
 * specific match is preferred.
 */
public class RegexTable {

    private final List<Entry> entries = new ArrayList<>();

    /**
     * Append a regex. It has lower precedence than every regex added before it.
     *
     * @param regex Regular expression that must match the entire URL
     * @param resourceKind Label handed to the identifier when this regex wins
     * @return this table
     * @throws IllegalArgumentException if the regex is already present
     */
    public RegexTable add(@NonNull String regex, @NonNull String resourceKind) {
        for (Entry entry : entries) {
            if (entry.getRegex().equals(regex)) {
                throw new IllegalArgumentException("Duplicate regex: " + regex);
            }
        }
        entries.add(new Entry(regex, Pattern.compile(regex), resourceKind));
        return this;
    }

    public boolean matches(String input) {
        return firstMatch(input).isPresent();
    }

    /**
     * Find the first entry, in insertion order, whose regex matches the whole input.
     */
    public Optional<Match> firstMatch(String input) {
        for (Entry entry : entries) {
            Matcher matcher = entry.getPattern().matcher(input);
            if (matcher.matches()) {
                return Optional.of(new Match(entry.getRegex(), entry.getResourceKind(), matcher));
            }
        }
        return Optional.empty();
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    @Getter
    public static class Entry {
        private final String regex;
        private final Pattern pattern;
        private final String resourceKind;

        Entry(String regex, Pattern pattern, String resourceKind) {
            this.regex = regex;
            this.pattern = pattern;
            this.resourceKind = resourceKind;
        }
    }

    /**
     * A successful match: which regex won, its resource kind, and its capture groups.
     */
    @Getter
    public static class Match {
        private final String regex;
        private final String resourceKind;
        private final Matcher matcher;

        Match(String regex, String resourceKind, Matcher matcher) {
            this.regex = regex;
            this.resourceKind = resourceKind;
            this.matcher = matcher;
        }

        /**
         * @param n Capture group index, starting at 1
         * @return Captured text, or null if the group did not participate
         */
        public String group(int n) {
            return matcher.group(n);
        }
    }
}
