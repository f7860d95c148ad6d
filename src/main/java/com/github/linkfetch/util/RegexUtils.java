package com.github.linkfetch.util;

import lombok.experimental.UtilityClass;

/**
 * Builds regular expressions for matching URLs, either from shell-style globs or
 * from protocol/host/path fragments.
 */
@UtilityClass
public class RegexUtils {

    /**
     * Protocol pattern used when none is given, matches both http and https.
     */
    public static final String DEFAULT_PROTOCOL = "http[s]?";

    /**
     * Create a regular expression from a glob. Supported wildcards are '*' and '?'.
     * <p>
     * An asterisk becomes {@code (.*)} and matches any run of characters, including
     * none, so {@code /home/*}{@code /file.txt} matches {@code /home/me/file.txt} and
     * {@code /home/me/projects/file.txt}. A question mark becomes {@code (.)} and
     * matches exactly one character. Both are capturing groups, so the matched
     * text can be read back with {@link java.util.regex.Matcher#group(int)}.
     * <p>
     * '.' and '\' are escaped. Every other character is copied as-is, which means a
     * literal '*' or '?' cannot be expressed; use a regular expression for that.
     * No start anchor is added.
     *
     * @param glob Glob expression
     * @param anchor Whether to append an end-of-input anchor ('$')
     * @return Regular expression
     */
    public static String compileGlob(String glob, boolean anchor) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*':
                    sb.append("(.*)");
                    break;
                case '?':
                    sb.append("(.)");
                    break;
                case '.':
                    sb.append("\\.");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                default:
                    sb.append(c);
            }
        }
        if (anchor) {
            sb.append('$');
        }
        return sb.toString();
    }

    /**
     * Create an anchored regular expression from a glob.
     *
     * @param glob Glob expression
     * @return Regular expression ending in '$'
     */
    public static String compileGlob(String glob) {
        return compileGlob(glob, true);
    }

    /**
     * Join already-compiled fragments into {@code protocol://hostpath}.
     *
     * @param protocol Protocol regex, e.g. "http" or "http[s]?"
     * @param host Host regex, e.g. "example\\.com"
     * @param path Path regex, e.g. "/directory"
     * @return URL regular expression
     */
    public static String ofUrl(String protocol, String host, String path) {
        return protocol + "://" + host + path;
    }

    /**
     * Same as {@link #ofUrl(String, String, String)} using {@link #DEFAULT_PROTOCOL}.
     */
    public static String ofUrl(String host, String path) {
        return ofUrl(DEFAULT_PROTOCOL, host, path);
    }

    /**
     * Compile host and path as globs and join them with {@link #DEFAULT_PROTOCOL}.
     * The host is left unanchored since the path follows it.
     *
     * @param host Host glob, e.g. "*.example.com"
     * @param path Path glob, e.g. "/resource/*"
     * @return URL regular expression
     */
    public static String ofUrlGlob(String host, String path) {
        return ofUrl(compileGlob(host, false), compileGlob(path));
    }

    /**
     * Compile protocol, host and path as globs. Only the path is anchored. An empty
     * protocol falls back to {@link #ofUrlGlob(String, String)}.
     */
    public static String ofUrlGlob(String protocol, String host, String path) {
        if (protocol == null || protocol.isEmpty()) {
            return ofUrlGlob(host, path);
        }
        return ofUrl(compileGlob(protocol, false), compileGlob(host, false), compileGlob(path));
    }
}
