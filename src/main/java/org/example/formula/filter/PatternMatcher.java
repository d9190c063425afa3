package org.example.formula.filter;

import java.util.Optional;

/**
 * Glob over package names.
 *
 * <p>{@code *} matches any run of characters (including none) and {@code ?} exactly one.
 * Every other pattern character must be a package name character (ASCII letters, digits
 * and {@code - _ + .}) and matches itself, so a pattern can never name something that is
 * not a package.</p>
 *
 * <p>Examples: {@code ocaml*} matches ocaml and ocaml-base-compiler, {@code *-dev} every
 * package ending in -dev, {@code lib?} liba but not lib or libab.</p>
 */
public final class PatternMatcher {

    private static final String NAME_PUNCTUATION = "-_+.";

    private final String glob;

    /**
     * Creates a matcher for the given glob.
     *
     * @param pattern the glob, surrounding whitespace ignored
     * @throws IllegalArgumentException if the pattern is blank or has a character no package name can contain
     */
    public PatternMatcher(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Pattern cannot be null or empty");
        }
        String trimmed = pattern.trim();
        Optional<String> problem = problemWith(trimmed);
        if (problem.isPresent()) {
            throw new IllegalArgumentException("Invalid pattern '" + trimmed + "': " + problem.get());
        }
        this.glob = trimmed;
    }

    /**
     * Describes the first character of a non-blank pattern that no package name can
     * contain, or empty if the pattern is a valid package name glob.
     */
    public static Optional<String> problemWith(String pattern) {
        String trimmed = pattern.trim();
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c != '*' && c != '?' && !isNameChar(c)) {
                return Optional.of("'" + c + "' at position " + i + " cannot appear in a package name");
            }
        }
        return Optional.empty();
    }

    static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || NAME_PUNCTUATION.indexOf(c) >= 0;
    }

    /**
     * Tests a package name against the glob.
     */
    public boolean matches(String packageName) {
        if (packageName == null) {
            return false;
        }
        int p = 0;
        int n = 0;
        int star = -1;
        int resume = 0;
        while (n < packageName.length()) {
            if (p < glob.length() && (glob.charAt(p) == '?' || glob.charAt(p) == packageName.charAt(n))) {
                p++;
                n++;
            } else if (p < glob.length() && glob.charAt(p) == '*') {
                star = p++;
                resume = n;
            } else if (star >= 0) {
                // let the last star absorb one more character
                p = star + 1;
                n = ++resume;
            } else {
                return false;
            }
        }
        while (p < glob.length() && glob.charAt(p) == '*') {
            p++;
        }
        return p == glob.length();
    }

    public String getPattern() {
        return glob;
    }

    @Override
    public String toString() {
        return glob;
    }
}
