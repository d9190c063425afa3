package org.example.formula.version;

import org.example.formula.exception.MalformedVersionException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A package version parsed from text such as {@code 1.2.0} or {@code 2.0beta1}.
 *
 * <p>The text is split on {@code .} and on every boundary between a run of digits
 * and a run of non-digits, so {@code 2.0beta1} becomes {@code [2, 0, beta, 1]}.
 * Versions are compared segment by segment:</p>
 * <ul>
 *   <li>numeric segments compare numerically</li>
 *   <li>textual segments compare lexically</li>
 *   <li>a numeric segment is greater than a textual segment at the same position</li>
 *   <li>a missing segment is less than any present segment, so {@code 1.0 < 1.0.0}</li>
 * </ul>
 *
 * <p>Equality follows the ordering: {@code 1.0a} and {@code 1.0.a} are equal.
 * {@link #toString()} always returns the original text.</p>
 */
public final class Version implements Comparable<Version> {

    private final String text;
    private final List<Segment> segments;

    private Version(String text, List<Segment> segments) {
        this.text = text;
        this.segments = segments;
    }

    /**
     * Parses a version string.
     *
     * @param text the version text
     * @return the parsed version
     * @throws MalformedVersionException if the text is empty, contains whitespace or an empty component
     */
    public static Version parse(String text) throws MalformedVersionException {
        if (text == null || text.isEmpty()) {
            throw new MalformedVersionException(text, "Version cannot be null or empty");
        }

        List<Segment> segments = new ArrayList<>();
        for (String component : text.split("\\.", -1)) {
            if (component.isEmpty()) {
                throw new MalformedVersionException(text,
                        "Invalid version '" + text + "': empty component between dots");
            }
            splitRuns(text, component, segments);
        }
        return new Version(text, Collections.unmodifiableList(segments));
    }

    private static void splitRuns(String text, String component, List<Segment> segments)
            throws MalformedVersionException {
        int start = 0;
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (Character.isWhitespace(c)) {
                throw new MalformedVersionException(text,
                        "Invalid version '" + text + "': whitespace is not allowed");
            }
            if (i > start && isDigit(c) != isDigit(component.charAt(i - 1))) {
                segments.add(Segment.of(component.substring(start, i)));
                start = i;
            }
        }
        segments.add(Segment.of(component.substring(start)));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /**
     * Returns the number of segments.
     */
    public int getSegmentCount() {
        return segments.size();
    }

    @Override
    public int compareTo(Version other) {
        int length = Math.max(segments.size(), other.segments.size());
        for (int i = 0; i < length; i++) {
            Segment mine = i < segments.size() ? segments.get(i) : null;
            Segment theirs = i < other.segments.size() ? other.segments.get(i) : null;
            int result = Segment.compare(mine, theirs);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    public boolean isNewerThan(Version other) {
        return compareTo(other) > 0;
    }

    public boolean isOlderThan(Version other) {
        return compareTo(other) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return compareTo((Version) o) == 0;
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

    /**
     * One numeric or textual run of a version. A null segment stands for the padding sentinel.
     */
    private record Segment(BigInteger number, String label) {

        static Segment of(String run) {
            return isDigit(run.charAt(0))
                    ? new Segment(new BigInteger(run), null)
                    : new Segment(null, run);
        }

        boolean isNumeric() {
            return number != null;
        }

        static int compare(Segment a, Segment b) {
            if (a == null || b == null) {
                return a == null ? (b == null ? 0 : -1) : 1;
            }
            if (a.isNumeric() && b.isNumeric()) {
                return a.number.compareTo(b.number);
            }
            if (a.isNumeric() != b.isNumeric()) {
                return a.isNumeric() ? 1 : -1;
            }
            return a.label.compareTo(b.label);
        }
    }
}
