package net.osslabz.wamp;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;


/**
 * Immutable, validated WAMP URI such as {@code com.example.error.bad_argument}.
 * <p>
 * URIs are compared by their string value and are used as keys for error, procedure and topic lookups.
 */
public final class Uri implements Comparable<Uri>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern LOOSE = Pattern.compile("^([^\\s.#]+\\.)*([^\\s.#]+)$");

    private static final Pattern LOOSE_EMPTY_SEGMENTS = Pattern.compile("^(([^\\s.#]+\\.)|\\.)*([^\\s.#]+)?$");

    private final String value;


    private Uri(String value) {

        this.value = value;
    }


    /**
     * Validates {@code raw} as a concrete URI. Every segment must be non-empty.
     *
     * @throws IllegalArgumentException if {@code raw} is null or not a valid URI
     */
    public static Uri of(String raw) {

        if (raw == null || raw.isEmpty() || !LOOSE.matcher(raw).matches()) {
            throw new IllegalArgumentException("invalid uri: '%s'".formatted(raw));
        }
        return new Uri(raw);
    }


    /**
     * Validates {@code raw} as a registration pattern. Empty segments are allowed and act as wildcards
     * under {@link MatchPolicy#WILDCARD}.
     */
    public static Uri ofPattern(String raw) {

        if (raw == null || raw.isEmpty() || !LOOSE_EMPTY_SEGMENTS.matcher(raw).matches()) {
            throw new IllegalArgumentException("invalid uri pattern: '%s'".formatted(raw));
        }
        return new Uri(raw);
    }


    public List<String> segments() {

        return Arrays.asList(this.value.split("\\.", -1));
    }


    public boolean startsWith(Uri prefix) {

        return this.value.startsWith(prefix.value);
    }


    public int length() {

        return this.value.length();
    }


    @Override
    public int compareTo(Uri o) {

        return this.value.compareTo(o.value);
    }


    @Override
    public boolean equals(Object o) {

        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Uri that = (Uri) o;
        return Objects.equals(value, that.value);
    }


    @Override
    public int hashCode() {

        return value.hashCode();
    }


    @Override
    public String toString() {

        return value;
    }
}
