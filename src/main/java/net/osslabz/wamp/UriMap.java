package net.osslabz.wamp;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Maps URIs to values.
 * <p>
 * Registrations default to {@link MatchPolicy#EXACT}. Prefix and wildcard registrations have to be requested
 * explicitly and are only consulted after the exact lookup missed, in that order:
 * <ol>
 *     <li>exact match</li>
 *     <li>longest prefix match</li>
 *     <li>most specific wildcard match, comparing segments left to right where a concrete segment beats an empty
 *     one</li>
 * </ol>
 * Registering a value for a (policy, uri) pair that is already present replaces the previous value.
 * <p>
 * Instances are safe for concurrent registration and lookup. A lookup sees every registration that completed
 * before it started.
 *
 * @param <V> value type
 */
public class UriMap<V> {

    private static final Logger log = LoggerFactory.getLogger(UriMap.class);

    private final Map<Uri, V> exact = new ConcurrentHashMap<>();

    private final Map<Uri, V> prefix = new ConcurrentHashMap<>();

    private final Map<Uri, V> wildcard = new ConcurrentHashMap<>();


    /**
     * Registers {@code value} under {@code uri} for exact matching.
     *
     * @return the value previously registered under the same uri, or null
     */
    public V register(Uri uri, V value) {

        return register(uri, MatchPolicy.EXACT, value);
    }


    public V register(Uri uri, MatchPolicy policy, V value) {

        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(value, "value");

        V previous = tableFor(policy).put(uri, value);
        if (previous != null) {
            log.debug("Replaced {} registration for '{}'.", policy.getValue(), uri);
        } else {
            log.debug("Registered '{}' with {} matching.", uri, policy.getValue());
        }
        return previous;
    }


    public V remove(Uri uri, MatchPolicy policy) {

        return tableFor(policy).remove(uri);
    }


    /**
     * Resolves the value applicable to {@code uri}.
     *
     * @throws UriNotFoundException if no registration applies
     */
    public V resolve(Uri uri) {

        return find(uri).orElseThrow(() -> new UriNotFoundException(uri));
    }


    public Optional<V> find(Uri uri) {

        Objects.requireNonNull(uri, "uri");

        V value = this.exact.get(uri);
        if (value != null) {
            return Optional.of(value);
        }

        Optional<V> prefixMatch = findPrefix(uri);
        if (prefixMatch.isPresent()) {
            return prefixMatch;
        }

        return findWildcard(uri);
    }


    public int size() {

        return this.exact.size() + this.prefix.size() + this.wildcard.size();
    }


    public boolean isEmpty() {

        return size() == 0;
    }


    private Optional<V> findPrefix(Uri uri) {

        Uri best = null;
        V bestValue = null;
        for (Map.Entry<Uri, V> entry : this.prefix.entrySet()) {
            Uri candidate = entry.getKey();
            if (uri.startsWith(candidate) && (best == null || candidate.length() > best.length())) {
                best = candidate;
                bestValue = entry.getValue();
            }
        }
        return Optional.ofNullable(bestValue);
    }


    private Optional<V> findWildcard(Uri uri) {

        List<String> segments = uri.segments();

        List<String> best = null;
        V bestValue = null;
        for (Map.Entry<Uri, V> entry : this.wildcard.entrySet()) {
            List<String> candidate = entry.getKey().segments();
            if (!matchesWildcard(candidate, segments)) {
                continue;
            }
            if (best == null || isMoreSpecific(candidate, best)) {
                best = candidate;
                bestValue = entry.getValue();
            }
        }
        return Optional.ofNullable(bestValue);
    }


    private static boolean matchesWildcard(List<String> pattern, List<String> segments) {

        if (pattern.size() != segments.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            String expected = pattern.get(i);
            if (!expected.isEmpty() && !expected.equals(segments.get(i))) {
                return false;
            }
        }
        return true;
    }


    private static boolean isMoreSpecific(List<String> candidate, List<String> current) {

        for (int i = 0; i < candidate.size(); i++) {
            boolean candidateConcrete = !candidate.get(i).isEmpty();
            boolean currentConcrete = !current.get(i).isEmpty();
            if (candidateConcrete != currentConcrete) {
                return candidateConcrete;
            }
        }
        return false;
    }


    private Map<Uri, V> tableFor(MatchPolicy policy) {

        return switch (policy) {
            case EXACT -> this.exact;
            case PREFIX -> this.prefix;
            case WILDCARD -> this.wildcard;
        };
    }
}
