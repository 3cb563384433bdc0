package net.osslabz.wamp;

/**
 * How a registered URI is matched against a concrete URI in a {@link UriMap}.
 */
public enum MatchPolicy {

    /** The concrete URI must equal the registered one. */
    EXACT("exact"),

    /** The registered URI is a string prefix of the concrete one. The longest prefix wins. */
    PREFIX("prefix"),

    /** Empty segments of the registered URI match any single segment of the concrete one. */
    WILDCARD("wildcard");

    private final String value;


    MatchPolicy(String value) {

        this.value = value;
    }


    public String getValue() {

        return value;
    }
}
