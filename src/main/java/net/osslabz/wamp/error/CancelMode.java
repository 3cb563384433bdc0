package net.osslabz.wamp.error;

import java.util.Arrays;
import java.util.Optional;


/**
 * How aggressively an in-flight call should be canceled.
 */
public enum CancelMode {

    SKIP("skip"),

    KILL("kill"),

    KILL_NO_WAIT("killnowait");

    private final String value;


    CancelMode(String value) {

        this.value = value;
    }


    public String getValue() {

        return value;
    }


    public static Optional<CancelMode> fromValue(String value) {

        return Arrays.stream(values()).filter(m -> m.value.equals(value)).findFirst();
    }
}
