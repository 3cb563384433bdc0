package net.osslabz.wamp.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * The caller asked to cancel an in-flight invocation.
 * <p>
 * Delivered to the invocation handler, which decides whether to cooperate. It is never reported back as the
 * result of the call.
 */
public class InterruptException extends WampException {

    public static final String MODE = "mode";

    private final transient Map<String, Object> options;


    public InterruptException(Map<String, ?> options) {

        super("interrupt requested (options = %s)".formatted(options));
        this.options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }


    public Map<String, Object> getOptions() {

        return options;
    }


    /**
     * @throws InvalidMessageException if the options carry no mode, or one this client does not know
     */
    public CancelMode getCancelMode() {

        Object mode = this.options.get(MODE);
        if (mode == null) {
            throw new InvalidMessageException("interrupt carries no cancel mode");
        }
        if (mode instanceof CancelMode cancelMode) {
            return cancelMode;
        }
        return CancelMode.fromValue(mode.toString())
            .orElseThrow(() -> new InvalidMessageException("unknown cancel mode '%s'".formatted(mode)));
    }


    @Override
    public String toString() {

        return "%s(options=%s)".formatted(getClass().getSimpleName(), options);
    }
}
